package com.jwsphere.querystream;

import com.google.common.collect.ImmutableList;

import javax.annotation.Nullable;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * An immutable description of a query handed to a {@link QueryEngine}.
 */
public final class QueryRequest {

    public static final int UNLIMITED = -1;

    private final String query;
    private final int limit;

    @Nullable
    private final String fetchPlan;

    private final ImmutableList<Object> arguments;

    private QueryRequest(String query, int limit, @Nullable String fetchPlan, ImmutableList<Object> arguments) {
        this.query = Objects.requireNonNull(query, "Query text must be non-null.");
        this.limit = limit;
        this.fetchPlan = fetchPlan;
        this.arguments = arguments;
    }

    public static QueryRequest of(String query) {
        return new QueryRequest(query, UNLIMITED, null, ImmutableList.of());
    }

    public QueryRequest withLimit(int limit) {
        if (limit <= 0 && limit != UNLIMITED) {
            throw new IllegalArgumentException("Limit must be strictly positive or UNLIMITED.");
        }
        return new QueryRequest(query, limit, fetchPlan, arguments);
    }

    public QueryRequest withFetchPlan(String fetchPlan) {
        return new QueryRequest(query, limit, Objects.requireNonNull(fetchPlan), arguments);
    }

    /**
     * Replaces the positional arguments bound to the query.  Arguments must be non-null.
     */
    public QueryRequest withArguments(List<?> arguments) {
        return new QueryRequest(query, limit, fetchPlan, ImmutableList.copyOf(arguments));
    }

    public String getQuery() {
        return query;
    }

    public int getLimit() {
        return limit;
    }

    public boolean isLimited() {
        return limit != UNLIMITED;
    }

    public Optional<String> getFetchPlan() {
        return Optional.ofNullable(fetchPlan);
    }

    public List<Object> getArguments() {
        return arguments;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        QueryRequest that = (QueryRequest) o;
        return limit == that.limit &&
                query.equals(that.query) &&
                Objects.equals(fetchPlan, that.fetchPlan) &&
                arguments.equals(that.arguments);
    }

    @Override
    public int hashCode() {
        return Objects.hash(query, limit, fetchPlan, arguments);
    }

    @Override
    public String toString() {
        return "QueryRequest{" +
                "query='" + query + '\'' +
                ", limit=" + limit +
                ", fetchPlan=" + fetchPlan +
                ", arguments=" + arguments +
                '}';
    }

}
