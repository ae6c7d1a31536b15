package com.iksanov.coherentcache.population.jdbc;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * SQL text with positional parameters, bound in order to the {@code ?} placeholders.
 */
public record SqlStatement(String sql, List<Object> parameters) {

    public SqlStatement {
        Objects.requireNonNull(sql, "sql");
        if (sql.isBlank()) throw new IllegalArgumentException("sql must not be blank");
        parameters = parameters == null ? List.of() : Collections.unmodifiableList(Arrays.asList(parameters.toArray()));
    }

    public static SqlStatement of(String sql, Object... parameters) {
        return new SqlStatement(sql, Arrays.asList(parameters));
    }

    @Override
    public String toString() {
        return sql + " " + parameters;
    }
}
