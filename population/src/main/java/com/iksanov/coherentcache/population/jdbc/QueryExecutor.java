package com.iksanov.coherentcache.population.jdbc;

import java.util.List;

/**
 * Access to the source of truth.
 * <p>
 * {@link #update(SqlStatement)} returns only after the change is committed.
 * Failures raise {@link com.iksanov.coherentcache.common.exception.StorageAccessException}.
 */
public interface QueryExecutor {

    <T> List<T> query(SqlStatement statement, RowMapper<T> mapper);

    int update(SqlStatement statement);
}
