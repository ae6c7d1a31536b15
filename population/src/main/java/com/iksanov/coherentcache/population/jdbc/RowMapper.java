package com.iksanov.coherentcache.population.jdbc;

import java.sql.ResultSet;
import java.sql.SQLException;

@FunctionalInterface
public interface RowMapper<T> {

    /** Maps the current row. Must not advance the result set. */
    T map(ResultSet rs) throws SQLException;
}
