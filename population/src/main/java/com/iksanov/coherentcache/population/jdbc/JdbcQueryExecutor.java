package com.iksanov.coherentcache.population.jdbc;

import com.iksanov.coherentcache.common.exception.StorageAccessException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.*;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * {@link QueryExecutor} over a pooled {@link DataSource}. Each call borrows one connection;
 * updates run in auto-commit mode, so they are committed when {@link #update} returns.
 */
public class JdbcQueryExecutor implements QueryExecutor {

    private static final Logger log = LoggerFactory.getLogger(JdbcQueryExecutor.class);
    private final DataSource ds;

    public JdbcQueryExecutor(DataSource ds) {
        this.ds = Objects.requireNonNull(ds, "ds");
    }

    @Override
    public <T> List<T> query(SqlStatement statement, RowMapper<T> mapper) {
        try (Connection c = ds.getConnection(); PreparedStatement ps = c.prepareStatement(statement.sql())) {
            bind(ps, statement.parameters());
            try (ResultSet rs = ps.executeQuery()) {
                List<T> rows = new ArrayList<>();
                while (rs.next()) rows.add(mapper.map(rs));
                log.debug("Query returned {} rows: {}", rows.size(), statement.sql());
                return rows;
            }
        } catch (SQLException e) {
            throw new StorageAccessException("Query failed: " + statement.sql(), e);
        }
    }

    @Override
    public int update(SqlStatement statement) {
        try (Connection c = ds.getConnection(); PreparedStatement ps = c.prepareStatement(statement.sql())) {
            bind(ps, statement.parameters());
            int updated = ps.executeUpdate();
            if (!c.getAutoCommit()) c.commit();
            log.debug("Update affected {} rows: {}", updated, statement.sql());
            return updated;
        } catch (SQLException e) {
            throw new StorageAccessException("Update failed: " + statement.sql(), e);
        }
    }

    private static void bind(PreparedStatement ps, List<Object> parameters) throws SQLException {
        for (int i = 0; i < parameters.size(); i++) {
            Object value = parameters.get(i);
            if (value == null) ps.setNull(i + 1, Types.NULL);
            else ps.setObject(i + 1, value);
        }
    }
}
