package com.iksanov.coherentcache.population.jdbc;

import com.iksanov.coherentcache.population.config.PopulationConfig;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;

public class DataSourceFactory {

    public static HikariDataSource create(PopulationConfig config) {
        return create(config.jdbcUrl(), config.user(), config.password(), config.poolSize());
    }

    public static HikariDataSource create(String jdbcUrl, String user, String pass, int maxPool) {
        HikariConfig cfg = new HikariConfig();
        cfg.setJdbcUrl(jdbcUrl);
        cfg.setUsername(user);
        cfg.setPassword(pass);
        cfg.setMaximumPoolSize(maxPool);
        cfg.setAutoCommit(true);
        cfg.setPoolName("population-ds");
        cfg.addDataSourceProperty("cachePrepStmts", "true");
        return new HikariDataSource(cfg);
    }
}
