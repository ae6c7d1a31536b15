package com.iksanov.coherentcache.population.config;

import com.iksanov.coherentcache.common.exception.ConfigurationException;

import java.util.Map;

public record PopulationConfig(
        String jdbcUrl,
        String user,
        String password,
        int poolSize
) {
    public PopulationConfig {
        if (jdbcUrl == null || !jdbcUrl.startsWith("jdbc:"))
            throw new ConfigurationException("JDBC url must start with 'jdbc:': " + jdbcUrl);
        if (poolSize <= 0) throw new ConfigurationException("Pool size must be > 0");
    }

    public static PopulationConfig defaults() {
        return new PopulationConfig("jdbc:postgresql://localhost:5432/app", "app", "", 10);
    }

    public static PopulationConfig fromEnv() {
        return fromEnv(System.getenv());
    }

    public static PopulationConfig fromEnv(Map<String, String> env) {
        PopulationConfig d = defaults();
        return new PopulationConfig(
                getEnv(env, "POPULATION_JDBC_URL", d.jdbcUrl()),
                getEnv(env, "POPULATION_JDBC_USER", d.user()),
                getEnv(env, "POPULATION_JDBC_PASSWORD", d.password()),
                getEnvInt(env, "POPULATION_JDBC_POOL_SIZE", d.poolSize())
        );
    }

    @Override
    public String toString() {
        return String.format("PopulationConfig[url=%s, user=%s, password=***, pool=%d]", jdbcUrl, user, poolSize);
    }

    private static String getEnv(Map<String, String> env, String key, String def) {
        String v = env.get(key);
        return v == null || v.isBlank() ? def : v;
    }

    private static int getEnvInt(Map<String, String> env, String key, int def) {
        String v = env.get(key);
        if (v == null || v.isBlank()) return def;
        try {
            return Integer.parseInt(v.trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Invalid integer for " + key + ": " + v, e);
        }
    }
}
