package com.iksanov.coherentcache.population.config;

import com.iksanov.coherentcache.common.exception.ConfigurationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.*;

@DisplayName("PopulationConfig")
class PopulationConfigTest {

    @Test
    @DisplayName("Environment overrides defaults")
    void shouldReadEnvironment() {
        PopulationConfig config = PopulationConfig.fromEnv(Map.of(
                "POPULATION_JDBC_URL", "jdbc:postgresql://db:5432/shop",
                "POPULATION_JDBC_USER", "shop",
                "POPULATION_JDBC_PASSWORD", "secret",
                "POPULATION_JDBC_POOL_SIZE", "4"));

        assertThat(config.jdbcUrl()).isEqualTo("jdbc:postgresql://db:5432/shop");
        assertThat(config.user()).isEqualTo("shop");
        assertThat(config.poolSize()).isEqualTo(4);
        assertThat(config.toString()).doesNotContain("secret");
    }

    @Test
    @DisplayName("Invalid url or pool size is rejected")
    void shouldValidate() {
        assertThatThrownBy(() -> PopulationConfig.fromEnv(Map.of("POPULATION_JDBC_URL", "postgres://db")))
                .isInstanceOf(ConfigurationException.class);
        assertThatThrownBy(() -> PopulationConfig.fromEnv(Map.of("POPULATION_JDBC_POOL_SIZE", "0")))
                .isInstanceOf(ConfigurationException.class);
        assertThatThrownBy(() -> PopulationConfig.fromEnv(Map.of("POPULATION_JDBC_POOL_SIZE", "x")))
                .isInstanceOf(ConfigurationException.class);
    }
}
