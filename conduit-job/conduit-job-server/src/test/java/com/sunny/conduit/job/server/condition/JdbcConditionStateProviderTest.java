package com.sunny.conduit.job.server.condition;

import com.sunny.conduit.job.core.model.Observation;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.BadSqlGrammarException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DriverManagerDataSource;

import java.math.BigDecimal;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JdbcConditionStateProviderTest {

    private JdbcTemplate jdbcTemplate;
    private JdbcConditionStateProvider provider;

    @BeforeEach
    void setUp() {
        DriverManagerDataSource dataSource = new DriverManagerDataSource(
                "jdbc:h2:mem:" + UUID.randomUUID() + ";MODE=MySQL;DB_CLOSE_DELAY=-1", "sa", "");
        jdbcTemplate = new JdbcTemplate(dataSource);
        jdbcTemplate.execute("CREATE TABLE sensor_reading (id BIGINT AUTO_INCREMENT PRIMARY KEY, "
                + "tenant_id VARCHAR(64) NOT NULL, temperature DECIMAL(6,2), state VARCHAR(16))");
        provider = new JdbcConditionStateProvider(jdbcTemplate);
    }

    @Test
    void latest_shouldReturnNewestRowOfTenant() {
        jdbcTemplate.update("INSERT INTO sensor_reading (tenant_id, temperature, state) VALUES (?, ?, ?)",
                "tenant-a", new BigDecimal("20.50"), "idle");
        jdbcTemplate.update("INSERT INTO sensor_reading (tenant_id, temperature, state) VALUES (?, ?, ?)",
                "tenant-a", new BigDecimal("31.00"), "hot");
        jdbcTemplate.update("INSERT INTO sensor_reading (tenant_id, temperature, state) VALUES (?, ?, ?)",
                "tenant-b", new BigDecimal("5.00"), "cold");

        Optional<Observation> state = provider.latest("tenant-a", "sensor_reading", 0);

        assertTrue(state.isPresent());
        assertEquals(2L, state.get().watermark());
        assertEquals("hot", state.get().data().get("state"));
        assertEquals(0, new BigDecimal("31.00").compareTo((BigDecimal) state.get().data().get("temperature")));
    }

    @Test
    void latest_shouldOnlyReturnRowsNewerThanWatermark() {
        jdbcTemplate.update("INSERT INTO sensor_reading (tenant_id, temperature, state) VALUES (?, ?, ?)",
                "tenant-a", new BigDecimal("31.00"), "hot");

        Observation first = provider.latest("tenant-a", "sensor_reading", 0).orElseThrow();
        assertTrue(provider.latest("tenant-a", "sensor_reading", first.watermark()).isEmpty());

        jdbcTemplate.update("INSERT INTO sensor_reading (tenant_id, temperature, state) VALUES (?, ?, ?)",
                "tenant-a", new BigDecimal("32.00"), "hot");
        Observation next = provider.latest("tenant-a", "sensor_reading", first.watermark()).orElseThrow();
        assertEquals(first.watermark() + 1, next.watermark());
    }

    @Test
    void latest_noRowsShouldBeEmpty() {
        assertTrue(provider.latest("tenant-a", "sensor_reading", 0).isEmpty());
    }

    @Test
    void latest_shouldRejectUnsafeSource() {
        assertThrows(IllegalArgumentException.class,
                () -> provider.latest("tenant-a", "sensor_reading; DROP TABLE sensor_reading", 0));
        assertThrows(IllegalArgumentException.class, () -> provider.latest("tenant-a", null, 0));
    }

    @Test
    void latest_missingTableShouldSurfaceAsDataAccessError() {
        assertThrows(BadSqlGrammarException.class, () -> provider.latest("tenant-a", "no_such_table", 0));
    }
}
