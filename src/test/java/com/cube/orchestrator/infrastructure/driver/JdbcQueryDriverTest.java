package com.cube.orchestrator.infrastructure.driver;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.Timestamp;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs the JDBC driver against an in-memory H2 database.
 */
class JdbcQueryDriverTest {

    private QueryDriver driver;

    @BeforeEach
    void setUp() {
        DriverConfig config = DriverConfig.from("default", Map.of(
                "url", "jdbc:h2:mem:" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1",
                "username", "sa",
                "password", ""));
        driver = new JdbcQueryDriverProvider(Duration.ofSeconds(30)).open(config, 2);
        driver.createTableAs("orders", "SELECT 1 AS id, 'paid' AS status UNION ALL SELECT 2, 'open'", List.of());
    }

    @AfterEach
    void tearDown() {
        driver.close();
    }

    @Test
    void testQuery_BindsParameters() {
        List<Map<String, Object>> rows = driver.query("SELECT id FROM orders WHERE status = ?", List.of("paid"));

        assertEquals(1, rows.size());
        assertEquals(1, ((Number) rows.get(0).values().iterator().next()).intValue());
    }

    @Test
    void testCreateListAndDropTables() {
        driver.createSchemaIfNotExists("pre_aggregations");
        driver.createTableAs("pre_aggregations.orders_totals_abcdef12_1700000000",
                "SELECT status, count(*) AS cnt FROM orders GROUP BY status", List.of());

        List<String> tables = driver.listTables("pre_aggregations").stream()
                .map(name -> name.toLowerCase(Locale.ROOT))
                .collect(Collectors.toList());
        assertEquals(List.of("orders_totals_abcdef12_1700000000"), tables);

        driver.dropTable("pre_aggregations.orders_totals_abcdef12_1700000000");
        assertTrue(driver.listTables("pre_aggregations").isEmpty());
    }

    @Test
    void testBind_ConvertsInstants() {
        Instant instant = Instant.parse("2024-03-01T00:00:00Z");

        Object[] bound = JdbcQueryDriver.bind(List.of(instant, "us"));

        assertEquals(Timestamp.from(instant), bound[0]);
        assertEquals("us", bound[1]);
        assertEquals(0, JdbcQueryDriver.bind(null).length);
    }
}
