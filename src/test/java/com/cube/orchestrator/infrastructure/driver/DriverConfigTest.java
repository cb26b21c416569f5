package com.cube.orchestrator.infrastructure.driver;

import com.cube.orchestrator.domain.exception.DriverConfigException;
import com.cube.orchestrator.domain.exception.ErrorKind;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class DriverConfigTest {

    @Test
    void testFrom_ValidJdbcConfig() {
        DriverConfig config = DriverConfig.from("default", Map.of(
                "url", "jdbc:postgresql://db:5432/analytics",
                "username", "cube",
                "password", "secret",
                "maxPoolSize", "20"));

        assertEquals("jdbc", config.getType());
        assertEquals("cube", config.getUsername());
        assertEquals(20, config.getMaxPoolSize());
        assertFalse(config.toString().contains("secret"));
    }

    @Test
    void testFrom_RejectsMalformedConfig() {
        DriverConfigException empty = assertThrows(DriverConfigException.class, () -> DriverConfig.from("default", null));
        assertEquals(ErrorKind.DRIVER_CONFIG_ERROR, empty.getKind());

        assertThrows(DriverConfigException.class, () -> DriverConfig.from("default", Map.of("type", "jdbc")));
        assertThrows(DriverConfigException.class, () -> DriverConfig.from("default", Map.of("type", "mongo", "url", "x")));
        assertThrows(DriverConfigException.class, () -> DriverConfig.from("default", Map.of("url", 42)));
        assertThrows(DriverConfigException.class, () -> DriverConfig.from("default", Map.of("url", "jdbc:h2:mem:x", "maxPoolSize", "many")));
        assertThrows(DriverConfigException.class, () -> DriverConfig.from("default", Map.of("url", "jdbc:h2:mem:x", "maxPoolSize", 0)));
    }

    @Test
    void testPoolSize_AtLeastTwiceTotalConcurrency() {
        Map<String, Object> raw = new HashMap<>();
        raw.put("url", "jdbc:h2:mem:x");

        assertEquals(8, DriverConfig.from("default", raw).poolSize(4));

        raw.put("maxPoolSize", 4);
        assertEquals(8, DriverConfig.from("default", raw).poolSize(4));

        raw.put("maxPoolSize", 32);
        assertEquals(32, DriverConfig.from("default", raw).poolSize(4));
    }
}
