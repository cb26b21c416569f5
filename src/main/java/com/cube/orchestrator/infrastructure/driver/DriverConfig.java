package com.cube.orchestrator.infrastructure.driver;

import com.cube.orchestrator.domain.exception.DriverConfigException;
import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Validated output of the driver factory hook.
 *
 * Accepted keys:
 * - type: driver type, only "jdbc" (default)
 * - url: JDBC url (required)
 * - username, password, driverClassName (optional)
 * - maxPoolSize: upper bound requested by the host; raised to twice the queue concurrency if lower
 */
@Value
@Builder
public class DriverConfig {

    public static final String TYPE_JDBC = "jdbc";

    String dataSource;
    String type;
    String url;
    String username;
    String password;
    String driverClassName;
    Integer maxPoolSize;

    public static DriverConfig from(String dataSource, Map<String, Object> config) {
        if (config == null || config.isEmpty()) {
            throw new DriverConfigException("Driver factory returned no configuration for data source '" + dataSource + "'");
        }
        String type = stringValue(dataSource, config, "type");
        if (type == null) {
            type = TYPE_JDBC;
        }
        if (!TYPE_JDBC.equalsIgnoreCase(type)) {
            throw new DriverConfigException("Unsupported driver type '" + type + "' for data source '" + dataSource + "'");
        }
        String url = stringValue(dataSource, config, "url");
        if (url == null || url.isBlank()) {
            throw new DriverConfigException("Driver configuration for data source '" + dataSource + "' has no url");
        }
        return DriverConfig.builder()
                .dataSource(dataSource)
                .type(TYPE_JDBC)
                .url(url)
                .username(stringValue(dataSource, config, "username"))
                .password(stringValue(dataSource, config, "password"))
                .driverClassName(stringValue(dataSource, config, "driverClassName"))
                .maxPoolSize(intValue(dataSource, config, "maxPoolSize"))
                .build();
    }

    /**
     * Pool size for a data source shared by queues running {@code totalConcurrency} items at once.
     */
    public int poolSize(int totalConcurrency) {
        int floor = Math.max(2, totalConcurrency * 2);
        return maxPoolSize != null ? Math.max(maxPoolSize, floor) : floor;
    }

    private static String stringValue(String dataSource, Map<String, Object> config, String key) {
        Object value = config.get(key);
        if (value == null) {
            return null;
        }
        if (!(value instanceof CharSequence)) {
            throw new DriverConfigException("Driver option '" + key + "' of data source '" + dataSource
                    + "' must be a string, got " + value.getClass().getSimpleName());
        }
        return value.toString();
    }

    private static Integer intValue(String dataSource, Map<String, Object> config, String key) {
        Object value = config.get(key);
        if (value == null) {
            return null;
        }
        int parsed;
        if (value instanceof Number) {
            parsed = ((Number) value).intValue();
        } else {
            try {
                parsed = Integer.parseInt(value.toString().trim());
            } catch (NumberFormatException e) {
                throw new DriverConfigException("Driver option '" + key + "' of data source '" + dataSource
                        + "' is not a number: " + value, e);
            }
        }
        if (parsed <= 0) {
            throw new DriverConfigException("Driver option '" + key + "' of data source '" + dataSource
                    + "' must be positive, got " + parsed);
        }
        return parsed;
    }

    @Override
    public String toString() {
        return "DriverConfig(dataSource=" + dataSource + ", type=" + type + ", url=" + url
                + ", username=" + username + ", maxPoolSize=" + maxPoolSize + ")";
    }
}
