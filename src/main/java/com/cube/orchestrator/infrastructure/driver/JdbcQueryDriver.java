package com.cube.orchestrator.infrastructure.driver;

import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.ConnectionCallback;
import org.springframework.jdbc.core.JdbcTemplate;

import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * {@link QueryDriver} on top of Spring's {@link JdbcTemplate}.
 */
@Slf4j
public class JdbcQueryDriver implements QueryDriver {

    private final JdbcTemplate jdbcTemplate;
    private final Runnable onClose;

    public JdbcQueryDriver(JdbcTemplate jdbcTemplate, Runnable onClose) {
        this.jdbcTemplate = jdbcTemplate;
        this.onClose = onClose;
    }

    @Override
    public List<Map<String, Object>> query(String sql, List<Object> params) {
        return jdbcTemplate.queryForList(sql, bind(params));
    }

    @Override
    public void createSchemaIfNotExists(String schema) {
        jdbcTemplate.execute("CREATE SCHEMA IF NOT EXISTS " + schema);
    }

    @Override
    public void createTableAs(String qualifiedTableName, String sql, List<Object> params) {
        log.debug("Creating table {}", qualifiedTableName);
        jdbcTemplate.update("CREATE TABLE " + qualifiedTableName + " AS " + sql, bind(params));
    }

    @Override
    public void dropTable(String qualifiedTableName) {
        log.debug("Dropping table {}", qualifiedTableName);
        jdbcTemplate.execute("DROP TABLE IF EXISTS " + qualifiedTableName);
    }

    @Override
    public List<String> listTables(String schema) {
        return jdbcTemplate.execute((ConnectionCallback<List<String>>) connection -> {
            DatabaseMetaData metaData = connection.getMetaData();
            // unquoted identifiers are stored folded by databases like H2 and Oracle
            String schemaPattern = metaData.storesUpperCaseIdentifiers() ? schema.toUpperCase(Locale.ROOT) : schema;
            List<String> tables = new ArrayList<>();
            try (ResultSet rs = metaData.getTables(null, schemaPattern, "%", new String[]{"TABLE"})) {
                while (rs.next()) {
                    tables.add(rs.getString("TABLE_NAME"));
                }
            }
            return tables;
        });
    }

    @Override
    public void close() {
        onClose.run();
    }

    static Object[] bind(List<Object> params) {
        if (params == null) {
            return new Object[0];
        }
        Object[] bound = new Object[params.size()];
        for (int i = 0; i < bound.length; i++) {
            Object param = params.get(i);
            bound[i] = param instanceof Instant ? Timestamp.from((Instant) param) : param;
        }
        return bound;
    }
}
