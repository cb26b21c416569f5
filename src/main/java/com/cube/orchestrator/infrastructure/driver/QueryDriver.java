package com.cube.orchestrator.infrastructure.driver;

import java.util.List;
import java.util.Map;

/**
 * Connection to one data source, owned by an orchestrator instance.
 *
 * The orchestrator never builds SQL beyond wrapping a definition's query in
 * {@code CREATE TABLE ... AS}; everything else is passed through.
 */
public interface QueryDriver extends AutoCloseable {

    List<Map<String, Object>> query(String sql, List<Object> params);

    void createSchemaIfNotExists(String schema);

    void createTableAs(String qualifiedTableName, String sql, List<Object> params);

    void dropTable(String qualifiedTableName);

    List<String> listTables(String schema);

    @Override
    void close();
}
