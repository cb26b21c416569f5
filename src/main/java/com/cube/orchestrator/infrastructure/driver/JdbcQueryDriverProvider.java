package com.cube.orchestrator.infrastructure.driver;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;

import java.time.Duration;

/**
 * Opens pooled JDBC connections (HikariCP) for a data source.
 */
@Slf4j
public class JdbcQueryDriverProvider implements QueryDriverProvider {

    private final Duration queryTimeout;

    public JdbcQueryDriverProvider(Duration queryTimeout) {
        this.queryTimeout = queryTimeout;
    }

    @Override
    public QueryDriver open(DriverConfig config, int poolSize) {
        HikariConfig hikari = new HikariConfig();
        hikari.setPoolName("cube-" + config.getDataSource());
        hikari.setJdbcUrl(config.getUrl());
        hikari.setUsername(config.getUsername());
        hikari.setPassword(config.getPassword());
        if (config.getDriverClassName() != null) {
            hikari.setDriverClassName(config.getDriverClassName());
        }
        hikari.setMaximumPoolSize(poolSize);

        HikariDataSource dataSource = new HikariDataSource(hikari);
        JdbcTemplate jdbcTemplate = new JdbcTemplate(dataSource);
        jdbcTemplate.setQueryTimeout((int) queryTimeout.toSeconds());

        log.info("Opened data source '{}' (pool size {})", config.getDataSource(), poolSize);
        return new JdbcQueryDriver(jdbcTemplate, dataSource::close);
    }
}
