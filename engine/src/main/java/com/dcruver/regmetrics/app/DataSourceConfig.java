package com.dcruver.regmetrics.app;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.datasource.DriverManagerDataSource;

import javax.sql.DataSource;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * SQLite data source for historical metrics.
 */
@Configuration
public class DataSourceConfig {

    @Bean
    public DataSource dataSource(@Value("${regmetrics.history.metrics-db}") String metricsDb) throws Exception {
        Path dbPath = Path.of(metricsDb).toAbsolutePath();
        if (dbPath.getParent() != null) {
            Files.createDirectories(dbPath.getParent());
        }

        DriverManagerDataSource dataSource = new DriverManagerDataSource();
        dataSource.setDriverClassName("org.sqlite.JDBC");
        dataSource.setUrl("jdbc:sqlite:" + dbPath);

        return dataSource;
    }
}
