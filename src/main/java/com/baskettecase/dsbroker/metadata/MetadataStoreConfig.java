package com.baskettecase.dsbroker.metadata;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.jdbc.core.JdbcTemplate;

import javax.sql.DataSource;
import java.util.List;

/**
 * Configuration for the metadata database.
 *
 * Holds data-source and credential records. The store bean exposed to the rest of the
 * application is the filtering one, so every write passes through the registered
 * {@link WriteFilter}s.
 */
@Slf4j
@Configuration
public class MetadataStoreConfig {

    @Value("${spring.datasource.url}")
    private String jdbcUrl;

    @Value("${spring.datasource.username}")
    private String username;

    @Value("${spring.datasource.password}")
    private String password;

    @Bean(name = "metadataDataSource")
    public DataSource metadataDataSource() {
        HikariConfig config = new HikariConfig();
        config.setJdbcUrl(jdbcUrl);
        config.setUsername(username);
        config.setPassword(password);
        config.setPoolName("metadata-pool");

        // Small pool for metadata operations
        config.setMaximumPoolSize(5);
        config.setMinimumIdle(1);
        config.setConnectionTimeout(10000);
        config.setValidationTimeout(5000);

        config.addDataSourceProperty("application_name", "data-source-broker");

        HikariDataSource dataSource = new HikariDataSource(config);
        log.info("Created connection pool for metadata database");
        return dataSource;
    }

    @Bean(name = "metadataJdbcTemplate")
    public JdbcTemplate metadataJdbcTemplate(@Qualifier("metadataDataSource") DataSource metadataDataSource) {
        return new JdbcTemplate(metadataDataSource);
    }

    @Bean
    public JdbcMetadataStore jdbcMetadataStore(
            @Qualifier("metadataJdbcTemplate") JdbcTemplate jdbcTemplate,
            ObjectMapper objectMapper) {
        JdbcMetadataStore store = new JdbcMetadataStore(jdbcTemplate, objectMapper);
        store.initializeTable();
        return store;
    }

    @Bean
    @Primary
    public MetadataStore metadataStore(JdbcMetadataStore jdbcMetadataStore, List<WriteFilter> writeFilters) {
        return new FilteringMetadataStore(jdbcMetadataStore, writeFilters);
    }
}
