package com.tapelibrary.inventory.config;

import org.springframework.boot.jdbc.DataSourceBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;

/**
 * Builds the inventory DataSource from {@link InventoryProperties} instead of
 * {@code spring.datasource.*}, so the required keys are validated before a pool exists.
 */
@Configuration
public class InventoryDataSourceConfig {

    @Bean
    public DataSource inventoryDataSource(InventoryProperties properties) {
        return DataSourceBuilder.create()
            .driverClassName("org.postgresql.Driver")
            .url(properties.jdbcUrl())
            .username(properties.username())
            .password(properties.password())
            .build();
    }
}
