package com.boilerplate.config;

import org.springframework.boot.jdbc.DataSourceBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.ConfigurableEnvironment;

import javax.sql.DataSource;

@Configuration
public class DatabaseConfig {

    @Bean
    public DatabaseSettings databaseSettings(ConfigurableEnvironment environment, DatabaseProperties properties) {
        return DatabaseSettingsLoader.load(environment, properties.getUrlTemplate());
    }

    @Bean
    public DataSource dataSource(DatabaseSettings settings) {
        return DataSourceBuilder.create()
            .url(settings.jdbcUrl())
            .username(settings.user())
            .password(settings.password())
            .build();
    }
}
