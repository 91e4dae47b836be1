package com.boilerplate.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Database options that are not secrets.
 * Connection credentials come from the DB_* environment variables instead.
 */
@Configuration
@ConfigurationProperties(prefix = "boilerplate.database")
public class DatabaseProperties {

    private String urlTemplate = "jdbc:postgresql://{host}:{port}/{name}?currentSchema={schema}";

    // Development only: create the schema and tables when absent
    private boolean createSchema = false;

    public String getUrlTemplate() {
        return urlTemplate;
    }

    public void setUrlTemplate(String urlTemplate) {
        this.urlTemplate = urlTemplate;
    }

    public boolean isCreateSchema() {
        return createSchema;
    }

    public void setCreateSchema(boolean createSchema) {
        this.createSchema = createSchema;
    }
}
