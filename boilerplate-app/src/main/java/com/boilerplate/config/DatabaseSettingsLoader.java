package com.boilerplate.config;

import org.springframework.core.env.ConfigurableEnvironment;
import org.springframework.core.env.PropertySource;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads the database environment variables and derives the JDBC URL.
 * Every missing variable is reported, not just the first one.
 */
public final class DatabaseSettingsLoader {

    public static final String DB_HOST = "DB_HOST";
    public static final String DB_PORT = "DB_PORT";
    public static final String DB_NAME = "DB_NAME";
    public static final String DB_USER = "DB_USER";
    public static final String DB_PASSWORD = "DB_PASSWORD";
    public static final String DB_SCHEMA = "DB_SCHEMA";

    public static final List<String> REQUIRED_VARIABLES =
        List.of(DB_HOST, DB_PORT, DB_NAME, DB_USER, DB_PASSWORD, DB_SCHEMA);

    private DatabaseSettingsLoader() {
    }

    /**
     * Resolve all required variables and build the settings.
     *
     * @param environment source of the variables; values are read raw, without placeholder resolution
     * @param urlTemplate JDBC URL with {host}, {port}, {name} and {schema} placeholders
     * @return the validated settings
     * @throws MissingConfigurationException if any variable is absent or blank
     */
    public static DatabaseSettings load(ConfigurableEnvironment environment, String urlTemplate) {
        Map<String, String> values = new LinkedHashMap<>();
        List<String> missing = new ArrayList<>();

        for (String variable : REQUIRED_VARIABLES) {
            String value = rawProperty(environment, variable);
            if (!StringUtils.hasText(value)) {
                missing.add(variable);
            } else {
                values.put(variable, value.trim());
            }
        }

        if (!missing.isEmpty()) {
            throw new MissingConfigurationException(missing);
        }

        return new DatabaseSettings(
            values.get(DB_HOST),
            values.get(DB_PORT),
            values.get(DB_NAME),
            values.get(DB_USER),
            values.get(DB_PASSWORD),
            values.get(DB_SCHEMA),
            buildJdbcUrl(urlTemplate, values)
        );
    }

    // Credentials may legitimately contain "${", so placeholders are not expanded
    static String rawProperty(ConfigurableEnvironment environment, String name) {
        for (PropertySource<?> source : environment.getPropertySources()) {
            Object value = source.getProperty(name);
            if (value != null) {
                return value.toString();
            }
        }
        return null;
    }

    static String buildJdbcUrl(String urlTemplate, Map<String, String> values) {
        if (!StringUtils.hasText(urlTemplate)) {
            throw new IllegalArgumentException("Database URL template must not be empty");
        }
        return urlTemplate
            .replace("{host}", values.get(DB_HOST))
            .replace("{port}", values.get(DB_PORT))
            .replace("{name}", values.get(DB_NAME))
            .replace("{schema}", values.get(DB_SCHEMA));
    }
}
