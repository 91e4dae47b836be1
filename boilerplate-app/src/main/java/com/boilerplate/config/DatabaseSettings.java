package com.boilerplate.config;

/**
 * Validated database connection settings, built once at startup.
 */
public record DatabaseSettings(
    String host,
    String port,
    String name,
    String user,
    String password,
    String schema,
    String jdbcUrl
) {
    @Override
    public String toString() {
        return "DatabaseSettings[host=" + host + ", port=" + port + ", name=" + name
            + ", user=" + user + ", password=****, schema=" + schema + ", jdbcUrl=" + jdbcUrl + "]";
    }
}
