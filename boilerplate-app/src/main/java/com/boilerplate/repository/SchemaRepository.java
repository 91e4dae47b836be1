package com.boilerplate.repository;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public class SchemaRepository {

    private final JdbcTemplate jdbc;

    public SchemaRepository(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    /**
     * List the tables of a schema from the metadata catalog.
     * A schema that does not exist yields an empty list.
     */
    public List<String> findTableNames(String schema) {
        return jdbc.queryForList("""
            SELECT table_name
            FROM information_schema.tables
            WHERE table_schema = ?
            ORDER BY table_name
            """,
            String.class,
            schema
        );
    }

    /**
     * Create the schema and the todos/users tables when they are absent.
     * Existing objects are left untouched.
     */
    public void createSchemaIfMissing(String schema) {
        String qualified = quote(schema);

        jdbc.execute("CREATE SCHEMA IF NOT EXISTS " + qualified);

        jdbc.execute("""
            CREATE TABLE IF NOT EXISTS %s.todos (
                id INTEGER PRIMARY KEY,
                user_id INTEGER NOT NULL,
                title VARCHAR(255) NOT NULL,
                completed BOOLEAN NOT NULL
            )
            """.formatted(qualified));

        jdbc.execute("""
            CREATE TABLE IF NOT EXISTS %s.users (
                id INTEGER PRIMARY KEY,
                name VARCHAR(255),
                username VARCHAR(255),
                email VARCHAR(255)
            )
            """.formatted(qualified));
    }

    static String quote(String identifier) {
        return "\"" + identifier.replace("\"", "\"\"") + "\"";
    }
}
