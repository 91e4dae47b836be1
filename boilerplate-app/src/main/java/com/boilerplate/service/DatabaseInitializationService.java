package com.boilerplate.service;

import com.boilerplate.config.DatabaseSettings;
import com.boilerplate.repository.SchemaRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Verifies the database connection and logs the tables of the configured schema.
 */
@Service
public class DatabaseInitializationService {

    private static final Logger log = LoggerFactory.getLogger(DatabaseInitializationService.class);

    private final SchemaRepository schemaRepository;
    private final DatabaseSettings settings;

    public DatabaseInitializationService(SchemaRepository schemaRepository, DatabaseSettings settings) {
        this.schemaRepository = schemaRepository;
        this.settings = settings;
    }

    /**
     * Create the configured schema and its tables if they do not exist yet.
     */
    public void ensureSchema() {
        schemaRepository.createSchemaIfMissing(settings.schema());
        log.info("Ensured schema '{}' and its tables exist", settings.schema());
    }

    /**
     * Run the diagnostic table listing against the configured schema.
     *
     * @return table names in the schema, empty if the schema has none or does not exist
     * @throws DataAccessException if the database cannot be reached or the query fails
     */
    public List<String> initialize() {
        try {
            List<String> tableNames = schemaRepository.findTableNames(settings.schema());

            log.info("Connected to database successfully!");
            log.info("Available tables in schema '{}':", settings.schema());
            for (String tableName : tableNames) {
                log.info("- {}", tableName);
            }
            if (tableNames.isEmpty()) {
                log.warn("Schema '{}' has no tables or does not exist", settings.schema());
            }
            return tableNames;
        } catch (DataAccessException e) {
            log.error("Error while connecting to database", e);
            throw e;
        }
    }
}
