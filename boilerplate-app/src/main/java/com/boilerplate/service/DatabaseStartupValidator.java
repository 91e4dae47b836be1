package com.boilerplate.service;

import com.boilerplate.config.DatabaseProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.stereotype.Component;

/**
 * Runs the database check once all singletons exist and before the web server
 * starts, so a failure aborts startup instead of serving traffic.
 */
@Component
public class DatabaseStartupValidator implements SmartInitializingSingleton {

    private static final Logger log = LoggerFactory.getLogger(DatabaseStartupValidator.class);

    private final DatabaseInitializationService databaseInitializationService;
    private final DatabaseProperties databaseProperties;

    public DatabaseStartupValidator(DatabaseInitializationService databaseInitializationService,
                                    DatabaseProperties databaseProperties) {
        this.databaseInitializationService = databaseInitializationService;
        this.databaseProperties = databaseProperties;
    }

    @Override
    public void afterSingletonsInstantiated() {
        try {
            if (databaseProperties.isCreateSchema()) {
                databaseInitializationService.ensureSchema();
            }
            databaseInitializationService.initialize();
        } catch (RuntimeException e) {
            log.error("An error occurred while initializing the database.", e);
            throw e;
        }
    }
}
