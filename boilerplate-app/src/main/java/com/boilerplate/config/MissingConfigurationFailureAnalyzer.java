package com.boilerplate.config;

import org.springframework.boot.diagnostics.AbstractFailureAnalyzer;
import org.springframework.boot.diagnostics.FailureAnalysis;

/**
 * Prints missing database variables in the "APPLICATION FAILED TO START" report
 * instead of a bean creation stack trace.
 */
public class MissingConfigurationFailureAnalyzer extends AbstractFailureAnalyzer<MissingConfigurationException> {

    @Override
    protected FailureAnalysis analyze(Throwable rootFailure, MissingConfigurationException cause) {
        String description = cause.getMessage();
        String action = "Set " + String.join(", ", cause.getMissingVariables())
            + " as environment variables or in a .env file in the working directory.";
        return new FailureAnalysis(description, action, cause);
    }
}
