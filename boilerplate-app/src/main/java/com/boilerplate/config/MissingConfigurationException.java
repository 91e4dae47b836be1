package com.boilerplate.config;

import java.util.List;

public class MissingConfigurationException extends RuntimeException {

    private final List<String> missingVariables;

    public MissingConfigurationException(List<String> missingVariables) {
        super("Missing required environment variables: " + String.join(", ", missingVariables) + ". "
            + "Please ensure all required environment variables are set in the environment or the .env file.");
        this.missingVariables = List.copyOf(missingVariables);
    }

    public List<String> getMissingVariables() {
        return missingVariables;
    }
}
