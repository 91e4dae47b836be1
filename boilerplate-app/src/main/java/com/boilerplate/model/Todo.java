package com.boilerplate.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Todo item as published by the placeholder API.
 * Upstream records are passed through as-is, so a missing title stays null;
 * the NOT NULL constraint applies only to the persisted todos table.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Todo(
    int id,
    int userId,
    String title,
    boolean completed
) {
    @Override
    public String toString() {
        return "Todo #" + id + ": " + title + " (User: " + userId + ") - "
            + (completed ? "Completed" : "Pending");
    }
}
