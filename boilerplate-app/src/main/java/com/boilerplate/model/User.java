package com.boilerplate.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * User profile as published by the placeholder API.
 * Address, phone and company details are dropped on read.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record User(
    int id,
    String name,
    String username,
    String email
) {}
