package com.boilerplate.service;

public class PlaceholderApiException extends RuntimeException {

    public PlaceholderApiException(String message, Throwable cause) {
        super(message, cause);
    }
}
