package com.boilerplate.controller;

import com.boilerplate.service.PlaceholderApiException;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(PlaceholderApiException.class)
    @ResponseStatus(HttpStatus.BAD_GATEWAY)
    public Map<String, Object> handleUpstreamFailure(PlaceholderApiException e) {
        return Map.of(
                "error", "BAD_GATEWAY",
                "message", e.getMessage()
        );
    }
}
