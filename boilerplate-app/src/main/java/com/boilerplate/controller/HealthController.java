package com.boilerplate.controller;

import com.boilerplate.model.HealthStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;

@RestController
public class HealthController {

    @GetMapping("/health")
    public HealthStatus health() {
        return HealthStatus.healthy(Instant.now());
    }
}
