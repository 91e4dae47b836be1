package com.boilerplate.controller;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(HealthController.class)
class HealthControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    private Instant fetchTimestamp() throws Exception {
        String body = mockMvc.perform(get("/health"))
            .andExpect(status().isOk())
            .andReturn()
            .getResponse()
            .getContentAsString();
        JsonNode json = objectMapper.readTree(body);
        return Instant.parse(json.get("timestamp").asText());
    }

    @Test
    void reportsHealthyStatus() throws Exception {
        mockMvc.perform(get("/health"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("healthy"))
            .andExpect(jsonPath("$.database").value("connected"))
            .andExpect(jsonPath("$.application").value("running"))
            .andExpect(jsonPath("$.timestamp").isString());
    }

    @Test
    void timestampAdvancesBetweenCalls() throws Exception {
        Instant first = fetchTimestamp();
        Thread.sleep(5);
        Instant second = fetchTimestamp();

        assertThat(second).isAfter(first);
    }
}
