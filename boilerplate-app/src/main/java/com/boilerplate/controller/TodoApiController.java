package com.boilerplate.controller;

import com.boilerplate.model.Todo;
import com.boilerplate.service.PlaceholderApiClient;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/todos")
public class TodoApiController {

    private final PlaceholderApiClient placeholderApiClient;

    public TodoApiController(PlaceholderApiClient placeholderApiClient) {
        this.placeholderApiClient = placeholderApiClient;
    }

    @GetMapping
    public List<Todo> listTodos() {
        return placeholderApiClient.fetchTodos();
    }
}
