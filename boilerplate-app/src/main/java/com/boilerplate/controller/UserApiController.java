package com.boilerplate.controller;

import com.boilerplate.model.User;
import com.boilerplate.service.PlaceholderApiClient;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/users")
public class UserApiController {

    private final PlaceholderApiClient placeholderApiClient;

    public UserApiController(PlaceholderApiClient placeholderApiClient) {
        this.placeholderApiClient = placeholderApiClient;
    }

    /**
     * List users, optionally with their total.
     *
     * @param count when true the response also carries the number of users
     */
    @GetMapping
    public Map<String, Object> listUsers(@RequestParam(required = false) Boolean count) {
        List<User> users = placeholderApiClient.fetchUsers();

        Map<String, Object> response = new LinkedHashMap<>();
        if (Boolean.TRUE.equals(count)) {
            response.put("count", users.size());
        }
        response.put("users", users);
        return response;
    }
}
