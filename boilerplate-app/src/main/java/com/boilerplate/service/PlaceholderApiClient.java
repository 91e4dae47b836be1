package com.boilerplate.service;

import com.boilerplate.config.PlaceholderApiProperties;
import com.boilerplate.model.Todo;
import com.boilerplate.model.User;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.UnknownContentTypeException;

import java.util.Arrays;
import java.util.List;

/**
 * Client for the JSONPlaceholder demo API.
 * No retries; the RestClient's default timeouts apply.
 */
@Service
public class PlaceholderApiClient {

    private static final Logger log = LoggerFactory.getLogger(PlaceholderApiClient.class);

    private final RestClient restClient;
    private final PlaceholderApiProperties properties;

    public PlaceholderApiClient(RestClient.Builder restClientBuilder, PlaceholderApiProperties properties) {
        this.restClient = restClientBuilder.build();
        this.properties = properties;
    }

    /**
     * Fetch all todos.
     *
     * @return the todos in upstream order, empty if the body is null
     * @throws PlaceholderApiException on a non-2xx status, transport error or unreadable body
     */
    public List<Todo> fetchTodos() {
        Todo[] todos = fetch(properties.getTodosUrl(), Todo[].class, "todos");
        return todos == null ? List.of() : Arrays.asList(todos);
    }

    /**
     * Fetch all users.
     *
     * @return the users in upstream order, empty if the body is null
     * @throws PlaceholderApiException on a non-2xx status, transport error or unreadable body
     */
    public List<User> fetchUsers() {
        User[] users = fetch(properties.getUsersUrl(), User[].class, "users");
        return users == null ? List.of() : Arrays.asList(users);
    }

    private <T> T fetch(String url, Class<T> type, String resource) {
        try {
            return restClient.get()
                    .uri(url)
                    .accept(MediaType.APPLICATION_JSON)
                    .retrieve()
                    .body(type);
        } catch (RestClientException e) {
            if (e instanceof UnknownContentTypeException
                    || e.getCause() instanceof HttpMessageNotReadableException) {
                log.error("Error deserializing {} response", resource, e);
            } else {
                log.error("Error fetching {} from JSONPlaceholder API", resource, e);
            }
            throw new PlaceholderApiException("Failed to fetch " + resource, e);
        }
    }
}
