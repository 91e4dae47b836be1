package com.boilerplate.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConfigurationProperties(prefix = "boilerplate.placeholder-api")
public class PlaceholderApiProperties {

    private String todosUrl = "https://jsonplaceholder.typicode.com/todos";
    private String usersUrl = "https://jsonplaceholder.typicode.com/users";

    public String getTodosUrl() {
        return todosUrl;
    }

    public void setTodosUrl(String todosUrl) {
        this.todosUrl = todosUrl;
    }

    public String getUsersUrl() {
        return usersUrl;
    }

    public void setUsersUrl(String usersUrl) {
        this.usersUrl = usersUrl;
    }
}
