package com.butlergroceries.retailer.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

@ConfigurationProperties(prefix = "app")
public class AppProperties {
    private String name = "Butler Groceries";
    /**
     * Origins allowed to call the API from a browser. Comma-separated in the environment.
     */
    private List<String> corsOrigins = new ArrayList<>(List.of("http://localhost:3000"));

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public List<String> getCorsOrigins() {
        return corsOrigins;
    }

    public void setCorsOrigins(List<String> corsOrigins) {
        this.corsOrigins = corsOrigins;
    }
}
