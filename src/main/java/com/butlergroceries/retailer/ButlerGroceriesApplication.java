package com.butlergroceries.retailer;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class ButlerGroceriesApplication {
    public static void main(String[] args) {
        SpringApplication.run(ButlerGroceriesApplication.class, args);
    }
}
