package com.olympicsdata;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main Spring Boot application for the Olympic edition integration service.
 */
@SpringBootApplication
public class OlympicsIntegrationApplication {

    public static void main(String[] args) {
        SpringApplication.run(OlympicsIntegrationApplication.class, args);
    }
}
