package com.taskgraph.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application entry point for the TaskGraph engine.
 * Engine components are wired explicitly in {@link com.taskgraph.api.config.EngineConfiguration}.
 */
@SpringBootApplication
public class TaskGraphApplication {

    public static void main(String[] args) {
        SpringApplication.run(TaskGraphApplication.class, args);
    }
}
