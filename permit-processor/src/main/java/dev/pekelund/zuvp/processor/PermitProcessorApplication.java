package dev.pekelund.zuvp.processor;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Spring Boot application entry point for the permit processing service.
 */
@SpringBootApplication
public class PermitProcessorApplication {

    public static void main(String[] args) {
        SpringApplication.run(PermitProcessorApplication.class, args);
    }
}
