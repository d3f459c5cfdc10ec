package com.pressroom.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.domain.EntityScan;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;

/**
 * Pressroom API Application
 * 
 * Accounts, profiles, content and tags over a single relational store.
 * Java 17 + Spring Boot 3.4.x
 */
@SpringBootApplication(scanBasePackages = "com.pressroom")
@EntityScan(basePackages = "com.pressroom.core.domain")
@EnableJpaRepositories(basePackages = "com.pressroom.core.repository")
public class PressroomApiApplication {

    public static void main(String[] args) {
        SpringApplication.run(PressroomApiApplication.class, args);
    }
}
