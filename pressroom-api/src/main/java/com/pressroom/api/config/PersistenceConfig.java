package com.pressroom.api.config;

import com.pressroom.core.schema.EntityValidator;
import jakarta.validation.Validator;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the core's schema validation into the application context.
 * 
 * The pooled {@code DataSource} and the transaction manager come from Spring Boot
 * auto-configuration; they are created at startup and closed on shutdown.
 */
@Configuration
@EnableConfigurationProperties(WriteProperties.class)
public class PersistenceConfig {

    @Bean
    public EntityValidator entityValidator(Validator validator) {
        return new EntityValidator(validator);
    }
}
