package com.poc.vmmigration.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * JSON mapping shared by the REST API and the object stores.
 */
@Configuration
public class JacksonConfiguration {
    
    /**
     * ObjectMapper for JSON serialization/deserialization.
     */
    @Bean
    public ObjectMapper objectMapper() {
        return createObjectMapper();
    }

    /**
     * Snake-case JSON with ISO-8601 dates.
     */
    public static ObjectMapper createObjectMapper() {
        return new ObjectMapper()
            .findAndRegisterModules() // Register Java 8 time module, etc.
            .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }
}
