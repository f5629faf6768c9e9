package com.bko.intervalcoach.workout;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class WorkoutCatalogConfiguration {

    @Bean
    public WorkoutCatalog workoutCatalog(ObjectMapper objectMapper) {
        return WorkoutCatalog.load(objectMapper);
    }
}
