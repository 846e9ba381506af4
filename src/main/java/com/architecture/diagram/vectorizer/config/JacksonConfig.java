package com.architecture.diagram.vectorizer.config;

import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.springframework.boot.autoconfigure.jackson.Jackson2ObjectMapperBuilderCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Adjusts the auto-configured ObjectMapper; {@code spring.jackson.*} properties still apply.
 */
@Configuration
public class JacksonConfig {

    @Bean
    public Jackson2ObjectMapperBuilderCustomizer stableKeyOrderCustomizer() {
        // Stable key order so diagram JSON diffs cleanly
        return builder -> builder.featuresToEnable(
                MapperFeature.SORT_PROPERTIES_ALPHABETICALLY,
                SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);
    }
}
