package com.architecture.diagram.vectorizer.config;

import com.architecture.diagram.vectorizer.service.extraction.BindingThresholds;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Geometric binding tolerances used when raw scene elements carry no explicit linkage.
 * Reads values from application.yml properties.
 */
@Configuration
@Slf4j
public class BindingConfig {

    @Value("${diagram.binding.connector-proximity:20}")
    private double connectorProximity;

    @Value("${diagram.binding.frame-containment-slack:0}")
    private double frameContainmentSlack;

    @Bean
    public BindingThresholds bindingThresholds() {
        log.info("[Binding Config] connector proximity: {}, frame containment slack: {}",
                connectorProximity, frameContainmentSlack);

        return BindingThresholds.builder()
                .connectorProximity(connectorProximity)
                .frameContainmentSlack(frameContainmentSlack)
                .build();
    }
}
