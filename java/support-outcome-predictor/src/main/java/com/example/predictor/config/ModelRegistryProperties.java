package com.example.predictor.config;

import java.time.Duration;
import java.util.List;
import java.util.Set;

import org.springframework.boot.context.properties.ConfigurationProperties;

import com.example.predictor.model.Capability;

@ConfigurationProperties(prefix = "app.models")
public record ModelRegistryProperties(
    List<String> locations,
    Set<Capability> requiredCapabilities,
    Duration scoringBudget
) {

    public ModelRegistryProperties {
        locations = locations == null || locations.isEmpty()
            ? List.of("classpath*:models/*.json")
            : List.copyOf(locations);
        requiredCapabilities = requiredCapabilities == null || requiredCapabilities.isEmpty()
            ? Set.of(Capability.INTENT, Capability.SENTIMENT)
            : Set.copyOf(requiredCapabilities);
        scoringBudget = scoringBudget == null ? Duration.ofMillis(250) : scoringBudget;
    }

    public static ModelRegistryProperties defaults() {
        return new ModelRegistryProperties(null, null, null);
    }
}
