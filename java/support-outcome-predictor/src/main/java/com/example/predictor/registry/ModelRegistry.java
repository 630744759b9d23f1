package com.example.predictor.registry;

import java.util.List;
import java.util.Map;
import java.util.Set;

import com.example.predictor.model.Capability;

public interface ModelRegistry {

    /**
     * @param version exact version, or {@code null} for the highest loaded one
     * @throws com.example.predictor.exception.ModelUnavailableException if nothing matches
     */
    ScoringUnit resolve(Capability capability, String version);

    Set<Capability> missingCapabilities();

    Map<Capability, List<String>> loadedVersions();
}
