package com.example.predictor.registry;

import java.io.IOException;
import java.io.InputStream;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ConcurrentNavigableMap;
import java.util.concurrent.ConcurrentSkipListMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;
import org.springframework.core.io.support.ResourcePatternResolver;
import org.springframework.stereotype.Component;

import com.example.predictor.config.ModelRegistryProperties;
import com.example.predictor.exception.ModelUnavailableException;
import com.example.predictor.model.Capability;
import com.fasterxml.jackson.databind.ObjectMapper;

import jakarta.annotation.PostConstruct;

/**
 * Registry backed by JSON artifacts exported by the training job. Artifacts are read once at
 * startup from the configured resource patterns; an unreadable artifact is skipped, not fatal,
 * and shows up as a missing capability on {@code /health}.
 */
@Component
public class ArtifactModelRegistry implements ModelRegistry {

    private static final Logger log = LoggerFactory.getLogger(ArtifactModelRegistry.class);
    private static final ObjectMapper mapper = new ObjectMapper();

    static final Comparator<String> VERSION_ORDER = ArtifactModelRegistry::compareVersions;

    private final ModelRegistryProperties properties;
    private final ResourcePatternResolver resolver = new PathMatchingResourcePatternResolver();
    private final ConcurrentMap<Capability, ConcurrentNavigableMap<String, ScoringUnit>> units =
        new ConcurrentHashMap<>();

    public ArtifactModelRegistry(ModelRegistryProperties properties) {
        this.properties = properties;
    }

    @PostConstruct
    public void loadArtifacts() {
        for (String location : properties.locations()) {
            Resource[] resources;
            try {
                resources = resolver.getResources(location);
            } catch (IOException e) {
                log.warn("Cannot list model artifacts at {}: {}", location, e.getMessage());
                continue;
            }
            for (Resource resource : resources) {
                loadArtifact(resource);
            }
        }
        log.info("Model registry ready: loaded={} missing={}", loadedVersions(), missingCapabilities());
    }

    private void loadArtifact(Resource resource) {
        try (InputStream in = resource.getInputStream()) {
            ModelArtifact artifact = mapper.readValue(in, ModelArtifact.class);
            ScoringUnit unit = ScoringUnitFactory.create(artifact);
            register(unit);
            log.info("Loaded {} model v{} ({}) from {}", unit.capability().wireName(), unit.version(),
                artifact.family(), resource.getDescription());
        } catch (IOException | IllegalArgumentException e) {
            log.warn("Skipping model artifact {}: {}", resource.getDescription(), e.getMessage());
        }
    }

    public void register(ScoringUnit unit) {
        ScoringUnit guarded = unit instanceof GuardedScoringUnit
            ? unit
            : new GuardedScoringUnit(unit, properties.scoringBudget());
        units.computeIfAbsent(unit.capability(), c -> new ConcurrentSkipListMap<>(VERSION_ORDER))
            .put(unit.version(), guarded);
    }

    @Override
    public ScoringUnit resolve(Capability capability, String version) {
        ConcurrentNavigableMap<String, ScoringUnit> versions = units.get(capability);
        if (versions == null || versions.isEmpty()) {
            throw new ModelUnavailableException(capability, version);
        }
        if (version == null) {
            Map.Entry<String, ScoringUnit> latest = versions.lastEntry();
            if (latest == null) {
                throw new ModelUnavailableException(capability, null);
            }
            return latest.getValue();
        }
        ScoringUnit unit = versions.get(version);
        if (unit == null) {
            throw new ModelUnavailableException(capability, version);
        }
        return unit;
    }

    @Override
    public Set<Capability> missingCapabilities() {
        Set<Capability> missing = EnumSet.noneOf(Capability.class);
        for (Capability required : properties.requiredCapabilities()) {
            var versions = units.get(required);
            if (versions == null || versions.isEmpty()) {
                missing.add(required);
            }
        }
        return missing;
    }

    @Override
    public Map<Capability, List<String>> loadedVersions() {
        Map<Capability, List<String>> loaded = new EnumMap<>(Capability.class);
        units.forEach((capability, versions) -> {
            if (!versions.isEmpty()) {
                loaded.put(capability, List.copyOf(versions.keySet()));
            }
        });
        return loaded;
    }

    static int compareVersions(String a, String b) {
        String[] left = a.split("[.\\-]");
        String[] right = b.split("[.\\-]");
        for (int i = 0; i < Math.max(left.length, right.length); i++) {
            String l = i < left.length ? left[i] : "0";
            String r = i < right.length ? right[i] : "0";
            int cmp;
            if (l.chars().allMatch(Character::isDigit) && r.chars().allMatch(Character::isDigit)
                && !l.isEmpty() && !r.isEmpty()) {
                cmp = new java.math.BigInteger(l).compareTo(new java.math.BigInteger(r));
            } else {
                cmp = l.compareTo(r);
            }
            if (cmp != 0) return cmp;
        }
        return a.compareTo(b);
    }
}
