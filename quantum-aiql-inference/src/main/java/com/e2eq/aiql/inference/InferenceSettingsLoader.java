package com.e2eq.aiql.inference;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Loads {@link InferenceSettings} from YAML. Keys that are absent keep their defaults:
 * <pre>
 * inference:
 *   maxForwardSteps: 100
 *   maxProofDepth: 20
 *   conjunctionIntroductionCap: 10
 *   proveForwardSteps: 50
 *   lieThreshold: 0.3
 * </pre>
 */
public final class InferenceSettingsLoader {

    // DTOs mirroring YAML
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record YSettings(YInference inference) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record YInference(Integer maxForwardSteps,
                             Integer maxProofDepth,
                             Integer conjunctionIntroductionCap,
                             Integer proveForwardSteps,
                             Double lieThreshold) {}

    private final ObjectMapper mapper = new ObjectMapper(new YAMLFactory());

    public InferenceSettings loadFromClasspath(String resourcePath) throws IOException {
        try (InputStream in = Thread.currentThread().getContextClassLoader().getResourceAsStream(resourcePath)) {
            if (in == null) throw new IOException("Resource not found: " + resourcePath);
            return load(in);
        }
    }

    public InferenceSettings loadFromPath(Path path) throws IOException {
        try (InputStream in = Files.newInputStream(path)) {
            return load(in);
        }
    }

    public InferenceSettings load(InputStream in) throws IOException {
        YSettings y = mapper.readValue(in, YSettings.class);
        return toSettings(y == null ? null : y.inference());
    }

    private InferenceSettings toSettings(YInference y) throws IOException {
        InferenceSettings d = InferenceSettings.defaults();
        if (y == null) {
            return d;
        }
        try {
            return new InferenceSettings(
                    Optional.ofNullable(y.maxForwardSteps()).orElse(d.maxForwardSteps()),
                    Optional.ofNullable(y.maxProofDepth()).orElse(d.maxProofDepth()),
                    Optional.ofNullable(y.conjunctionIntroductionCap()).orElse(d.conjunctionIntroductionCap()),
                    Optional.ofNullable(y.proveForwardSteps()).orElse(d.proveForwardSteps()),
                    Optional.ofNullable(y.lieThreshold()).orElse(d.lieThreshold()));
        } catch (IllegalArgumentException e) {
            throw new IOException("Invalid inference settings: " + e.getMessage(), e);
        }
    }
}
