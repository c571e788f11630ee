package com.sem.lcs.io;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sem.lcs.api.ConfigException;
import com.sem.lcs.dsl.LcsConfig;
import com.sem.lcs.util.InvariancePolicy;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

import lombok.extern.log4j.Log4j2;

/**
 * Loads JSON model definitions and converts them to {@link LcsConfig}.
 */
@Log4j2
public final class ModelDefinitionLoader {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private ModelDefinitionLoader() {
        // Utility class
    }

    /** Parses a JSON file into a ModelDefinition. */
    public static ModelDefinition parseFile(Path path) throws IOException {
        try (InputStream in = Files.newInputStream(path)) {
            ModelDefinition def = MAPPER.readValue(in, ModelDefinition.class);
            log.info("Loaded model definition from {}", path);
            return def;
        }
    }

    /** Parses a JSON string into a ModelDefinition. */
    public static ModelDefinition parse(String json) {
        try {
            return MAPPER.readValue(json, ModelDefinition.class);
        } catch (JsonProcessingException e) {
            throw new ConfigException("Malformed model definition: " + e.getOriginalMessage(), e);
        }
    }

    /** Reads and validates a model definition file in one step. */
    public static LcsConfig load(Path path) throws IOException {
        return toConfig(parseFile(path));
    }

    /**
     * Validates a definition and turns it into a configuration.
     *
     * @throws ConfigException if a required key is missing or any value is
     *                         invalid.
     */
    public static LcsConfig toConfig(ModelDefinition def) {
        ModelDefinition.ModelInfo m = def.getModel();
        if (m == null)
            throw new ConfigException("Missing 'model' key");
        if (m.getHorizon() == null)
            throw new ConfigException("Missing 'horizon'");
        if (m.getProcesses() == null || m.getProcesses().isEmpty())
            throw new ConfigException("Missing 'processes'");

        InvariancePolicy policy;
        try {
            policy = InvariancePolicy.fromString(m.getInvariance());
        } catch (IllegalArgumentException e) {
            throw new ConfigException(e.getMessage(), e);
        }

        var b = LcsConfig.builder()
                .horizon(m.getHorizon())
                .processes(m.getProcesses().toArray(String[]::new))
                .coupled(m.isCoupled())
                .stochastic(m.isStochastic())
                .invariance(policy);
        if (m.getName() != null)
            b.name(m.getName());
        if (m.getIndicators() != null)
            m.getIndicators().forEach((p, n) -> {
                if (n == null)
                    throw new ConfigException("Null indicator count for process " + p);
                b.indicators(p, n);
            });
        if (m.getLevelMeanFixed() != null)
            b.levelMeanFixed(m.getLevelMeanFixed());
        return b.build();
    }
}
