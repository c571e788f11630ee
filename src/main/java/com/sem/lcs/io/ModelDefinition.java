package com.sem.lcs.io;

import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import lombok.Data;

/**
 * POJO representation of a model definition file.
 *
 * <pre>{@code
 * {"model": {"name": "bivariate", "horizon": 5, "processes": ["X", "Y"],
 *            "indicators": {"X": 1, "Y": 1}, "coupled": true,
 *            "stochastic": true, "invariance": "strong"}}
 * }</pre>
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public final class ModelDefinition {
    private ModelInfo model;

    /** Structural parameters of the model. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static final class ModelInfo {
        private String name, description, invariance;
        private Integer horizon;
        private List<String> processes;
        private Map<String, Integer> indicators;
        private boolean coupled, stochastic;
        private Boolean levelMeanFixed;
    }
}
