package com.sem.lcs;

import com.sem.lcs.api.ConfigException;
import com.sem.lcs.api.DataSource;
import com.sem.lcs.api.EstimationEngine;
import com.sem.lcs.api.FitResult;
import com.sem.lcs.api.ManifestVariable;
import com.sem.lcs.dsl.LcsConfig;
import com.sem.lcs.dsl.PathBuilder;
import com.sem.lcs.engine.ModelSpecification;
import com.sem.lcs.io.EquationTextExporter;
import com.sem.lcs.io.ModelDefinitionLoader;
import com.sem.lcs.io.PathListExporter;
import com.sem.lcs.io.PathRow;
import com.sem.lcs.util.SpecExplain;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.List;

/**
 * A high-level wrapper that builds a latent change score specification and
 * hands out its renderings.
 * <p>
 * This class handles:
 * <ul>
 * <li>Loading JSON model definitions</li>
 * <li>Building the specification with {@link PathBuilder}</li>
 * <li>Rendering the path-list and equation-text forms</li>
 * <li>Handing the specification to an external {@link EstimationEngine}</li>
 * </ul>
 */
public final class LcsModel {
    private static final Logger log = LogManager.getLogger(LcsModel.class);

    private final LcsConfig config;
    private final ModelSpecification spec;

    private LcsModel(LcsConfig config, ModelSpecification spec) {
        this.config = config;
        this.spec = spec;
    }

    /** Builds the model described by {@code config}. */
    public static LcsModel build(LcsConfig config) {
        return new LcsModel(config, PathBuilder.build(config));
    }

    /**
     * Builds the model described by a JSON definition file.
     *
     * @param jsonPath Path to the JSON model definition.
     */
    public static LcsModel load(Path jsonPath) {
        LcsConfig config;
        try {
            config = ModelDefinitionLoader.load(jsonPath);
        } catch (IOException e) {
            throw new ConfigException("Failed to load model definition from " + jsonPath, e);
        }
        return build(config);
    }

    public LcsConfig config() {
        return config;
    }

    public ModelSpecification specification() {
        return spec;
    }

    public List<PathRow> pathList() {
        return PathListExporter.toPathList(spec);
    }

    public String pathListText() {
        return PathListExporter.toText(spec);
    }

    public List<String> equationText() {
        return EquationTextExporter.toEquationText(spec);
    }

    public SpecExplain explain() {
        return new SpecExplain(spec);
    }

    /**
     * Fits the model with an external engine.
     *
     * <p>
     * Checks that the data has a column for every manifest variable, then
     * delegates. Engine failures such as
     * {@link com.sem.lcs.api.NonconvergenceException} reach the caller
     * unchanged.
     *
     * @throws ConfigException if a manifest variable has no data column.
     */
    public FitResult estimate(EstimationEngine engine, DataSource data) {
        var columns = new HashSet<>(data.columns());
        for (ManifestVariable m : spec.manifests())
            if (!columns.contains(m.name()))
                throw new ConfigException("Data has no column for manifest variable " + m.name());
        log.info("Estimating '{}' on {} rows", spec.name(), data.rowCount());
        return engine.estimate(spec, data);
    }
}
