package com.sem.lcs.dsl;

import com.sem.lcs.api.ConfigException;
import com.sem.lcs.api.LatentVariable;
import com.sem.lcs.api.MeanSource;
import com.sem.lcs.api.MeasurementPolicy;
import com.sem.lcs.api.Path;
import com.sem.lcs.api.PathId;
import com.sem.lcs.api.PathKind;
import com.sem.lcs.api.Variable;
import com.sem.lcs.engine.ModelSpecification;
import com.sem.lcs.engine.VariableRegistry;
import com.sem.lcs.engine.VariableSet;

import java.util.Locale;

import lombok.extern.log4j.Log4j2;

/**
 * Path Builder -- turns an {@link LcsConfig} into a complete
 * {@link ModelSpecification}.
 *
 * <p>
 * One parametric algorithm covers every variant (univariate or bivariate,
 * single or multiple indicators, deterministic or stochastic). Paths are
 * emitted stage by stage in the order of
 * {@link com.sem.lcs.engine.PathStage}, and within a stage process by process,
 * so identical configurations always yield identical specifications.
 *
 * Usage:
 *
 * <pre>{@code
 * ModelSpecification spec = PathBuilder.build(cfg);
 * }</pre>
 *
 * A builder instance is single use; the static {@link #build(LcsConfig)}
 * creates a fresh one per call, so concurrent builds share nothing.
 */
@Log4j2
public final class PathBuilder {
    static final double MEAN_START = 0.0;
    static final double VARIANCE_START = 1.0;
    static final double COVARIANCE_START = 0.0;
    static final double COEFFICIENT_START = 0.0;
    static final double LOADING_START = 1.0;
    static final double UNIT = 1.0;

    private final LcsConfig config;
    private final VariableSet vars;
    private final ModelSpecification.Builder spec;
    private final MeasurementPolicy policy;

    // Flag to prevent reuse after building
    private boolean built;

    PathBuilder(LcsConfig config, VariableSet vars, ModelSpecification.Builder spec) {
        this.config = config;
        this.vars = vars;
        this.spec = spec;
        this.policy = config.policy();
    }

    /**
     * Creates a builder for the given configuration with freshly allocated
     * variables.
     */
    public static PathBuilder create(LcsConfig config) {
        VariableSet vars = VariableRegistry.allocate(config.processes(), config.horizon(), config.indicators());
        return new PathBuilder(config, vars, ModelSpecification.builder(config.name()).withVariables(vars));
    }

    /** Builds the full specification for {@code config}. */
    public static ModelSpecification build(LcsConfig config) {
        return create(config).build();
    }

    /**
     * Emits every stage and freezes the result.
     *
     * @throws ConfigException on an invalid combination.
     * @throws com.sem.lcs.api.LabelConflictException if two paths share a
     *         label incompatibly.
     */
    public ModelSpecification build() {
        checkNotBuilt();
        built = true;

        emitMeans();
        emitInitialCovariances();
        emitLatentChain();
        emitAdditive();
        emitSelfFeedback();
        emitCoupling();
        emitChangeToLatent();
        emitMeasurement();
        emitIntercepts();
        emitMeasurementErrors();
        if (config.stochastic())
            emitInnovations();

        ModelSpecification result = spec.build();
        log.debug("Built '{}': {} variables, {} paths, {} labels ({})", config.name(),
                result.variables().size(), result.pathCount(), result.labels().size(), config);
        return result;
    }

    public VariableSet variables() {
        return vars;
    }

    // ── Stages ───────────────────────────────────────────────────

    private void emitMeans() {
        for (int p = 0; p < vars.processCount(); p++) {
            String tok = token(p);
            if (!config.fixesLevelMean(vars.process(p)))
                mean(vars.level(p), MEAN_START, "mean" + tok + "0");
            mean(vars.slope(p), MEAN_START, "mean" + tok + "a");
        }
    }

    private void emitInitialCovariances() {
        for (int p = 0; p < vars.processCount(); p++) {
            String tok = token(p);
            variance(vars.level(p), VARIANCE_START, "var" + tok + "0");
            variance(vars.slope(p), VARIANCE_START, "var" + tok + "a");
            covariance(vars.level(p), vars.slope(p), COVARIANCE_START, "cov" + tok + "0" + tok + "a");
        }
        // Cross-process covariances among all initial factors
        for (int p = 0; p < vars.processCount(); p++) {
            for (int q = p + 1; q < vars.processCount(); q++) {
                LatentVariable[] mine = { vars.level(p), vars.slope(p) };
                LatentVariable[] theirs = { vars.level(q), vars.slope(q) };
                String[] suffix = { "0", "a" };
                for (int i = 0; i < 2; i++)
                    for (int j = 0; j < 2; j++)
                        covariance(mine[i], theirs[j], COVARIANCE_START,
                                "cov" + token(p) + suffix[i] + token(q) + suffix[j]);
            }
        }
    }

    private void emitLatentChain() {
        for (int p = 0; p < vars.processCount(); p++) {
            fixed(vars.level(p), vars.state(p, 1));
            for (int t = 2; t <= vars.horizon(); t++)
                fixed(vars.state(p, t - 1), vars.state(p, t));
        }
    }

    private void emitAdditive() {
        for (int p = 0; p < vars.processCount(); p++)
            for (int t = 2; t <= vars.horizon(); t++)
                fixed(vars.slope(p), vars.change(p, t));
    }

    private void emitSelfFeedback() {
        for (int p = 0; p < vars.processCount(); p++) {
            String label = config.isBivariate() ? "beta_" + token(p) : "beta";
            for (int t = 2; t <= vars.horizon(); t++)
                regression(vars.state(p, t - 1), vars.change(p, t), COEFFICIENT_START, label);
        }
    }

    private void emitCoupling() {
        if (!config.coupled())
            return;
        for (int p = 0; p < vars.processCount(); p++) {
            // gamma_<p> is the effect of the other process on p's change
            String label = "gamma_" + token(p);
            for (int q = 0; q < vars.processCount(); q++) {
                if (q == p)
                    continue;
                for (int t = 2; t <= vars.horizon(); t++)
                    regression(vars.state(q, t - 1), vars.change(p, t), COEFFICIENT_START, label);
            }
        }
    }

    private void emitChangeToLatent() {
        for (int p = 0; p < vars.processCount(); p++)
            for (int t = 2; t <= vars.horizon(); t++)
                fixed(vars.change(p, t), vars.state(p, t));
    }

    private void emitMeasurement() {
        for (int p = 0; p < vars.processCount(); p++) {
            int k = vars.indicatorCount(p);
            for (int t = 1; t <= vars.horizon(); t++) {
                for (int i = 1; i <= k; i++) {
                    Variable m = vars.manifest(p, i, t);
                    if (i == 1 || !policy.isLoadingFree(i)) {
                        fixed(vars.state(p, t), m);
                    } else {
                        String label = policy.tiesLoadings() ? "lambda_" + token(p) + i : null;
                        regression(vars.state(p, t), m, LOADING_START, label);
                    }
                }
            }
        }
    }

    private void emitIntercepts() {
        if (!policy.estimatesIntercepts())
            return;
        for (int p = 0; p < vars.processCount(); p++) {
            int k = vars.indicatorCount(p);
            if (k == 1)
                continue;
            for (int t = 1; t <= vars.horizon(); t++)
                for (int i = 1; i <= k; i++)
                    mean(vars.manifest(p, i, t), MEAN_START, "nu_" + token(p) + i);
        }
    }

    private void emitMeasurementErrors() {
        for (int p = 0; p < vars.processCount(); p++) {
            int k = vars.indicatorCount(p);
            for (int t = 1; t <= vars.horizon(); t++)
                for (int i = 1; i <= k; i++)
                    variance(vars.manifest(p, i, t), VARIANCE_START,
                            "vare_" + token(p) + (k == 1 ? "" : String.valueOf(i)));
        }
        if (config.isBivariate() && vars.indicatorCount(0) == 1 && vars.indicatorCount(1) == 1) {
            for (int t = 1; t <= vars.horizon(); t++)
                covariance(vars.manifest(0, 1, t), vars.manifest(1, 1, t), COVARIANCE_START, "covErr");
        }
    }

    /**
     * Stochastic overlay: innovation variance on every change score and, when
     * coupled, the same-occasion covariance of the two processes' changes.
     * Appends only.
     */
    void emitInnovations() {
        for (int p = 0; p < vars.processCount(); p++) {
            String label = config.isBivariate() ? "varDer_" + token(p) : "varDer";
            for (int t = 2; t <= vars.horizon(); t++)
                variance(vars.change(p, t), VARIANCE_START, label);
        }
        if (config.coupled()) {
            for (int t = 2; t <= vars.horizon(); t++)
                covariance(vars.change(0, t), vars.change(1, t), COVARIANCE_START, "covDer");
        }
    }

    // ── Path primitives ──────────────────────────────────────────

    /** Fixed unit regression. */
    PathId fixed(Variable from, Variable to) {
        return spec.addPath(Path.fixed(from, to, PathKind.REGRESSION, UNIT));
    }

    /** Free regression coefficient, optionally tied by label. */
    PathId regression(Variable from, Variable to, double start, String label) {
        return spec.addPath(Path.free(from, to, PathKind.REGRESSION, start, label));
    }

    /** Free mean or intercept of {@code target}. */
    PathId mean(Variable target, double start, String label) {
        return spec.addPath(Path.free(MeanSource.INSTANCE, target, PathKind.REGRESSION, start, label));
    }

    /** Free variance of {@code v}. */
    PathId variance(Variable v, double start, String label) {
        return spec.addPath(Path.free(v, v, PathKind.COVARIANCE, start, label));
    }

    /**
     * Free covariance between two distinct variables. A variance must go
     * through {@link #variance}; passing the same variable twice is rejected.
     */
    PathId covariance(Variable a, Variable b, double start, String label) {
        if (a.equals(b))
            throw new ConfigException("Covariance of " + a.name() + " with itself; declare it as a variance");
        return spec.addPath(Path.free(a, b, PathKind.COVARIANCE, start, label));
    }

    ModelSpecification finish() {
        checkNotBuilt();
        built = true;
        return spec.build();
    }

    private String token(int p) {
        return vars.process(p).toLowerCase(Locale.ROOT);
    }

    private void checkNotBuilt() {
        if (built)
            throw new IllegalStateException("Specification already built");
    }
}
