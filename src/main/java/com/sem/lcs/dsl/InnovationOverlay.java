package com.sem.lcs.dsl;

import com.sem.lcs.api.ConfigException;
import com.sem.lcs.engine.ModelSpecification;
import com.sem.lcs.engine.PathStage;
import com.sem.lcs.engine.VariableRegistry;
import com.sem.lcs.engine.VariableSet;

import lombok.extern.log4j.Log4j2;

/**
 * Turns a deterministic specification into its stochastic counterpart by
 * appending innovation (co)variances. Existing paths are left untouched, so
 * {@code apply(build(cfg), cfg)} equals {@code build(cfg.withStochastic(true))}.
 */
@Log4j2
public final class InnovationOverlay {

    private InnovationOverlay() {
        // Utility class
    }

    /**
     * Appends the innovation stage to {@code base}.
     *
     * @param base   Specification built from {@code config}.
     * @param config Configuration {@code base} was built from; its stochastic
     *               flag is ignored.
     * @return A new specification; {@code base} itself if it already carries
     *         innovations.
     * @throws ConfigException if {@code base} was not built from {@code config}.
     */
    public static ModelSpecification apply(ModelSpecification base, LcsConfig config) {
        if (!base.processes().equals(config.processes()))
            throw new ConfigException("Specification processes " + base.processes()
                    + " do not match configuration " + config.processes());
        if (!base.paths(PathStage.INNOVATION).isEmpty()) {
            log.debug("'{}' already stochastic; overlay not reapplied", base.name());
            return base;
        }
        VariableSet vars = VariableRegistry.allocate(config.processes(), config.horizon(), config.indicators());
        for (var v : base.variables())
            if (vars.byName(v.name()) == null)
                throw new ConfigException("Variable " + v.name() + " is not part of configuration " + config);
        if (vars.all().size() != base.variables().size())
            throw new ConfigException("Configuration " + config + " allocates " + vars.all().size()
                    + " variables but '" + base.name() + "' has " + base.variables().size());
        if (config.coupled() == base.paths(PathStage.COUPLING).isEmpty())
            throw new ConfigException("Configuration " + config + (config.coupled() ? " is" : " is not")
                    + " coupled but '" + base.name() + "' " + (config.coupled() ? "has no" : "has")
                    + " coupling paths");

        var builder = new PathBuilder(config, vars, base.toBuilder());
        builder.emitInnovations();
        return builder.finish();
    }
}
