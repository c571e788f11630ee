package com.sem.lcs.dsl;

import com.sem.lcs.api.ConfigException;
import com.sem.lcs.api.MeasurementPolicy;
import com.sem.lcs.engine.VariableRegistry;
import com.sem.lcs.util.InvariancePolicy;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import lombok.extern.log4j.Log4j2;

/**
 * Structural parameters of one latent change score model.
 *
 * <p>
 * Immutable; created through {@link #builder()}, which validates the whole
 * configuration before returning it:
 *
 * <pre>{@code
 * LcsConfig cfg = LcsConfig.builder()
 *         .horizon(5)
 *         .processes("X", "Y")
 *         .coupled(true)
 *         .stochastic(true)
 *         .build();
 * }</pre>
 */
public final class LcsConfig {
    public static final int MAX_PROCESSES = 2;

    private final String name;
    private final int horizon;
    private final List<String> processes;
    private final Map<String, Integer> indicators;
    private final boolean coupled;
    private final boolean stochastic;
    private final MeasurementPolicy policy;
    private final Boolean levelMeanFixed;

    private LcsConfig(Builder b, List<String> processes, Map<String, Integer> indicators, boolean coupled) {
        this.name = b.name;
        this.horizon = b.horizon;
        this.processes = Collections.unmodifiableList(processes);
        this.indicators = Collections.unmodifiableMap(indicators);
        this.coupled = coupled;
        this.stochastic = b.stochastic;
        this.policy = b.policy;
        this.levelMeanFixed = b.levelMeanFixed;
    }

    public static Builder builder() {
        return new Builder();
    }

    public String name() {
        return name;
    }

    public int horizon() {
        return horizon;
    }

    public List<String> processes() {
        return processes;
    }

    public Map<String, Integer> indicators() {
        return indicators;
    }

    /**
     * @throws ConfigException if {@code process} is not part of this
     *                         configuration.
     */
    public int indicatorCount(String process) {
        Integer n = indicators.get(process);
        if (n == null)
            throw new ConfigException("Unknown process " + process + "; configured " + processes);
        return n;
    }

    /** True only when two processes are present and coupling was requested. */
    public boolean coupled() {
        return coupled;
    }

    public boolean stochastic() {
        return stochastic;
    }

    public MeasurementPolicy policy() {
        return policy;
    }

    public boolean isBivariate() {
        return processes.size() == 2;
    }

    /**
     * Whether the initial level mean of {@code process} is fixed to zero: the
     * explicit override if one was set, otherwise the policy's rule.
     */
    public boolean fixesLevelMean(String process) {
        if (levelMeanFixed != null)
            return levelMeanFixed;
        return policy.fixesLevelMean(indicatorCount(process));
    }

    /** Copy of this configuration with a different stochastic flag. */
    public LcsConfig withStochastic(boolean value) {
        return toBuilder().stochastic(value).build();
    }

    /** Copy of this configuration with a different coupling flag. */
    public LcsConfig withCoupled(boolean value) {
        return toBuilder().coupled(value).build();
    }

    public Builder toBuilder() {
        var b = new Builder().name(name).horizon(horizon).processes(processes.toArray(String[]::new))
                .coupled(coupled).stochastic(stochastic).measurementPolicy(policy);
        indicators.forEach(b::indicators);
        if (levelMeanFixed != null)
            b.levelMeanFixed(levelMeanFixed);
        return b;
    }

    @Override
    public String toString() {
        return "LcsConfig[name=" + name + ", T=" + horizon + ", processes=" + processes + ", indicators="
                + indicators + ", coupled=" + coupled + ", stochastic=" + stochastic + ", policy=" + policy.id()
                + (levelMeanFixed != null ? ", levelMeanFixed=" + levelMeanFixed : "") + "]";
    }

    @Log4j2
    public static final class Builder {
        private String name = "lcs";
        private int horizon;
        private final List<String> processes = new ArrayList<>();
        private final Map<String, Integer> indicators = new LinkedHashMap<>();
        private boolean coupled;
        private boolean stochastic;
        private MeasurementPolicy policy = InvariancePolicy.DEFAULT;
        private Boolean levelMeanFixed;

        private Builder() {
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder horizon(int horizon) {
            this.horizon = horizon;
            return this;
        }

        /** Replaces the process list. Order determines emission order. */
        public Builder processes(String... ids) {
            processes.clear();
            Collections.addAll(processes, ids);
            return this;
        }

        /** Sets the indicator count of one process; unset processes get 1. */
        public Builder indicators(String process, int count) {
            indicators.put(process, count);
            return this;
        }

        public Builder coupled(boolean coupled) {
            this.coupled = coupled;
            return this;
        }

        public Builder stochastic(boolean stochastic) {
            this.stochastic = stochastic;
            return this;
        }

        public Builder invariance(InvariancePolicy policy) {
            return measurementPolicy(policy);
        }

        /** Installs a custom measurement regime. */
        public Builder measurementPolicy(MeasurementPolicy policy) {
            this.policy = policy;
            return this;
        }

        /**
         * Overrides the policy's rule for fixing the initial level mean to zero,
         * for every process.
         */
        public Builder levelMeanFixed(boolean fixed) {
            this.levelMeanFixed = fixed;
            return this;
        }

        /**
         * Validates and freezes the configuration.
         *
         * @throws ConfigException if any structural parameter is invalid.
         */
        public LcsConfig build() {
            if (horizon < 2)
                throw new ConfigException("horizon must be >= 2, got " + horizon);
            if (processes.isEmpty() || processes.size() > MAX_PROCESSES)
                throw new ConfigException("Expected 1 to " + MAX_PROCESSES + " processes, got " + processes);
            if (policy == null)
                throw new ConfigException("A measurement policy is required");
            for (String p : processes) {
                if (p == null || !VariableRegistry.PROCESS_ID.matcher(p).matches())
                    throw new ConfigException("Process id must be upper-case letters: " + p);
                if (Collections.frequency(processes, p) > 1)
                    throw new ConfigException("Duplicate process id: " + p);
            }
            for (String p : indicators.keySet())
                if (!processes.contains(p))
                    throw new ConfigException("Indicator count given for unknown process " + p);

            Map<String, Integer> counts = new LinkedHashMap<>();
            for (String p : processes) {
                Integer c = indicators.getOrDefault(p, 1);
                if (c == null || c < 1)
                    throw new ConfigException("Process " + p + " needs at least one indicator, got " + c);
                counts.put(p, c);
            }

            boolean effectiveCoupling = coupled && processes.size() > 1;
            if (coupled && !effectiveCoupling)
                log.warn("Coupling requested for univariate model '{}'; ignored", name);
            return new LcsConfig(this, new ArrayList<>(processes), counts, effectiveCoupling);
        }
    }
}
