package com.sem.lcs.engine;

import com.sem.lcs.api.ConfigException;
import com.sem.lcs.api.LabelConflictException;
import com.sem.lcs.api.LabelId;
import com.sem.lcs.api.LatentVariable;
import com.sem.lcs.api.ManifestVariable;
import com.sem.lcs.api.MeanSource;
import com.sem.lcs.api.ParameterLabel;
import com.sem.lcs.api.Path;
import com.sem.lcs.api.PathId;
import com.sem.lcs.api.Variable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * Immutable latent change score model: processes, variables, paths and
 * parameter labels for one configuration.
 *
 * <p>
 * Paths keep their emission order, which is the canonical order defined by
 * {@link PathStage}. Variables are kept in canonical order (process, role,
 * indicator, occasion) regardless of how they were discovered, so a
 * specification parsed back from text equals the one it was rendered from.
 * The name is descriptive only and takes no part in equality.
 *
 * <p>
 * Thread safety: instances are deeply immutable and may be shared freely.
 */
public final class ModelSpecification {
    private final String name;
    private final List<String> processes;
    private final List<Variable> variables;
    private final List<Path> paths;
    private final List<ParameterLabel> labels;
    private final Map<String, ParameterLabel> labelsByName;
    private final Map<String, Variable> variablesByName;

    private ModelSpecification(String name, List<String> processes, List<Variable> variables, List<Path> paths,
            List<ParameterLabel> labels) {
        this.name = name;
        this.processes = List.copyOf(processes);
        this.variables = List.copyOf(variables);
        this.paths = List.copyOf(paths);
        this.labels = List.copyOf(labels);
        var lbn = new LinkedHashMap<String, ParameterLabel>();
        for (ParameterLabel l : labels)
            lbn.put(l.name(), l);
        this.labelsByName = Collections.unmodifiableMap(lbn);
        var vbn = new LinkedHashMap<String, Variable>();
        for (Variable v : variables)
            vbn.put(v.name(), v);
        this.variablesByName = Collections.unmodifiableMap(vbn);
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public String name() {
        return name;
    }

    public List<String> processes() {
        return processes;
    }

    public List<Variable> variables() {
        return variables;
    }

    public List<LatentVariable> latents() {
        var out = new ArrayList<LatentVariable>();
        for (Variable v : variables)
            if (v instanceof LatentVariable l)
                out.add(l);
        return out;
    }

    public List<ManifestVariable> manifests() {
        var out = new ArrayList<ManifestVariable>();
        for (Variable v : variables)
            if (v instanceof ManifestVariable m)
                out.add(m);
        return out;
    }

    /** Looks up a variable by rendered name, or {@code null}. */
    public Variable variable(String name) {
        return variablesByName.get(name);
    }

    public List<Path> paths() {
        return paths;
    }

    public Path path(PathId id) {
        return paths.get(id.index());
    }

    public int pathCount() {
        return paths.size();
    }

    public int count(Predicate<Path> filter) {
        int n = 0;
        for (Path p : paths)
            if (filter.test(p))
                n++;
        return n;
    }

    public List<Path> paths(PathStage stage) {
        var out = new ArrayList<Path>();
        for (Path p : paths)
            if (PathStage.classify(p) == stage)
                out.add(p);
        return out;
    }

    /** Number of paths per stage, every stage present. */
    public Map<PathStage, Integer> stageCounts() {
        var counts = new EnumMap<PathStage, Integer>(PathStage.class);
        for (PathStage s : PathStage.values())
            counts.put(s, 0);
        for (Path p : paths)
            counts.merge(PathStage.classify(p), 1, Integer::sum);
        return counts;
    }

    public List<ParameterLabel> labels() {
        return labels;
    }

    /** Label by name, or {@code null}. */
    public ParameterLabel label(String name) {
        return labelsByName.get(name);
    }

    /**
     * Returns a builder seeded with this specification's paths, for overlays
     * that append to an existing model.
     */
    public Builder toBuilder() {
        var b = new Builder(name);
        for (Variable v : variables)
            b.addVariable(v);
        for (Path p : paths)
            b.addPath(p);
        return b;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof ModelSpecification other))
            return false;
        return processes.equals(other.processes) && variables.equals(other.variables)
                && paths.equals(other.paths) && labels.equals(other.labels);
    }

    @Override
    public int hashCode() {
        return Objects.hash(processes, variables, paths, labels);
    }

    @Override
    public String toString() {
        return "ModelSpecification[" + name + ", " + variables.size() + " variables, " + paths.size()
                + " paths, " + labels.size() + " labels]";
    }

    /**
     * Accumulates paths in emission order and freezes them into a
     * {@link ModelSpecification}. Single use.
     */
    public static final class Builder {
        private final String name;
        private final Map<String, Variable> variables = new LinkedHashMap<>();
        private final List<Path> paths = new ArrayList<>();
        private final LabelRegistry labels;
        private VariableSet allocated;
        private boolean built;

        private Builder(String name) {
            this.name = name;
            this.labels = new LabelRegistry(n -> variables.containsKey(n) || MeanSource.NAME.equals(n));
        }

        /**
         * Restricts path endpoints to an allocated variable set and registers
         * its variables.
         */
        public Builder withVariables(VariableSet set) {
            checkNotBuilt();
            this.allocated = set;
            for (Variable v : set.all())
                addVariable(v);
            return this;
        }

        public Builder addVariable(Variable v) {
            checkNotBuilt();
            if (v instanceof MeanSource)
                return this;
            Variable prev = variables.putIfAbsent(v.name(), v);
            if (prev != null && !prev.equals(v))
                throw new ConfigException("Two variables share the name " + v.name());
            return this;
        }

        /**
         * Appends a path, interning its label.
         *
         * @return The id of the new path.
         * @throws LabelConflictException if the label is already used
         *                                incompatibly.
         */
        public PathId addPath(Path path) {
            checkNotBuilt();
            endpoint(path.from());
            endpoint(path.to());
            LabelId label = path.hasLabel() ? labels.intern(path.label(), path.kind(), path.free()) : null;
            var id = new PathId(paths.size());
            paths.add(path);
            if (label != null)
                labels.attach(label, id);
            return id;
        }

        public LabelRegistry labels() {
            return labels;
        }

        public int pathCount() {
            return paths.size();
        }

        public ModelSpecification build() {
            checkNotBuilt();
            built = true;
            for (ParameterLabel l : labels.labels())
                if (variables.containsKey(l.name()))
                    throw new LabelConflictException(l.name(), "clashes with a variable of the same name");

            List<String> processes = new ArrayList<>();
            for (Variable v : variables.values())
                if (!processes.contains(v.process()))
                    processes.add(v.process());
            List<Variable> sorted = new ArrayList<>(variables.values());
            sorted.sort(canonicalOrder(processes));
            return new ModelSpecification(name, processes, sorted, paths, labels.labels());
        }

        private void endpoint(Variable v) {
            if (v instanceof MeanSource)
                return;
            if (allocated != null && allocated.byName(v.name()) == null)
                throw new ConfigException("Path endpoint " + v.name() + " was not allocated");
            addVariable(v);
        }

        private void checkNotBuilt() {
            if (built)
                throw new IllegalStateException("Specification already built");
        }
    }

    /** Process position, then role (manifests last), indicator, occasion. */
    static Comparator<Variable> canonicalOrder(List<String> processes) {
        return Comparator.<Variable>comparingInt(v -> processes.indexOf(v.process()))
                .thenComparingInt(ModelSpecification::category)
                .thenComparingInt(v -> v instanceof ManifestVariable m ? m.indicator() : 0)
                .thenComparingInt(v -> v instanceof ManifestVariable m ? m.time() : ((LatentVariable) v).time());
    }

    private static int category(Variable v) {
        if (v instanceof LatentVariable l)
            return l.role().ordinal();
        return Integer.MAX_VALUE;
    }
}
