package com.sem.lcs.engine;

import com.sem.lcs.api.LatentVariable;
import com.sem.lcs.api.ManifestVariable;
import com.sem.lcs.api.Variable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Variables allocated for one configuration, indexed by process position,
 * indicator and occasion rather than by name.
 *
 * Immutable after {@link VariableRegistry#allocate} returns it.
 */
public final class VariableSet {
    private final List<String> processes;
    private final int horizon;
    private final int[] indicatorCounts;

    // [process]
    private final LatentVariable[] levels;
    private final LatentVariable[] slopes;
    // [process][time], index 0 unused; changes also leave index 1 unused
    private final LatentVariable[][] states;
    private final LatentVariable[][] changes;
    // [process][indicator][time], indicator and time 1-based
    private final ManifestVariable[][][] manifests;

    private final Map<String, Variable> byName;
    private final List<Variable> allocationOrder;

    VariableSet(List<String> processes, int horizon, int[] indicatorCounts,
            LatentVariable[] levels, LatentVariable[] slopes,
            LatentVariable[][] states, LatentVariable[][] changes,
            ManifestVariable[][][] manifests, Map<String, Variable> byName,
            List<Variable> allocationOrder) {
        this.processes = List.copyOf(processes);
        this.horizon = horizon;
        this.indicatorCounts = indicatorCounts;
        this.levels = levels;
        this.slopes = slopes;
        this.states = states;
        this.changes = changes;
        this.manifests = manifests;
        this.byName = byName;
        this.allocationOrder = Collections.unmodifiableList(new ArrayList<>(allocationOrder));
    }

    public List<String> processes() {
        return processes;
    }

    public int processCount() {
        return processes.size();
    }

    public String process(int p) {
        return processes.get(p);
    }

    public int horizon() {
        return horizon;
    }

    public int indicatorCount(int p) {
        return indicatorCounts[p];
    }

    public LatentVariable level(int p) {
        return levels[p];
    }

    public LatentVariable slope(int p) {
        return slopes[p];
    }

    /** State of process {@code p} at occasion {@code t}, t in [1, T]. */
    public LatentVariable state(int p, int t) {
        checkTime(t, 1);
        return states[p][t];
    }

    /** Change of process {@code p} into occasion {@code t}, t in [2, T]. */
    public LatentVariable change(int p, int t) {
        checkTime(t, 2);
        return changes[p][t];
    }

    public ManifestVariable manifest(int p, int indicator, int t) {
        checkTime(t, 1);
        if (indicator < 1 || indicator > indicatorCounts[p])
            throw new IndexOutOfBoundsException("Indicator " + indicator + " of process " + process(p));
        return manifests[p][indicator][t];
    }

    /** Looks a variable up by its rendered name, or {@code null}. */
    public Variable byName(String name) {
        return byName.get(name);
    }

    public boolean contains(String name) {
        return byName.containsKey(name);
    }

    /** Every variable in allocation order. */
    public List<Variable> all() {
        return allocationOrder;
    }

    /** Occasions per process, the same for every process. */
    public int stateCount() {
        return horizon;
    }

    public int changeCount() {
        return horizon - 1;
    }

    public int manifestCount(int p) {
        return horizon * indicatorCounts[p];
    }

    private void checkTime(int t, int first) {
        if (t < first || t > horizon)
            throw new IndexOutOfBoundsException("Occasion " + t + " outside [" + first + ", " + horizon + "]");
    }
}
