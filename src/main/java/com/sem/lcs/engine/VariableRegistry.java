package com.sem.lcs.engine;

import com.sem.lcs.api.ConfigException;
import com.sem.lcs.api.LatentVariable;
import com.sem.lcs.api.ManifestVariable;
import com.sem.lcs.api.Variable;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

import lombok.extern.log4j.Log4j2;

/**
 * Allocates the latent and manifest variables of a latent change score model.
 *
 * <p>
 * For each process the registry emits, in this order: the initial level, the
 * initial slope, {@code State(1..T)}, {@code Change(2..T)} and one manifest
 * per indicator per occasion. A process with a single indicator gets
 * manifests named after the process.
 */
@Log4j2
public final class VariableRegistry {
    /** Process ids are upper-case letters so that every derived name is reversible. */
    public static final Pattern PROCESS_ID = Pattern.compile("[A-Z]+");

    private VariableRegistry() {
        // Utility class
    }

    /**
     * Allocates all variables for the given processes.
     *
     * @param processes  Ordered process ids.
     * @param horizon    Number of occasions T, at least 2.
     * @param indicators Indicator count per process, each at least 1.
     * @return The allocated, immutable variable set.
     * @throws ConfigException on an invalid horizon, process id or indicator count.
     */
    public static VariableSet allocate(List<String> processes, int horizon, Map<String, Integer> indicators) {
        if (horizon < 2)
            throw new ConfigException("Horizon must be at least 2 to define a change score, got " + horizon);
        if (processes == null || processes.isEmpty())
            throw new ConfigException("At least one process is required");
        var seen = new HashSet<String>();
        for (String p : processes) {
            if (p == null || !PROCESS_ID.matcher(p).matches())
                throw new ConfigException("Process id must match " + PROCESS_ID.pattern() + ": " + p);
            if (!seen.add(p))
                throw new ConfigException("Duplicate process id: " + p);
        }

        int n = processes.size();
        int[] counts = new int[n];
        for (int p = 0; p < n; p++) {
            Integer c = indicators == null ? null : indicators.get(processes.get(p));
            if (c == null || c < 1)
                throw new ConfigException("Process " + processes.get(p) + " needs at least one indicator, got " + c);
            counts[p] = c;
        }

        var levels = new LatentVariable[n];
        var slopes = new LatentVariable[n];
        var states = new LatentVariable[n][horizon + 1];
        var changes = new LatentVariable[n][horizon + 1];
        var manifests = new ManifestVariable[n][][];
        Map<String, Variable> byName = new HashMap<>();
        List<Variable> order = new ArrayList<>();

        for (int p = 0; p < n; p++) {
            String id = processes.get(p);
            levels[p] = register(LatentVariable.level(id), byName, order);
            slopes[p] = register(LatentVariable.slope(id), byName, order);
            for (int t = 1; t <= horizon; t++)
                states[p][t] = register(LatentVariable.state(id, t), byName, order);
            for (int t = 2; t <= horizon; t++)
                changes[p][t] = register(LatentVariable.change(id, t), byName, order);

            boolean single = counts[p] == 1;
            manifests[p] = new ManifestVariable[counts[p] + 1][horizon + 1];
            for (int k = 1; k <= counts[p]; k++)
                for (int t = 1; t <= horizon; t++)
                    manifests[p][k][t] = register(new ManifestVariable(id, k, t, single), byName, order);
        }

        log.trace("Allocated {} variables for processes {} over {} occasions", order.size(), processes, horizon);
        return new VariableSet(processes, horizon, counts, levels, slopes, states, changes, manifests, byName, order);
    }

    private static <V extends Variable> V register(V v, Map<String, Variable> byName, List<Variable> order) {
        if (byName.putIfAbsent(v.name(), v) != null)
            throw new ConfigException("Duplicate variable name: " + v.name());
        order.add(v);
        return v;
    }
}
