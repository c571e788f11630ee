package com.sem.lcs.util;

import com.sem.lcs.api.Path;
import com.sem.lcs.api.PathKind;
import com.sem.lcs.api.Variable;
import com.sem.lcs.engine.ModelSpecification;
import com.sem.lcs.engine.PathStage;

import java.util.Map;

/**
 * Diagnostic utility for inspecting a built specification.
 *
 * <p>
 * Generates human-readable summaries for logs and debugging sessions. Not
 * one of the external forms: use the exporters for anything an engine reads.
 */
public final class SpecExplain {
    private final ModelSpecification spec;

    public SpecExplain(ModelSpecification spec) {
        this.spec = spec;
    }

    /**
     * Dumps one variable: its kind and every path touching it.
     */
    public String explainVariable(String name) {
        Variable v = spec.variable(name);
        if (v == null)
            throw new IllegalArgumentException("Unknown variable: " + name);
        StringBuilder sb = new StringBuilder(256);
        sb.append("Variable: ").append(name).append('\n')
                .append("  Type: ").append(v.getClass().getSimpleName()).append('\n')
                .append("  Process: ").append(v.process()).append('\n');
        int in = 0, out = 0;
        StringBuilder edges = new StringBuilder();
        for (Path p : spec.paths()) {
            if (p.to().equals(v) && p.kind() == PathKind.REGRESSION) {
                in++;
                edges.append("    <- ").append(p).append('\n');
            } else if (p.from().equals(v) && p.kind() == PathKind.REGRESSION) {
                out++;
                edges.append("    -> ").append(p).append('\n');
            } else if (p.kind() == PathKind.COVARIANCE && (p.from().equals(v) || p.to().equals(v))) {
                edges.append("    <> ").append(p).append('\n');
            }
        }
        sb.append("  Incoming: ").append(in).append(", outgoing: ").append(out).append('\n');
        return sb.append(edges).toString();
    }

    /** One line per stage with its path count, plus totals. */
    public String summary() {
        StringBuilder sb = new StringBuilder(512);
        sb.append("Model '").append(spec.name()).append("' processes=").append(spec.processes())
                .append(" variables=").append(spec.variables().size())
                .append(" paths=").append(spec.pathCount())
                .append(" labels=").append(spec.labels().size()).append('\n');
        for (Map.Entry<PathStage, Integer> e : spec.stageCounts().entrySet())
            if (e.getValue() > 0)
                sb.append("  ").append(e.getKey()).append(": ").append(e.getValue()).append('\n');
        return sb.toString();
    }

    /** Every path with its index and stage. */
    public String dumpPaths() {
        StringBuilder sb = new StringBuilder(64 * spec.pathCount());
        sb.append("Specification (").append(spec.pathCount()).append(" paths):\n");
        int i = 0;
        for (Path p : spec.paths()) {
            sb.append("  [").append(i++).append("] ").append(PathStage.classify(p)).append(' ').append(p)
                    .append('\n');
        }
        return sb.toString();
    }
}
