package com.sem.lcs.io;

import com.sem.lcs.api.Path;
import com.sem.lcs.engine.ModelSpecification;
import com.sem.lcs.engine.PathStage;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Renders a specification as equation text, grouped by operator.
 *
 * <pre>
 * # regressions
 * lY_T1 ~ 1.0*y0
 * dY_T2 ~ start(0.0)*beta*lY_T1
 * # loadings
 * lY_T1 =~ 1.0*Y_T1
 * # intercepts
 * y0 ~ start(0.0)*meany0*1
 * # covariances
 * y0 ~~ start(1.0)*vary0*y0
 * </pre>
 *
 * Every term carries its value, either as a fixed constant ({@code 1.0*}) or a
 * start value ({@code start(0.0)*}), followed by the label if any, so the text
 * holds exactly the information of the path-list form. Within a group, lines
 * keep emission order.
 */
public final class EquationTextExporter {

    private EquationTextExporter() {
        // Utility class
    }

    /**
     * Produces the lines, including one {@code # group} header per non-empty
     * group.
     *
     * @throws com.sem.lcs.api.ExportException if a path does not belong to any
     *         stage.
     */
    public static List<String> toEquationText(ModelSpecification spec) {
        Map<EquationGroup, List<String>> groups = new EnumMap<>(EquationGroup.class);
        for (EquationGroup g : EquationGroup.values())
            groups.put(g, new ArrayList<>());
        for (Path p : spec.paths()) {
            EquationGroup g = EquationGroup.of(PathStage.classify(p));
            groups.get(g).add(line(g, p));
        }

        var out = new ArrayList<String>(spec.pathCount() + groups.size());
        for (var e : groups.entrySet()) {
            if (e.getValue().isEmpty())
                continue;
            out.add("# " + e.getKey().header());
            out.addAll(e.getValue());
        }
        return out;
    }

    public static String toText(ModelSpecification spec) {
        return String.join("\n", toEquationText(spec)) + "\n";
    }

    static String line(EquationGroup g, Path p) {
        String lhs;
        String rhs;
        switch (g) {
            case LOADINGS, COVARIANCES -> {
                lhs = p.from().name();
                rhs = p.to().name();
            }
            case INTERCEPTS -> {
                lhs = p.to().name();
                rhs = "1";
            }
            default -> {
                lhs = p.to().name();
                rhs = p.from().name();
            }
        }
        var sb = new StringBuilder(48);
        sb.append(lhs).append(' ').append(g.operator()).append(' ');
        if (p.free())
            sb.append("start(").append(p.value()).append(")*");
        else
            sb.append(p.value()).append('*');
        if (p.hasLabel())
            sb.append(p.label()).append('*');
        return sb.append(rhs).toString();
    }
}
