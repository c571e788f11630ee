package com.sem.lcs.io;

import com.sem.lcs.api.ExportException;
import com.sem.lcs.api.MeanSource;
import com.sem.lcs.api.Path;
import com.sem.lcs.api.PathKind;
import com.sem.lcs.api.Variable;
import com.sem.lcs.engine.ModelSpecification;
import com.sem.lcs.engine.PathStage;
import com.sem.lcs.util.VariableNames;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads equation text back into a {@link ModelSpecification}.
 *
 * <p>
 * The text is grouped by operator, so lines are first parsed into paths and
 * then stably sorted by {@link PathStage}; this restores the emission order of
 * the specification the text was rendered from. Lines starting with
 * {@code #} and blank lines are ignored.
 */
public final class EquationTextParser {
    private static final Pattern LINE = Pattern.compile("^\\s*(\\S+)\\s+(=~|~~|~)\\s+(\\S+)\\s*$");
    private static final Pattern START = Pattern.compile("start\\(([^)]*)\\)");
    private static final Pattern LABEL = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private EquationTextParser() {
        // Utility class
    }

    public static ModelSpecification parse(String name, String text) {
        return parse(name, List.of(text.split("\r?\n")));
    }

    /**
     * Parses lines as produced by
     * {@link EquationTextExporter#toEquationText}.
     *
     * @throws ExportException on a malformed line or unknown variable.
     */
    public static ModelSpecification parse(String name, List<String> lines) {
        record Parsed(PathStage stage, Path path) {
        }
        var parsed = new ArrayList<Parsed>(lines.size());
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            if (line.isBlank() || line.trim().startsWith("#"))
                continue;
            Path p = parseLine(line, i + 1);
            PathStage stage;
            try {
                stage = PathStage.classify(p);
            } catch (ExportException e) {
                throw ExportException.atLine(i + 1, e.getMessage());
            }
            parsed.add(new Parsed(stage, p));
        }
        // List.sort is stable: within a stage the text order is kept
        parsed.sort(Comparator.comparing(Parsed::stage));

        var builder = ModelSpecification.builder(name);
        for (Parsed p : parsed)
            builder.addPath(p.path());
        return builder.build();
    }

    static Path parseLine(String line, int lineNo) {
        Matcher m = LINE.matcher(line);
        if (!m.matches())
            throw ExportException.atLine(lineNo, "Expected '<lhs> <op> <term>': " + line);
        Variable lhs = resolve(m.group(1), lineNo);
        String op = m.group(2);
        String[] parts = m.group(3).split("\\*", -1);
        Variable rhs = resolve(parts[parts.length - 1], lineNo);

        Boolean free = null;
        double value = 0.0;
        String label = null;
        for (int i = 0; i < parts.length - 1; i++) {
            String mod = parts[i];
            Matcher sm = START.matcher(mod);
            if (sm.matches()) {
                free = Boolean.TRUE;
                value = number(sm.group(1), lineNo);
            } else if (LABEL.matcher(mod).matches()) {
                if (label != null)
                    throw ExportException.atLine(lineNo, "Two labels on one term");
                label = mod;
            } else {
                free = Boolean.FALSE;
                value = number(mod, lineNo);
            }
        }
        if (free == null)
            throw ExportException.atLine(lineNo, "Term needs a fixed value or a start value");

        return switch (op) {
            case "=~" -> new Path(lhs, rhs, PathKind.REGRESSION, free, value, label);
            case "~~" -> new Path(lhs, rhs, PathKind.COVARIANCE, free, value, label);
            default -> {
                if (lhs instanceof MeanSource)
                    throw ExportException.atLine(lineNo, "The mean source cannot be an outcome");
                yield new Path(rhs, lhs, PathKind.REGRESSION, free, value, label);
            }
        };
    }

    private static double number(String s, int lineNo) {
        try {
            return Double.parseDouble(s);
        } catch (NumberFormatException e) {
            throw ExportException.atLine(lineNo, "Bad number '" + s + "'");
        }
    }

    private static Variable resolve(String name, int lineNo) {
        Variable v = VariableNames.parse(name);
        if (v == null)
            throw ExportException.atLine(lineNo, "Unknown variable name '" + name + "'");
        return v;
    }
}
