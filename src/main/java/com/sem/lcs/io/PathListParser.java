package com.sem.lcs.io;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sem.lcs.api.ExportException;
import com.sem.lcs.api.Path;
import com.sem.lcs.api.PathKind;
import com.sem.lcs.api.Variable;
import com.sem.lcs.engine.ModelSpecification;
import com.sem.lcs.util.VariableNames;

import java.util.ArrayList;
import java.util.List;

/**
 * Reads the path-list form back into a {@link ModelSpecification}. Rows are
 * taken in the order given; labels are re-interned, so conflicting rows fail
 * with {@link com.sem.lcs.api.LabelConflictException}.
 */
public final class PathListParser {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private PathListParser() {
        // Utility class
    }

    /** Parses the tab-separated text written by {@link PathListExporter#render}. */
    public static ModelSpecification parse(String name, String text) {
        List<PathRow> rows = new ArrayList<>();
        String[] lines = text.split("\r?\n");
        for (int i = 0; i < lines.length; i++) {
            String line = lines[i];
            if (line.isBlank() || line.startsWith("#") || line.equals(PathRow.HEADER))
                continue;
            String[] cols = line.split(PathRow.SEPARATOR, -1);
            if (cols.length != 6)
                throw ExportException.atLine(i + 1, "Expected 6 tab-separated columns, got " + cols.length);
            try {
                rows.add(new PathRow(cols[0], cols[1], Integer.parseInt(cols[2]), Integer.parseInt(cols[3]),
                        Double.parseDouble(cols[4]), cols[5]));
            } catch (NumberFormatException e) {
                throw new ExportException("Bad number (line " + (i + 1) + "): " + e.getMessage(), e);
            }
        }
        return parse(name, rows);
    }

    /** Parses the JSON array written by {@link PathListExporter#toJson}. */
    public static ModelSpecification parseJson(String name, String json) {
        try {
            return parse(name, MAPPER.readValue(json, new TypeReference<List<PathRow>>() {
            }));
        } catch (JsonProcessingException e) {
            throw new ExportException("Malformed path-list JSON: " + e.getOriginalMessage(), e);
        }
    }

    /** Builds a specification from rows. */
    public static ModelSpecification parse(String name, List<PathRow> rows) {
        var builder = ModelSpecification.builder(name);
        int n = 0;
        for (PathRow r : rows) {
            n++;
            Variable from = resolve(r.from(), n);
            Variable to = resolve(r.to(), n);
            PathKind kind;
            try {
                kind = PathKind.fromArrows(r.arrows());
            } catch (IllegalArgumentException e) {
                throw ExportException.atLine(n, e.getMessage());
            }
            if (r.free() != 0 && r.free() != 1)
                throw ExportException.atLine(n, "free must be 0 or 1, got " + r.free());
            builder.addPath(new Path(from, to, kind, r.free() == 1, r.value(), r.label()));
        }
        return builder.build();
    }

    private static Variable resolve(String name, int row) {
        Variable v = VariableNames.parse(name);
        if (v == null)
            throw ExportException.atLine(row, "Unknown variable name '" + name + "'");
        return v;
    }
}
