package com.sem.lcs.io;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.sem.lcs.api.ExportException;
import com.sem.lcs.api.Path;
import com.sem.lcs.engine.ModelSpecification;
import com.sem.lcs.engine.PathStage;

import java.util.ArrayList;
import java.util.List;

/**
 * Renders a specification in the RAM path-list form: one row per path, in
 * emission order.
 *
 * <pre>
 * from    to      arrows  free    value   label
 * one     y0      1       1       0.0     meany0
 * y0      lY_T1   1       0       1.0
 * </pre>
 *
 * Stateless; safe to call from any thread.
 */
public final class PathListExporter {
    private static final ObjectMapper MAPPER = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    private PathListExporter() {
        // Utility class
    }

    /**
     * Converts every path to a row.
     *
     * @throws ExportException if a path does not belong to any stage.
     */
    public static List<PathRow> toPathList(ModelSpecification spec) {
        var rows = new ArrayList<PathRow>(spec.pathCount());
        for (Path p : spec.paths()) {
            PathStage.classify(p);
            rows.add(new PathRow(p.from().name(), p.to().name(), p.kind().arrows(), p.free() ? 1 : 0,
                    p.value(), p.label()));
        }
        return rows;
    }

    /** Header line plus one tab-separated line per row, newline terminated. */
    public static String render(List<PathRow> rows) {
        var sb = new StringBuilder(64 * (rows.size() + 1));
        sb.append(PathRow.HEADER).append('\n');
        for (PathRow r : rows)
            sb.append(r.toLine()).append('\n');
        return sb.toString();
    }

    public static String toText(ModelSpecification spec) {
        return render(toPathList(spec));
    }

    /** The rows as a JSON array, for engines that take structured input. */
    public static String toJson(ModelSpecification spec) {
        try {
            return MAPPER.writeValueAsString(toPathList(spec));
        } catch (JsonProcessingException e) {
            throw new ExportException("Failed to serialize path list of " + spec.name(), e);
        }
    }
}
