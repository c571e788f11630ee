package com.sem.lcs.io;

import com.sem.lcs.dsl.LcsConfig;
import com.sem.lcs.dsl.PathBuilder;
import com.sem.lcs.engine.ModelSpecification;
import com.sem.lcs.util.InvariancePolicy;
import org.junit.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.junit.Assert.*;

public class RoundTripTest {

    private static List<LcsConfig> configurations() {
        return List.of(
                LcsConfig.builder().horizon(5).processes("Y").build(),
                LcsConfig.builder().horizon(5).processes("Y").stochastic(true).build(),
                LcsConfig.builder().horizon(5).processes("X", "Y").coupled(true).stochastic(true).build(),
                LcsConfig.builder().horizon(3).processes("X", "Y").indicators("X", 2).build(),
                LcsConfig.builder().horizon(4).processes("Y").indicators("Y", 3).build(),
                LcsConfig.builder().horizon(4).processes("Y").indicators("Y", 3)
                        .invariance(InvariancePolicy.CONFIGURAL).build(),
                LcsConfig.builder().horizon(6).processes("COG", "NEU").indicators("COG", 3).indicators("NEU", 3)
                        .invariance(InvariancePolicy.WEAK).coupled(true).stochastic(true).build());
    }

    @Test
    public void testPathListRoundTrip() {
        for (LcsConfig cfg : configurations()) {
            ModelSpecification spec = PathBuilder.build(cfg);
            ModelSpecification parsed = PathListParser.parse(cfg.name(), PathListExporter.toText(spec));
            assertEquals(cfg.toString(), spec, parsed);
        }
    }

    @Test
    public void testPathListJsonRoundTrip() {
        for (LcsConfig cfg : configurations()) {
            ModelSpecification spec = PathBuilder.build(cfg);
            assertEquals(cfg.toString(), spec, PathListParser.parseJson(cfg.name(), PathListExporter.toJson(spec)));
        }
    }

    @Test
    public void testEquationTextRoundTrip() {
        for (LcsConfig cfg : configurations()) {
            ModelSpecification spec = PathBuilder.build(cfg);
            ModelSpecification parsed = EquationTextParser.parse(cfg.name(), EquationTextExporter.toText(spec));
            assertEquals(cfg.toString(), spec, parsed);
        }
    }

    @Test
    public void testBothFormsDescribeTheSameGraph() {
        for (LcsConfig cfg : configurations()) {
            ModelSpecification spec = PathBuilder.build(cfg);
            ModelSpecification fromPaths = PathListParser.parse("a", PathListExporter.toText(spec));
            ModelSpecification fromEquations = EquationTextParser.parse("b", EquationTextExporter.toEquationText(spec));
            assertEquals(fromPaths, fromEquations);
            assertEquals(PathListExporter.toText(fromPaths), PathListExporter.toText(fromEquations));
        }
    }

    @Test
    public void testEquationOrderWithinGroupsIsRestoredFromStages() {
        LcsConfig cfg = LcsConfig.builder().horizon(3).processes("X", "Y").coupled(true).build();
        ModelSpecification spec = PathBuilder.build(cfg);
        // Reverse the groups; stage classification still restores emission order
        List<String> lines = EquationTextExporter.toEquationText(spec);
        List<List<String>> groups = new ArrayList<>();
        for (String line : lines) {
            if (line.startsWith("#"))
                groups.add(new ArrayList<>());
            groups.get(groups.size() - 1).add(line);
        }
        Collections.reverse(groups);
        List<String> shuffled = new ArrayList<>();
        groups.forEach(shuffled::addAll);

        assertEquals(spec, EquationTextParser.parse("r", shuffled));
    }
}
