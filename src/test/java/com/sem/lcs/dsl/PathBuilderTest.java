package com.sem.lcs.dsl;

import com.sem.lcs.api.ConfigException;
import com.sem.lcs.api.LatentRole;
import com.sem.lcs.api.LatentVariable;
import com.sem.lcs.api.MeanSource;
import com.sem.lcs.api.Path;
import com.sem.lcs.api.PathKind;
import com.sem.lcs.engine.ModelSpecification;
import com.sem.lcs.engine.PathStage;
import org.junit.Test;

import java.util.List;
import java.util.Map;

import static org.junit.Assert.*;

public class PathBuilderTest {

    private static LcsConfig univariate(int horizon) {
        return LcsConfig.builder().horizon(horizon).processes("Y").build();
    }

    private static LcsConfig bivariate(int horizon, boolean coupled, boolean stochastic) {
        return LcsConfig.builder().horizon(horizon).processes("X", "Y")
                .coupled(coupled).stochastic(stochastic).build();
    }

    private static boolean isUnit(Path p) {
        return !p.free() && p.value() == 1.0;
    }

    @Test
    public void testUnivariateDualChange() {
        ModelSpecification spec = PathBuilder.build(univariate(5));

        int levelToFirstState = spec.count(p -> p.kind() == PathKind.REGRESSION && isUnit(p)
                && p.from().equals(LatentVariable.level("Y")) && p.to().equals(LatentVariable.state("Y", 1)));
        assertEquals(1, levelToFirstState);

        int beta = spec.count(p -> "beta".equals(p.label()));
        assertEquals(4, beta);
        assertEquals(4, spec.paths(PathStage.SELF_FEEDBACK).size());
        assertEquals(4, spec.label("beta").members().size());
    }

    @Test
    public void testUnivariateStageCounts() {
        ModelSpecification spec = PathBuilder.build(univariate(5));
        Map<PathStage, Integer> c = spec.stageCounts();

        assertEquals(2, (int) c.get(PathStage.MEANS));
        assertEquals(3, (int) c.get(PathStage.INITIAL_COVARIANCE));
        assertEquals(5, (int) c.get(PathStage.LATENT_CHAIN)); // level->T1 plus 4 state->state
        assertEquals(4, (int) c.get(PathStage.ADDITIVE));
        assertEquals(4, (int) c.get(PathStage.SELF_FEEDBACK));
        assertEquals(0, (int) c.get(PathStage.COUPLING));
        assertEquals(4, (int) c.get(PathStage.CHANGE_TO_LATENT));
        assertEquals(5, (int) c.get(PathStage.MEASUREMENT));
        assertEquals(0, (int) c.get(PathStage.MEASUREMENT_INTERCEPT));
        assertEquals(5, (int) c.get(PathStage.MEASUREMENT_ERROR));
        assertEquals(0, (int) c.get(PathStage.INNOVATION));
        assertEquals(32, spec.pathCount());

        // structural part: 2 means + 3 initial + 5 chain + 4 additive + 4 feedback + 4 change-to-latent
        int structural = spec.count(p -> {
            PathStage s = PathStage.classify(p);
            return s != PathStage.MEASUREMENT && s != PathStage.MEASUREMENT_INTERCEPT
                    && s != PathStage.MEASUREMENT_ERROR;
        });
        assertEquals(22, structural);
    }

    @Test
    public void testUnivariateVariablesAndLabels() {
        ModelSpecification spec = PathBuilder.build(univariate(5));
        long states = spec.latents().stream().filter(v -> v.role() == LatentRole.STATE).count();
        long changes = spec.latents().stream().filter(v -> v.role() == LatentRole.CHANGE).count();
        assertEquals(5, states);
        assertEquals(4, changes);
        assertEquals(5, spec.manifests().size());

        List<String> labels = spec.labels().stream().map(l -> l.name()).toList();
        assertEquals(List.of("meany0", "meanya", "vary0", "varya", "covy0ya", "beta", "vare_y"), labels);
        assertEquals(5, spec.label("vare_y").members().size());
    }

    @Test
    public void testChangeScoreWiring() {
        ModelSpecification spec = PathBuilder.build(bivariate(4, true, false));
        for (String proc : List.of("X", "Y")) {
            for (int t = 2; t <= 4; t++) {
                LatentVariable change = LatentVariable.change(proc, t);
                List<Path> incoming = spec.paths().stream()
                        .filter(p -> p.kind() == PathKind.REGRESSION && p.to().equals(change)).toList();
                List<Path> outgoing = spec.paths().stream()
                        .filter(p -> p.kind() == PathKind.REGRESSION && p.from().equals(change)).toList();

                assertEquals(3, incoming.size());
                assertEquals(1, incoming.stream()
                        .filter(p -> p.from().equals(LatentVariable.slope(proc)) && isUnit(p)).count());
                assertEquals(1, incoming.stream()
                        .filter(p -> p.from().equals(LatentVariable.state(proc, change.time() - 1))).count());
                assertEquals(1, outgoing.size());
                assertEquals(LatentVariable.state(proc, t), outgoing.get(0).to());
                assertTrue(isUnit(outgoing.get(0)));
            }
        }
    }

    @Test
    public void testBivariateCoupledStochastic() {
        ModelSpecification spec = PathBuilder.build(bivariate(5, true, true));

        assertEquals(4, spec.count(p -> "gamma_x".equals(p.label())));
        assertEquals(4, spec.count(p -> "gamma_y".equals(p.label())));
        assertEquals(4, spec.count(p -> "covDer".equals(p.label())));
        assertEquals(4, spec.count(p -> "beta_x".equals(p.label())));
        assertEquals(4, spec.count(p -> "beta_y".equals(p.label())));
        assertEquals(4, spec.count(p -> "varDer_x".equals(p.label())));
        assertEquals(5, spec.count(p -> "covErr".equals(p.label())));
        assertEquals(93, spec.pathCount());

        // gamma_x: Y's previous state drives X's change
        for (Path p : spec.paths()) {
            if ("gamma_x".equals(p.label())) {
                assertEquals("Y", p.from().process());
                assertEquals("X", p.to().process());
            }
        }
    }

    @Test
    public void testCrossProcessInitialCovariances() {
        ModelSpecification spec = PathBuilder.build(bivariate(3, false, false));
        List<String> initial = spec.paths(PathStage.INITIAL_COVARIANCE).stream().map(Path::label).toList();
        assertEquals(List.of("varx0", "varxa", "covx0xa", "vary0", "varya", "covy0ya",
                "covx0y0", "covx0ya", "covxay0", "covxaya"), initial);
    }

    @Test
    public void testCouplingAddsOnlyCouplingRegressions() {
        int horizon = 6;
        ModelSpecification plain = PathBuilder.build(bivariate(horizon, false, false));
        ModelSpecification coupled = PathBuilder.build(bivariate(horizon, true, false));

        assertEquals(2 * (horizon - 1), coupled.pathCount() - plain.pathCount());
        int plainRegressions = plain.count(p -> p.kind() == PathKind.REGRESSION);
        int coupledRegressions = coupled.count(p -> p.kind() == PathKind.REGRESSION);
        assertEquals(2 * (horizon - 1), coupledRegressions - plainRegressions);

        var withoutCoupling = coupled.paths().stream()
                .filter(p -> PathStage.classify(p) != PathStage.COUPLING).toList();
        assertEquals(plain.paths(), withoutCoupling);
    }

    @Test
    public void testStochasticAddsInnovations() {
        int horizon = 5;
        ModelSpecification uni = PathBuilder.build(univariate(horizon));
        ModelSpecification uniStoch = PathBuilder.build(univariate(horizon).withStochastic(true));
        assertEquals(horizon - 1, uniStoch.pathCount() - uni.pathCount());
        assertEquals(uni.paths(), uniStoch.paths().subList(0, uni.pathCount()));
        assertEquals(horizon - 1, uniStoch.count(p -> "varDer".equals(p.label())));

        ModelSpecification bi = PathBuilder.build(bivariate(horizon, true, false));
        ModelSpecification biStoch = PathBuilder.build(bivariate(horizon, true, true));
        // per-process innovation variances plus one covariance per occasion
        assertEquals(2 * (horizon - 1) + (horizon - 1), biStoch.pathCount() - bi.pathCount());
        assertEquals(bi.paths(), biStoch.paths().subList(0, bi.pathCount()));
        assertEquals(horizon - 1, biStoch.count(p -> p.kind() == PathKind.COVARIANCE
                && PathStage.classify(p) == PathStage.INNOVATION && !p.isVariance()));
    }

    @Test
    public void testUncoupledStochasticHasNoInnovationCovariance() {
        ModelSpecification spec = PathBuilder.build(bivariate(4, false, true));
        assertEquals(0, spec.count(p -> "covDer".equals(p.label())));
        assertEquals(6, spec.paths(PathStage.INNOVATION).size());
    }

    @Test
    public void testMultiIndicatorStrongInvariance() {
        LcsConfig cfg = LcsConfig.builder().horizon(4).processes("Y").indicators("Y", 3).build();
        ModelSpecification spec = PathBuilder.build(cfg);

        // level mean fixed at zero, only the slope mean is estimated
        List<Path> means = spec.paths(PathStage.MEANS);
        assertEquals(1, means.size());
        assertEquals(LatentVariable.slope("Y"), means.get(0).to());

        List<Path> loadings = spec.paths(PathStage.MEASUREMENT);
        assertEquals(12, loadings.size());
        assertEquals(4, loadings.stream().filter(p -> !p.free()).count());
        assertEquals(4, spec.label("lambda_y2").members().size());
        assertEquals(4, spec.label("lambda_y3").members().size());
        assertNull(spec.label("lambda_y1"));

        assertEquals(12, spec.paths(PathStage.MEASUREMENT_INTERCEPT).size());
        assertEquals(4, spec.label("nu_y1").members().size());
        assertEquals(4, spec.label("vare_y3").members().size());
        assertEquals(0, spec.count(p -> "covErr".equals(p.label())));
    }

    @Test
    public void testMultiIndicatorLevelMeanOverride() {
        LcsConfig cfg = LcsConfig.builder().horizon(3).processes("Y").indicators("Y", 2)
                .levelMeanFixed(false).build();
        ModelSpecification spec = PathBuilder.build(cfg);
        assertNotNull(spec.label("meany0"));
        assertEquals(2, spec.paths(PathStage.MEANS).size());
    }

    @Test
    public void testMixedIndicatorCountsHaveNoErrorCovariance() {
        LcsConfig cfg = LcsConfig.builder().horizon(3).processes("X", "Y").indicators("Y", 2).build();
        ModelSpecification spec = PathBuilder.build(cfg);
        assertNull(spec.label("covErr"));
        assertNotNull(spec.label("vare_x"));
        assertNotNull(spec.label("vare_y2"));
        // X keeps a free level mean, Y's is fixed
        assertNotNull(spec.label("meanx0"));
        assertNull(spec.label("meany0"));
    }

    @Test
    public void testMeansComeFromMeanSource() {
        ModelSpecification spec = PathBuilder.build(univariate(3));
        for (Path p : spec.paths(PathStage.MEANS)) {
            assertSame(MeanSource.INSTANCE, p.from());
            assertTrue(p.isMean());
            assertTrue(p.free());
        }
    }

    @Test
    public void testCovarianceOfVariableWithItselfIsRejected() {
        PathBuilder builder = PathBuilder.create(univariate(3));
        LatentVariable y0 = builder.variables().level(0);
        try {
            builder.covariance(y0, y0, 0.0, "bad");
            fail("Expected ConfigException");
        } catch (ConfigException e) {
            assertTrue(e.getMessage().contains("variance"));
        }
    }

    @Test(expected = IllegalStateException.class)
    public void testBuilderIsSingleUse() {
        PathBuilder builder = PathBuilder.create(univariate(3));
        builder.build();
        builder.build();
    }

    @Test
    public void testDeterministicBuilds() {
        LcsConfig cfg = bivariate(7, true, true);
        assertEquals(PathBuilder.build(cfg), PathBuilder.build(cfg));
        assertEquals(PathBuilder.build(cfg).paths(), PathBuilder.build(cfg).paths());
    }

    @Test
    public void testStageOrderIsMonotonic() {
        ModelSpecification spec = PathBuilder.build(bivariate(4, true, true));
        PathStage last = PathStage.MEANS;
        for (Path p : spec.paths()) {
            PathStage s = PathStage.classify(p);
            assertTrue("Out of order: " + p, s.compareTo(last) >= 0);
            last = s;
        }
    }
}
