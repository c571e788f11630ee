package com.sem.lcs.io;

import com.sem.lcs.api.ConfigException;
import com.sem.lcs.dsl.LcsConfig;
import com.sem.lcs.dsl.PathBuilder;
import com.sem.lcs.util.InvariancePolicy;
import org.junit.Test;

import java.net.URISyntaxException;
import java.nio.file.Path;
import java.nio.file.Paths;

import static org.junit.Assert.*;

public class ModelDefinitionLoaderTest {

    static Path resource(String name) throws URISyntaxException {
        return Paths.get(ModelDefinitionLoaderTest.class.getResource("/" + name).toURI());
    }

    @Test
    public void testLoadBivariateFile() throws Exception {
        LcsConfig cfg = ModelDefinitionLoader.load(resource("bivariate_coupled.json"));
        assertEquals("bivariate_coupled", cfg.name());
        assertEquals(5, cfg.horizon());
        assertEquals(java.util.List.of("X", "Y"), cfg.processes());
        assertTrue(cfg.coupled());
        assertTrue(cfg.stochastic());
        assertSame(InvariancePolicy.STRONG, cfg.policy());
        assertEquals(93, PathBuilder.build(cfg).pathCount());
    }

    @Test
    public void testLoadMultiIndicatorFileIgnoresUnknownKeys() throws Exception {
        LcsConfig cfg = ModelDefinitionLoader.load(resource("multi_indicator.json"));
        assertEquals(3, cfg.indicatorCount("Y"));
        assertSame(InvariancePolicy.WEAK, cfg.policy());
        assertTrue(cfg.fixesLevelMean("Y"));
        assertFalse(cfg.coupled());
        assertNull(PathBuilder.build(cfg).label("meany0"));
    }

    @Test
    public void testDefaultsFromMinimalDefinition() {
        LcsConfig cfg = ModelDefinitionLoader.toConfig(ModelDefinitionLoader.parse(
                "{\"model\": {\"horizon\": 3, \"processes\": [\"Y\"]}}"));
        assertEquals("lcs", cfg.name());
        assertEquals(1, cfg.indicatorCount("Y"));
        assertSame(InvariancePolicy.DEFAULT, cfg.policy());
        assertFalse(cfg.stochastic());
    }

    @Test
    public void testInvarianceIsCaseInsensitive() {
        LcsConfig cfg = ModelDefinitionLoader.toConfig(ModelDefinitionLoader.parse(
                "{\"model\": {\"horizon\": 3, \"processes\": [\"Y\"], \"invariance\": \"Configural\"}}"));
        assertSame(InvariancePolicy.CONFIGURAL, cfg.policy());
    }

    @Test(expected = ConfigException.class)
    public void testMissingModelKey() {
        ModelDefinitionLoader.toConfig(ModelDefinitionLoader.parse("{\"graph\": {}}"));
    }

    @Test(expected = ConfigException.class)
    public void testMissingHorizon() {
        ModelDefinitionLoader.toConfig(ModelDefinitionLoader.parse("{\"model\": {\"processes\": [\"Y\"]}}"));
    }

    @Test(expected = ConfigException.class)
    public void testMissingProcesses() {
        ModelDefinitionLoader.toConfig(ModelDefinitionLoader.parse("{\"model\": {\"horizon\": 3}}"));
    }

    @Test(expected = ConfigException.class)
    public void testUnknownInvariance() {
        ModelDefinitionLoader.toConfig(ModelDefinitionLoader.parse(
                "{\"model\": {\"horizon\": 3, \"processes\": [\"Y\"], \"invariance\": \"partial\"}}"));
    }

    @Test(expected = ConfigException.class)
    public void testHorizonBelowTwoRejected() {
        ModelDefinitionLoader.toConfig(ModelDefinitionLoader.parse(
                "{\"model\": {\"horizon\": 1, \"processes\": [\"Y\"]}}"));
    }

    @Test(expected = ConfigException.class)
    public void testZeroIndicatorsRejected() {
        ModelDefinitionLoader.toConfig(ModelDefinitionLoader.parse(
                "{\"model\": {\"horizon\": 3, \"processes\": [\"Y\"], \"indicators\": {\"Y\": 0}}}"));
    }

    @Test(expected = ConfigException.class)
    public void testMalformedJson() {
        ModelDefinitionLoader.parse("{\"model\": ");
    }
}
