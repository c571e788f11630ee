package com.sem.lcs.api;

import org.junit.Test;

import static org.junit.Assert.*;

public class PathTest {

    @Test
    public void testBlankLabelBecomesNull() {
        Path p = Path.free(LatentVariable.level("Y"), LatentVariable.level("Y"), PathKind.COVARIANCE, 1.0, "  ");
        assertNull(p.label());
        assertFalse(p.hasLabel());
        assertTrue(p.isVariance());
    }

    @Test
    public void testMeanPath() {
        Path p = Path.free(MeanSource.INSTANCE, LatentVariable.slope("Y"), PathKind.REGRESSION, 0.0, "meanya");
        assertTrue(p.isMean());
        assertFalse(p.isVariance());
        assertTrue(p.free());
    }

    @Test
    public void testArrows() {
        assertEquals(1, PathKind.REGRESSION.arrows());
        assertSame(PathKind.COVARIANCE, PathKind.fromArrows(2));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testMissingEndpoint() {
        Path.fixed(null, LatentVariable.level("Y"), PathKind.REGRESSION, 1.0);
    }

    @Test
    public void testVariableNames() {
        assertEquals("y0", LatentVariable.level("Y").name());
        assertEquals("coga", LatentVariable.slope("COG").name());
        assertEquals("dX_T4", LatentVariable.change("X", 4).name());
        assertEquals("Y_T2", new ManifestVariable("Y", 1, 2, true).name());
        assertEquals("Y1_T2", new ManifestVariable("Y", 1, 2, false).name());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testTimeFreeRoleRejectsOccasion() {
        new LatentVariable(LatentRole.INITIAL_LEVEL, "Y", 2);
    }
}
