package com.sem.lcs.engine;

import com.sem.lcs.api.ExportException;
import com.sem.lcs.api.LatentRole;
import com.sem.lcs.api.LatentVariable;
import com.sem.lcs.api.ManifestVariable;
import com.sem.lcs.api.MeanSource;
import com.sem.lcs.api.Path;
import com.sem.lcs.api.PathKind;
import com.sem.lcs.api.Variable;

/**
 * Canonical emission order of a latent change score specification.
 *
 * <p>
 * Declaration order is the order paths are emitted in. Every path a builder
 * produces belongs to exactly one stage, and the stage is recoverable from the
 * path's shape alone, which is what lets a parser restore canonical order from
 * a regrouped rendering. The stochastic innovation stage is last so that adding
 * it never moves an existing path.
 */
public enum PathStage {
    MEANS,
    INITIAL_COVARIANCE,
    LATENT_CHAIN,
    ADDITIVE,
    SELF_FEEDBACK,
    COUPLING,
    CHANGE_TO_LATENT,
    MEASUREMENT,
    MEASUREMENT_INTERCEPT,
    MEASUREMENT_ERROR,
    INNOVATION;

    /**
     * Determines the stage of a path from its endpoints and kind.
     *
     * @throws ExportException if the path does not fit any stage.
     */
    public static PathStage classify(Path path) {
        Variable from = path.from();
        Variable to = path.to();
        if (path.kind() == PathKind.COVARIANCE) {
            if (from instanceof LatentVariable a && to instanceof LatentVariable b) {
                if (isInitial(a) && isInitial(b))
                    return INITIAL_COVARIANCE;
                if (a.role() == LatentRole.CHANGE && b.role() == LatentRole.CHANGE && a.time() == b.time())
                    return INNOVATION;
            } else if (from instanceof ManifestVariable a && to instanceof ManifestVariable b
                    && a.time() == b.time()) {
                return MEASUREMENT_ERROR;
            }
            throw unclassifiable(path);
        }

        if (from instanceof MeanSource) {
            if (to instanceof LatentVariable l && isInitial(l))
                return MEANS;
            if (to instanceof ManifestVariable)
                return MEASUREMENT_INTERCEPT;
            throw unclassifiable(path);
        }
        if (!(from instanceof LatentVariable src))
            throw unclassifiable(path);
        if (to instanceof ManifestVariable m) {
            if (src.role() == LatentRole.STATE && src.process().equals(m.process()) && src.time() == m.time())
                return MEASUREMENT;
            throw unclassifiable(path);
        }
        if (!(to instanceof LatentVariable dst))
            throw unclassifiable(path);

        boolean sameProcess = src.process().equals(dst.process());
        if (dst.role() == LatentRole.STATE && sameProcess) {
            if (src.role() == LatentRole.INITIAL_LEVEL && dst.time() == 1)
                return LATENT_CHAIN;
            if (src.role() == LatentRole.STATE && src.time() == dst.time() - 1)
                return LATENT_CHAIN;
            if (src.role() == LatentRole.CHANGE && src.time() == dst.time())
                return CHANGE_TO_LATENT;
        } else if (dst.role() == LatentRole.CHANGE) {
            if (src.role() == LatentRole.INITIAL_SLOPE && sameProcess)
                return ADDITIVE;
            if (src.role() == LatentRole.STATE && src.time() == dst.time() - 1)
                return sameProcess ? SELF_FEEDBACK : COUPLING;
        }
        throw unclassifiable(path);
    }

    private static boolean isInitial(LatentVariable v) {
        return v.role() == LatentRole.INITIAL_LEVEL || v.role() == LatentRole.INITIAL_SLOPE;
    }

    private static ExportException unclassifiable(Path path) {
        return new ExportException("Path does not belong to any stage: " + path);
    }
}
