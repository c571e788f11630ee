package com.sem.lcs.io;

import com.sem.lcs.engine.PathStage;

/**
 * Blocks of the equation-text form, in output order, each with its operator
 * token.
 */
public enum EquationGroup {
    /** {@code outcome ~ predictor} */
    REGRESSIONS("regressions", "~"),
    /** {@code factor =~ indicator} */
    LOADINGS("loadings", "=~"),
    /** {@code variable ~ 1} */
    INTERCEPTS("intercepts", "~"),
    /** {@code a ~~ b} */
    COVARIANCES("covariances", "~~");

    private final String header;
    private final String operator;

    EquationGroup(String header, String operator) {
        this.header = header;
        this.operator = operator;
    }

    public String header() {
        return header;
    }

    public String operator() {
        return operator;
    }

    public static EquationGroup of(PathStage stage) {
        return switch (stage) {
            case MEANS, MEASUREMENT_INTERCEPT -> INTERCEPTS;
            case MEASUREMENT -> LOADINGS;
            case INITIAL_COVARIANCE, MEASUREMENT_ERROR, INNOVATION -> COVARIANCES;
            case LATENT_CHAIN, ADDITIVE, SELF_FEEDBACK, COUPLING, CHANGE_TO_LATENT -> REGRESSIONS;
        };
    }
}
