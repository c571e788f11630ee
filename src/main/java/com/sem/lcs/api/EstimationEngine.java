package com.sem.lcs.api;

import com.sem.lcs.engine.ModelSpecification;

/**
 * External structural-equation estimator. Nothing in this library implements
 * it; callers plug in an adapter to their engine of choice.
 */
@FunctionalInterface
public interface EstimationEngine {

    /**
     * Fits the specification to the data.
     *
     * @throws NonconvergenceException     if the optimizer does not converge.
     * @throws UnidentifiedModelException  if the model is not identified.
     */
    FitResult estimate(ModelSpecification spec, DataSource data);
}
