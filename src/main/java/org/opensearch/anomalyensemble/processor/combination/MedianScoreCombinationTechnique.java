/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package org.opensearch.anomalyensemble.processor.combination;

import java.util.Map;
import java.util.Set;

import org.apache.commons.math3.stat.descriptive.rank.Percentile;

import lombok.ToString;

/**
 * Abstracts combination of scores based on median
 */
@ToString(onlyExplicitlyIncluded = true)
public class MedianScoreCombinationTechnique implements ScoreCombinationTechnique {
    @ToString.Include
    public static final String TECHNIQUE_NAME = "median";
    private static final Set<String> SUPPORTED_PARAMS = Set.of();
    private static final double MEDIAN_QUANTILE = 50.0;

    public MedianScoreCombinationTechnique(final Map<String, Object> params, final ScoreCombinationUtil combinationUtil) {
        combinationUtil.validateParams(params, SUPPORTED_PARAMS);
    }

    /**
     * Median of scores, for even number of scores it's the mean of two middle scores
     */
    @Override
    public double combine(final double[] scores) {
        // Percentile is not thread safe, one instance per call
        return new Percentile(MEDIAN_QUANTILE).withEstimationType(Percentile.EstimationType.R_7).evaluate(scores);
    }

    @Override
    public String techniqueName() {
        return TECHNIQUE_NAME;
    }

    @Override
    public String describe() {
        return TECHNIQUE_NAME;
    }
}
