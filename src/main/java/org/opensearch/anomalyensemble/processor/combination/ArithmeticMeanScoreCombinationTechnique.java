/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package org.opensearch.anomalyensemble.processor.combination;

import java.util.Map;
import java.util.Set;

import org.apache.commons.math3.stat.StatUtils;

import lombok.ToString;

/**
 * Abstracts combination of scores based on arithmetic mean method
 */
@ToString(onlyExplicitlyIncluded = true)
public class ArithmeticMeanScoreCombinationTechnique implements ScoreCombinationTechnique {
    @ToString.Include
    public static final String TECHNIQUE_NAME = "mean";
    private static final Set<String> SUPPORTED_PARAMS = Set.of();

    public ArithmeticMeanScoreCombinationTechnique(final Map<String, Object> params, final ScoreCombinationUtil combinationUtil) {
        combinationUtil.validateParams(params, SUPPORTED_PARAMS);
    }

    /**
     * Arithmetic mean method for combining scores.
     * score = (score1 + score2 +...+ scoreN)/N
     */
    @Override
    public double combine(final double[] scores) {
        return StatUtils.mean(scores);
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
