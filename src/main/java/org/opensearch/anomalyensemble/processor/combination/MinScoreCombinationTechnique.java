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
 * Abstracts combination of scores by taking the minimum score
 */
@ToString(onlyExplicitlyIncluded = true)
public class MinScoreCombinationTechnique implements ScoreCombinationTechnique {
    @ToString.Include
    public static final String TECHNIQUE_NAME = "min";
    private static final Set<String> SUPPORTED_PARAMS = Set.of();

    public MinScoreCombinationTechnique(final Map<String, Object> params, final ScoreCombinationUtil combinationUtil) {
        combinationUtil.validateParams(params, SUPPORTED_PARAMS);
    }

    @Override
    public double combine(final double[] scores) {
        return StatUtils.min(scores);
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
