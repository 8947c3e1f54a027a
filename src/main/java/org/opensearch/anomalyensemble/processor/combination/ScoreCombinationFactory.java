/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package org.opensearch.anomalyensemble.processor.combination;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * Abstracts creation of exact score combination method based on technique name
 */
public class ScoreCombinationFactory {
    private static final ScoreCombinationUtil scoreCombinationUtil = new ScoreCombinationUtil();

    public static final ScoreCombinationTechnique DEFAULT_METHOD = new ArithmeticMeanScoreCombinationTechnique(
        Map.of(),
        scoreCombinationUtil
    );

    private final Map<String, Function<Map<String, Object>, ScoreCombinationTechnique>> scoreCombinationMethodsMap = Map.of(
        ArithmeticMeanScoreCombinationTechnique.TECHNIQUE_NAME,
        params -> new ArithmeticMeanScoreCombinationTechnique(params, scoreCombinationUtil),
        MedianScoreCombinationTechnique.TECHNIQUE_NAME,
        params -> new MedianScoreCombinationTechnique(params, scoreCombinationUtil),
        MaxScoreCombinationTechnique.TECHNIQUE_NAME,
        params -> new MaxScoreCombinationTechnique(params, scoreCombinationUtil),
        MinScoreCombinationTechnique.TECHNIQUE_NAME,
        params -> new MinScoreCombinationTechnique(params, scoreCombinationUtil)
    );

    /**
     * Get score combination method by technique name
     * @param technique name of technique
     * @return instance of ScoreCombinationTechnique for technique name
     */
    public ScoreCombinationTechnique createCombination(final String technique) {
        return createCombination(technique, Map.of());
    }

    /**
     * Get score combination method by technique name
     * @param technique name of technique
     * @param params parameters that combination technique may use
     * @return instance of ScoreCombinationTechnique for technique name
     */
    public ScoreCombinationTechnique createCombination(final String technique, final Map<String, Object> params) {
        return Optional.ofNullable(technique)
            .map(scoreCombinationMethodsMap::get)
            .orElseThrow(() -> new IllegalArgumentException("provided combination technique is not supported"))
            .apply(params);
    }

    /**
     * Names of all techniques this factory can create
     */
    public Set<String> supportedTechniques() {
        return scoreCombinationMethodsMap.keySet();
    }
}
