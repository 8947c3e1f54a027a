/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package org.opensearch.anomalyensemble.processor.normalization;

import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * Abstracts creation of exact score normalization method based on technique name
 */
public class ScoreNormalizationFactory {

    private static final ScoreNormalizationUtil scoreNormalizationUtil = new ScoreNormalizationUtil();

    public static final ScoreNormalizationTechnique DEFAULT_METHOD = new QuantileScoreNormalizationTechnique();

    private static final Map<String, Function<Map<String, Object>, ScoreNormalizationTechnique>> SCORE_NORMALIZATION_METHODS = Map.of(
        QuantileScoreNormalizationTechnique.TECHNIQUE_NAME,
        params -> new QuantileScoreNormalizationTechnique(params, scoreNormalizationUtil)
    );

    /**
     * Get score normalization method by technique name
     * @param technique name of technique
     * @return instance of ScoreNormalizationTechnique for technique name
     */
    public ScoreNormalizationTechnique createNormalization(final String technique) {
        return createNormalization(technique, Map.of());
    }

    /**
     * Get score normalization method by technique name
     * @param technique name of technique
     * @param params parameters that normalization technique may use
     * @return instance of ScoreNormalizationTechnique for technique name
     */
    public ScoreNormalizationTechnique createNormalization(final String technique, final Map<String, Object> params) {
        return Optional.ofNullable(technique)
            .map(SCORE_NORMALIZATION_METHODS::get)
            .orElseThrow(() -> new IllegalArgumentException("provided normalization technique is not supported"))
            .apply(params);
    }
}
