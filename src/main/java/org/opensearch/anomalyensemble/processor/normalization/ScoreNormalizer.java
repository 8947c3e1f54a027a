/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package org.opensearch.anomalyensemble.processor.normalization;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

import org.opensearch.anomalyensemble.model.ScoreArray;

import lombok.extern.log4j.Log4j2;

/**
 * Abstracts normalization of scores produced by multiple detectors
 */
@Log4j2
public class ScoreNormalizer {

    /**
     * Performs score normalization of every detector's scores independently, based on input normalization technique.
     * Input arrays are not mutated.
     * @param detectorScores raw scores, one array per detector
     * @param scoreNormalizationTechnique exact normalization method that should be applied
     * @return normalized scores in the same order as input
     */
    public List<ScoreArray> normalizeScores(
        final List<ScoreArray> detectorScores,
        final ScoreNormalizationTechnique scoreNormalizationTechnique
    ) {
        if (Objects.isNull(detectorScores) || detectorScores.isEmpty()) {
            log.debug("no detector scores to normalize");
            return List.of();
        }
        log.debug("normalizing scores of [{}] detectors with technique [{}]", detectorScores.size(), scoreNormalizationTechnique.describe());
        return detectorScores.stream().map(scoreNormalizationTechnique::normalize).collect(Collectors.toUnmodifiableList());
    }
}
