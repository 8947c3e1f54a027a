/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package org.opensearch.anomalyensemble.processor;

import java.util.List;

import org.opensearch.anomalyensemble.model.ScoreArray;
import org.opensearch.anomalyensemble.processor.combination.ScoreCombinationTechnique;
import org.opensearch.anomalyensemble.processor.normalization.ScoreNormalizationTechnique;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;

/**
 * DTO class to hold request parameters for normalization and combination
 */
@Builder
@AllArgsConstructor
@Getter
public class EnsembleWorkflowExecuteRequest {
    final List<ScoreArray> detectorScores;
    @NonNull
    final ScoreNormalizationTechnique normalizationTechnique;
    @NonNull
    final ScoreCombinationTechnique combinationTechnique;
}
