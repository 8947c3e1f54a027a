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
import lombok.Getter;

/**
 * Configured normalization and combination of anomaly scores. Turns raw scores of several detectors into a single
 * fused anomaly score array. Immutable and safe to share between threads.
 */
@AllArgsConstructor
public class AnomalyScoreEnsembler {
    public static final String TYPE = "anomaly-score-ensemble";

    @Getter
    private final String tag;
    @Getter
    private final String description;
    @Getter
    private final ScoreNormalizationTechnique normalizationTechnique;
    @Getter
    private final ScoreCombinationTechnique combinationTechnique;
    private final AnomalyScoreEnsembleWorkflow ensembleWorkflow;

    /**
     * Normalize scores of every detector and combine normalized scores into ensemble score
     * @param detectorScores raw scores, one array per detector, all arrays of the same shape and element type
     * @return fused anomaly scores
     */
    public ScoreArray ensemble(final List<ScoreArray> detectorScores) {
        EnsembleWorkflowExecuteRequest request = EnsembleWorkflowExecuteRequest.builder()
            .detectorScores(detectorScores)
            .normalizationTechnique(normalizationTechnique)
            .combinationTechnique(combinationTechnique)
            .build();
        return ensembleWorkflow.execute(request);
    }

    public String getType() {
        return TYPE;
    }
}
