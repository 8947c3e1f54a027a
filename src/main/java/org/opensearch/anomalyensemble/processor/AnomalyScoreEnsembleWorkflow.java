/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package org.opensearch.anomalyensemble.processor;

import java.util.List;

import org.opensearch.anomalyensemble.model.ScoreArray;
import org.opensearch.anomalyensemble.processor.combination.ScoreCombinationUtil;
import org.opensearch.anomalyensemble.processor.combination.ScoreCombiner;
import org.opensearch.anomalyensemble.processor.normalization.ScoreNormalizer;

import lombok.AllArgsConstructor;
import lombok.extern.log4j.Log4j2;

/**
 * Class abstracts steps required for score normalization and combination, this includes pre-processing of incoming data
 * and return of the fused anomaly scores
 */
@AllArgsConstructor
@Log4j2
public class AnomalyScoreEnsembleWorkflow {

    private final ScoreNormalizer scoreNormalizer;
    private final ScoreCombiner scoreCombiner;
    private final ScoreCombinationUtil scoreCombinationUtil = new ScoreCombinationUtil();

    /**
     * Start execution of this workflow
     * @param request contains raw scores of every detector, normalizationTechnique technique for score normalization
     * and combinationTechnique technique for score combination
     * @return fused anomaly scores with the shape of detector scores
     */
    public ScoreArray execute(final EnsembleWorkflowExecuteRequest request) {
        List<ScoreArray> detectorScores = request.getDetectorScores();
        // arity, shape and element type are checked on raw scores, normalized scores are all float64
        scoreCombinationUtil.validateScoreArrays(detectorScores);

        // normalize
        log.debug("Do score normalization");
        List<ScoreArray> normalizedScores = scoreNormalizer.normalizeScores(detectorScores, request.getNormalizationTechnique());

        // combine
        log.debug("Do score combination");
        return scoreCombiner.combineScores(normalizedScores, request.getCombinationTechnique());
    }
}
