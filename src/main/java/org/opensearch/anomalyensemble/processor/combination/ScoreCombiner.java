/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package org.opensearch.anomalyensemble.processor.combination;

import java.util.List;
import java.util.Objects;

import org.opensearch.anomalyensemble.model.ScoreArray;
import org.opensearch.anomalyensemble.model.ScoreDataType;

import lombok.extern.log4j.Log4j2;

/**
 * Abstracts combination of score arrays of multiple detectors into a single ensemble score array.
 */
@Log4j2
public class ScoreCombiner {
    private final ScoreCombinationUtil scoreCombinationUtil;

    public ScoreCombiner() {
        this(new ScoreCombinationUtil());
    }

    public ScoreCombiner(final ScoreCombinationUtil scoreCombinationUtil) {
        this.scoreCombinationUtil = scoreCombinationUtil;
    }

    /**
     * Performs score combination based on input combination technique. Input arrays are not mutated.
     * Main steps we're doing for combination:
     * - validate that arrays have the same shape and element type
     * - stack arrays along new trailing axis, for every position that gives vector of one score per detector
     * - reduce every such vector to a single score with the combination technique
     * Result has the shape of input arrays and float64 elements.
     *
     * @param scoreArrays               score arrays, one per detector
     * @param scoreCombinationTechnique exact combination method that should be applied
     * @return combined scores
     */
    public ScoreArray combineScores(final List<ScoreArray> scoreArrays, final ScoreCombinationTechnique scoreCombinationTechnique) {
        if (Objects.isNull(scoreCombinationTechnique)) {
            throw new IllegalArgumentException("combination technique must not be null");
        }
        scoreCombinationUtil.validateScoreArrays(scoreArrays);

        ScoreArray first = scoreArrays.get(0);
        int numberOfDetectors = scoreArrays.size();
        log.debug(
            "combining [{}] score arrays of shape [{}] with technique [{}]",
            numberOfDetectors,
            first.getShape(),
            scoreCombinationTechnique.describe()
        );

        double[] combinedScores = new double[first.size()];
        double[] scoresAtPosition = new double[numberOfDetectors];
        for (int position = 0; position < combinedScores.length; position++) {
            for (int detector = 0; detector < numberOfDetectors; detector++) {
                scoresAtPosition[detector] = scoreArrays.get(detector).get(position);
            }
            combinedScores[position] = scoreCombinationTechnique.combine(scoresAtPosition);
        }
        return ScoreArray.of(first.getShape(), ScoreDataType.FLOAT64, combinedScores);
    }
}
