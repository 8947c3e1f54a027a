/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package org.opensearch.anomalyensemble.processor.combination;

import java.util.function.ToDoubleFunction;

import org.opensearch.anomalyensemble.AnomalyEnsembleTestBase;

import lombok.NoArgsConstructor;

@NoArgsConstructor
public abstract class BaseScoreCombinationTechniqueTests extends AnomalyEnsembleTestBase {

    protected ToDoubleFunction<double[]> expectedScoreFunction;
    protected final ScoreCombinationUtil scoreCombinationUtil = new ScoreCombinationUtil();

    protected void assertCombination(final ScoreCombinationTechnique technique, final double[] scores, final double expectedScore) {
        double actualScore = technique.combine(scores);
        assertEquals(expectedScore, actualScore, DELTA_FOR_ASSERTION);
    }

    protected void assertCombinationOfRandomScores(final ScoreCombinationTechnique technique) {
        int numberOfScores = randomIntBetween(ScoreCombinationUtil.MIN_NUMBER_OF_SCORE_ARRAYS, ScoreCombinationUtil.MAX_NUMBER_OF_SCORE_ARRAYS);
        double[] scores = new double[numberOfScores];
        for (int i = 0; i < numberOfScores; i++) {
            scores[i] = randomDouble();
        }
        double expectedScore = expectedScoreFunction.applyAsDouble(scores.clone());
        assertEquals(expectedScore, technique.combine(scores), DELTA_FOR_ASSERTION);
    }

    protected void assertUnsupportedParamsRejected(final Runnable techniqueCreation) {
        IllegalArgumentException exception = expectThrows(IllegalArgumentException.class, techniqueCreation::run);
        assertEquals("provided parameter for combination technique is not supported. supported parameters are []", exception.getMessage());
    }
}
