/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package org.opensearch.anomalyensemble.processor.combination;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

public class ArithmeticMeanScoreCombinationTechniqueTests extends BaseScoreCombinationTechniqueTests {

    public ArithmeticMeanScoreCombinationTechniqueTests() {
        this.expectedScoreFunction = scores -> Arrays.stream(scores).sum() / scores.length;
    }

    public void testLogic_whenTwoScores_thenMean() {
        ScoreCombinationTechnique technique = new ArithmeticMeanScoreCombinationTechnique(Map.of(), scoreCombinationUtil);
        assertCombination(technique, new double[] { 0.2, 0.6 }, 0.4);
    }

    public void testLogic_whenFourScores_thenMean() {
        ScoreCombinationTechnique technique = new ArithmeticMeanScoreCombinationTechnique(Map.of(), scoreCombinationUtil);
        assertCombination(technique, new double[] { 1.0, 0.0, 0.5, 0.25 }, 0.4375);
    }

    public void testRandomValues_whenScoresPresent_thenCorrectScores() {
        ScoreCombinationTechnique technique = new ArithmeticMeanScoreCombinationTechnique(Map.of(), scoreCombinationUtil);
        assertCombinationOfRandomScores(technique);
    }

    public void testParams_whenWeightsProvided_thenFail() {
        assertUnsupportedParamsRejected(
            () -> new ArithmeticMeanScoreCombinationTechnique(Map.of("weights", List.of(0.5, 0.5)), scoreCombinationUtil)
        );
    }

    public void testName_whenDescribed_thenMean() {
        ScoreCombinationTechnique technique = new ArithmeticMeanScoreCombinationTechnique(Map.of(), scoreCombinationUtil);
        assertEquals("mean", technique.techniqueName());
        assertEquals("mean", technique.describe());
    }
}
