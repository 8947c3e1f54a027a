/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package org.opensearch.anomalyensemble.processor.combination;

import static org.hamcrest.Matchers.containsString;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.hamcrest.MatcherAssert;
import org.opensearch.anomalyensemble.AnomalyEnsembleTestBase;
import org.opensearch.anomalyensemble.model.ScoreArray;

public class ScoreCombinationUtilTests extends AnomalyEnsembleTestBase {

    private final ScoreCombinationUtil scoreCombinationUtil = new ScoreCombinationUtil();

    public void testParamsValidation_whenNoParams_thenSuccessful() {
        scoreCombinationUtil.validateParams(Map.of(), Set.of());
        scoreCombinationUtil.validateParams(null, Set.of());
    }

    public void testParamsValidation_whenNotSupportedParam_thenFail() {
        IllegalArgumentException exception = expectThrows(
            IllegalArgumentException.class,
            () -> scoreCombinationUtil.validateParams(Map.of("weights", List.of(1.0)), Set.of("b", "a"))
        );
        assertEquals(
            "provided parameter for combination technique is not supported. supported parameters are [a,b]",
            exception.getMessage()
        );
    }

    public void testScoreArraysValidation_whenTwoToFourArraysOfSameShape_thenSuccessful() {
        int numberOfArrays = randomIntBetween(2, 4);
        ScoreArray[] scoreArrays = new ScoreArray[numberOfArrays];
        for (int i = 0; i < numberOfArrays; i++) {
            scoreArrays[i] = randomScores(3, 2);
        }
        scoreCombinationUtil.validateScoreArrays(Arrays.asList(scoreArrays));
    }

    public void testScoreArraysValidation_whenWrongNumberOfArrays_thenFail() {
        ScoreArray scores = ScoreArray.of(new double[] { 0.1, 0.2 });

        IllegalArgumentException singleArrayException = expectThrows(
            IllegalArgumentException.class,
            () -> scoreCombinationUtil.validateScoreArrays(List.of(scores))
        );
        assertEquals("number of score arrays must be between 2 and 4, got 1", singleArrayException.getMessage());

        IllegalArgumentException fiveArraysException = expectThrows(
            IllegalArgumentException.class,
            () -> scoreCombinationUtil.validateScoreArrays(List.of(scores, scores, scores, scores, scores))
        );
        assertEquals("number of score arrays must be between 2 and 4, got 5", fiveArraysException.getMessage());

        IllegalArgumentException nullException = expectThrows(
            IllegalArgumentException.class,
            () -> scoreCombinationUtil.validateScoreArrays(null)
        );
        assertEquals("score arrays must not be null", nullException.getMessage());
    }

    public void testScoreArraysValidation_whenNullArray_thenFail() {
        IllegalArgumentException exception = expectThrows(
            IllegalArgumentException.class,
            () -> scoreCombinationUtil.validateScoreArrays(Arrays.asList(ScoreArray.of(new double[] { 0.1 }), null))
        );
        assertEquals("score array at position 1 is null", exception.getMessage());
    }

    public void testScoreArraysValidation_whenShapesDiffer_thenFail() {
        ScoreArray matrix = ScoreArray.of(new double[][] { { 0.1, 0.2 }, { 0.3, 0.4 } });
        ScoreArray vector = ScoreArray.of(new double[] { 0.1, 0.2, 0.3, 0.4 });

        IllegalArgumentException exception = expectThrows(
            IllegalArgumentException.class,
            () -> scoreCombinationUtil.validateScoreArrays(List.of(matrix, vector))
        );
        MatcherAssert.assertThat(exception.getMessage(), containsString("all score arrays must have the same shape"));
    }

    public void testScoreArraysValidation_whenElementTypesDiffer_thenFail() {
        ScoreArray floats = ScoreArray.of(new double[] { 1.0, 2.0 });
        ScoreArray ints = ScoreArray.of(new int[] { 1, 2 });

        IllegalArgumentException exception = expectThrows(
            IllegalArgumentException.class,
            () -> scoreCombinationUtil.validateScoreArrays(List.of(floats, ints))
        );
        assertEquals(
            "all score arrays must have the same element type, array at position 1 is of type int32, expected float64",
            exception.getMessage()
        );
    }

    public void testScoreArraysValidation_whenNaNScore_thenFailWithArrayAndElement() {
        ScoreArray complete = ScoreArray.of(new double[] { 2.0, 3.0 });
        ScoreArray withMissingScore = ScoreArray.of(new double[] { 1.0, Double.NaN });

        IllegalArgumentException exception = expectThrows(
            IllegalArgumentException.class,
            () -> scoreCombinationUtil.validateScoreArrays(List.of(complete, withMissingScore))
        );
        assertEquals("score array at position 1 contains NaN at element 1", exception.getMessage());
    }
}
