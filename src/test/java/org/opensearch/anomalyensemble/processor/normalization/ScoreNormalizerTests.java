/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package org.opensearch.anomalyensemble.processor.normalization;

import java.util.List;

import org.opensearch.anomalyensemble.AnomalyEnsembleTestBase;
import org.opensearch.anomalyensemble.model.ScoreArray;

public class ScoreNormalizerTests extends AnomalyEnsembleTestBase {

    public void testNormalization_whenNoScores_thenEmptyResult() {
        ScoreNormalizer scoreNormalizer = new ScoreNormalizer();

        assertTrue(scoreNormalizer.normalizeScores(List.of(), ScoreNormalizationFactory.DEFAULT_METHOD).isEmpty());
        assertTrue(scoreNormalizer.normalizeScores(null, ScoreNormalizationFactory.DEFAULT_METHOD).isEmpty());
    }

    public void testNormalization_whenScoresOfSeveralDetectors_thenEachNormalizedIndependently() {
        ScoreNormalizer scoreNormalizer = new ScoreNormalizer();
        ScoreNormalizationTechnique technique = new ScoreNormalizationFactory().createNormalization("quantile");
        ScoreArray firstDetectorScores = ScoreArray.of(new double[] { 0.1, 0.2, 0.3 });
        ScoreArray secondDetectorScores = ScoreArray.of(new double[] { 300, 200, 100 });

        List<ScoreArray> normalizedScores = scoreNormalizer.normalizeScores(List.of(firstDetectorScores, secondDetectorScores), technique);

        assertEquals(2, normalizedScores.size());
        assertArrayEquals(new double[] { 0.0, 0.5, 1.0 }, normalizedScores.get(0).toDoubleArray(), DELTA_FOR_ASSERTION);
        assertArrayEquals(new double[] { 1.0, 0.5, 0.0 }, normalizedScores.get(1).toDoubleArray(), DELTA_FOR_ASSERTION);
        assertEquals(technique.normalize(firstDetectorScores), normalizedScores.get(0));
    }
}
