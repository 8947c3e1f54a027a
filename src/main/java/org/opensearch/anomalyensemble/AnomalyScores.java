/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package org.opensearch.anomalyensemble;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.opensearch.anomalyensemble.model.ScoreArray;
import org.opensearch.anomalyensemble.model.ScoreBuffer;
import org.opensearch.anomalyensemble.processor.combination.ArithmeticMeanScoreCombinationTechnique;
import org.opensearch.anomalyensemble.processor.combination.ScoreCombinationFactory;
import org.opensearch.anomalyensemble.processor.combination.ScoreCombinationTechnique;
import org.opensearch.anomalyensemble.processor.combination.ScoreCombiner;
import org.opensearch.anomalyensemble.processor.normalization.QuantileLevels;
import org.opensearch.anomalyensemble.processor.normalization.QuantileScoreNormalizationTechnique;
import org.opensearch.anomalyensemble.processor.normalization.bounds.OutOfRangeMode;

import lombok.AccessLevel;
import lombok.NoArgsConstructor;

/**
 * Entry point for normalization of anomaly scores to quantile levels and for combination of normalized scores of
 * several detectors into ensemble score.
 *
 * <pre>
 * ScoreArray quantileScores1 = AnomalyScores.getQuantileScores(scores1);
 * ScoreArray quantileScores2 = AnomalyScores.getQuantileScores(scores2);
 * ScoreArray ensemble = AnomalyScores.computeEnsemble(List.of(quantileScores1, quantileScores2), "max");
 * </pre>
 */
@NoArgsConstructor(access = AccessLevel.PRIVATE)
public final class AnomalyScores {
    public static final String DEFAULT_ENSEMBLE = ArithmeticMeanScoreCombinationTechnique.TECHNIQUE_NAME;

    private static final QuantileScoreNormalizationTechnique DEFAULT_QUANTILE_TECHNIQUE = new QuantileScoreNormalizationTechnique();
    private static final ScoreCombinationFactory SCORE_COMBINATION_FACTORY = new ScoreCombinationFactory();
    private static final ScoreCombiner SCORE_COMBINER = new ScoreCombiner();

    /**
     * Quantile levels of scores using default levels 0.00, 0.01, ..., 1.00.
     * Score greater than threshold of level q[i-1] and not greater than threshold of level q[i] gets q[i].
     * @param scores N dimensional anomaly scores
     * @return quantile scores with the shape of input
     */
    public static ScoreArray getQuantileScores(final ScoreArray scores) {
        return DEFAULT_QUANTILE_TECHNIQUE.normalize(scores);
    }

    public static ScoreArray getQuantileScores(final ScoreArray scores, final QuantileLevels quantiles) {
        return new QuantileScoreNormalizationTechnique(quantiles, OutOfRangeMode.DEFAULT).normalize(scores);
    }

    /**
     * Same as {@link #getQuantileScores(ScoreArray)} but writes quantile levels into preallocated buffer
     * @param quantileScores buffer of the same shape as scores
     * @param scores N dimensional anomaly scores
     * @return the buffer passed in
     */
    public static ScoreBuffer getQuantileScoresInto(final ScoreBuffer quantileScores, final ScoreArray scores) {
        return DEFAULT_QUANTILE_TECHNIQUE.normalizeInto(quantileScores, scores);
    }

    public static ScoreBuffer getQuantileScoresInto(final ScoreBuffer quantileScores, final ScoreArray scores, final QuantileLevels quantiles) {
        return new QuantileScoreNormalizationTechnique(quantiles, OutOfRangeMode.DEFAULT).normalizeInto(quantileScores, scores);
    }

    /**
     * Mean of anomaly scores of 2 to 4 detectors
     */
    public static ScoreArray computeEnsemble(final ScoreArray first, final ScoreArray second, final ScoreArray... others) {
        List<ScoreArray> scores = new ArrayList<>(2 + others.length);
        scores.add(first);
        scores.add(second);
        scores.addAll(Arrays.asList(others));
        return computeEnsemble(scores, DEFAULT_ENSEMBLE);
    }

    /**
     * Mean, minimum, maximum or median of anomaly scores of 2 to 4 detectors. Scores of different detectors should be
     * comparable, e.g. by using {@link #getQuantileScores(ScoreArray)} before.
     * @param scores score arrays of the same shape and element type
     * @param ensemble one of "mean", "min", "max", "median"
     * @return ensemble scores with the shape of input and float64 elements
     */
    public static ScoreArray computeEnsemble(final List<ScoreArray> scores, final String ensemble) {
        ScoreCombinationTechnique technique = SCORE_COMBINATION_FACTORY.createCombination(ensemble);
        return SCORE_COMBINER.combineScores(scores, technique);
    }
}
