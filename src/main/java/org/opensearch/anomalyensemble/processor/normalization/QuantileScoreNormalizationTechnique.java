/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package org.opensearch.anomalyensemble.processor.normalization;

import java.util.Locale;
import java.util.Map;
import java.util.Set;

import org.opensearch.anomalyensemble.model.ScoreArray;
import org.opensearch.anomalyensemble.model.ScoreBuffer;
import org.opensearch.anomalyensemble.processor.normalization.bounds.OutOfRangeMode;

import com.google.common.annotations.VisibleForTesting;

import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;
import lombok.extern.log4j.Log4j2;

/**
 * Abstracts normalization of scores based on empirical quantiles of the scores
 */
@Log4j2
@ToString(onlyExplicitlyIncluded = true)
public class QuantileScoreNormalizationTechnique implements ScoreNormalizationTechnique {
    @ToString.Include
    public static final String TECHNIQUE_NAME = "quantile";
    public static final String PARAM_NAME_QUANTILES = "quantiles";
    public static final String PARAM_NAME_OUT_OF_RANGE = "out_of_range";
    static final double OUT_OF_RANGE_SCORE = 0.0;
    private static final Set<String> SUPPORTED_PARAMS = Set.of(PARAM_NAME_QUANTILES, PARAM_NAME_OUT_OF_RANGE);

    @Getter
    private final QuantileLevels quantileLevels;
    @Getter
    private final OutOfRangeMode outOfRangeMode;
    private final ScoreNormalizationUtil scoreNormalizationUtil;

    public QuantileScoreNormalizationTechnique() {
        this(QuantileLevels.DEFAULT, OutOfRangeMode.DEFAULT);
    }

    public QuantileScoreNormalizationTechnique(@NonNull final QuantileLevels quantileLevels, @NonNull final OutOfRangeMode outOfRangeMode) {
        this.quantileLevels = quantileLevels;
        this.outOfRangeMode = outOfRangeMode;
        this.scoreNormalizationUtil = new ScoreNormalizationUtil();
    }

    public QuantileScoreNormalizationTechnique(final Map<String, Object> params, final ScoreNormalizationUtil scoreNormalizationUtil) {
        this.scoreNormalizationUtil = scoreNormalizationUtil;
        scoreNormalizationUtil.validateParams(params, SUPPORTED_PARAMS);
        this.quantileLevels = scoreNormalizationUtil.getQuantileLevels(params, PARAM_NAME_QUANTILES);
        this.outOfRangeMode = scoreNormalizationUtil.getOutOfRangeMode(params, PARAM_NAME_OUT_OF_RANGE);
    }

    @Override
    public ScoreArray normalize(final ScoreArray scores) {
        scoreNormalizationUtil.validateScores(scores);
        return normalizeInto(ScoreBuffer.zerosLike(scores), scores).toScoreArray();
    }

    /**
     * Quantile normalization method.
     * Main algorithm steps:
     * - compute one threshold T[i] per quantile level q[i] over all scores
     * - score x where x is less or equal to T[1] gets q[1]
     * - score x where T[i-1] is less than x and x is less or equal to T[i] gets q[i], last matching level wins
     * - score above the last threshold gets 0.0 or the last level, depending on out of range mode
     *
     * Every element of output is written, previous content of the buffer is ignored.
     */
    @Override
    public ScoreBuffer normalizeInto(final ScoreBuffer output, final ScoreArray scores) {
        scoreNormalizationUtil.validateScores(scores);
        scoreNormalizationUtil.validateOutput(output, scores);

        double[] sample = scores.toDoubleArray();
        QuantileThresholds thresholds = QuantileThresholds.compute(sample, quantileLevels);
        int numberOfOutOfRangeScores = 0;
        for (int j = 0; j < sample.length; j++) {
            double quantileScore = quantileScore(sample[j], thresholds);
            if (Double.isNaN(quantileScore)) {
                quantileScore = outOfRangeMode == OutOfRangeMode.TOP_QUANTILE ? quantileLevels.last() : OUT_OF_RANGE_SCORE;
                numberOfOutOfRangeScores++;
            }
            output.set(j, quantileScore);
        }
        if (numberOfOutOfRangeScores > 0) {
            log.debug(
                "[{}] scores of [{}] are above highest quantile threshold [{}], assigned according to mode [{}]",
                numberOfOutOfRangeScores,
                sample.length,
                thresholds.get(thresholds.size() - 1),
                outOfRangeMode
            );
        }
        return output;
    }

    /**
     * Find quantile level for single score
     * @return quantile level or NaN if score is above all thresholds
     */
    @VisibleForTesting
    double quantileScore(final double score, final QuantileThresholds thresholds) {
        double quantileScore = Double.NaN;
        if (score <= thresholds.get(0)) {
            quantileScore = quantileLevels.get(0);
        }
        for (int i = 1; i < thresholds.size(); i++) {
            if (score > thresholds.get(i - 1) && score <= thresholds.get(i)) {
                quantileScore = quantileLevels.get(i);
            }
        }
        return quantileScore;
    }

    @Override
    public String techniqueName() {
        return TECHNIQUE_NAME;
    }

    @Override
    public String describe() {
        return String.format(Locale.ROOT, "%s, quantiles %s, out of range mode [%s]", TECHNIQUE_NAME, quantileLevels, outOfRangeMode);
    }
}
