/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package org.opensearch.anomalyensemble.processor.normalization;

import java.util.Arrays;

import org.apache.commons.math3.stat.StatUtils;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;

import lombok.NonNull;

/**
 * Empirical quantile thresholds of a sample, one threshold per quantile level. Thresholds are estimated with
 * linear interpolation between order statistics (Hyndman and Fan definition 7): for level q the fractional
 * rank is 1 + (n - 1) * q.
 */
public final class QuantileThresholds {
    private static final double PERCENTILE_SCALE = 100.0;

    private final double[] thresholds;

    private QuantileThresholds(final double[] thresholds) {
        this.thresholds = thresholds;
    }

    /**
     * Compute thresholds for every quantile level over given sample
     * @param sample flat sample of scores, must not be empty and must not contain NaN
     * @param quantileLevels levels to estimate thresholds for
     * @return thresholds in the order of quantile levels
     */
    public static QuantileThresholds compute(@NonNull final double[] sample, @NonNull final QuantileLevels quantileLevels) {
        if (sample.length == 0) {
            throw new IllegalArgumentException("cannot compute quantile thresholds of empty sample");
        }
        Percentile percentile = new Percentile().withEstimationType(Percentile.EstimationType.R_7);
        percentile.setData(sample);
        double min = StatUtils.min(sample);

        double[] thresholds = new double[quantileLevels.size()];
        for (int i = 0; i < thresholds.length; i++) {
            double level = quantileLevels.get(i);
            // Percentile accepts (0, 100] only, level 0 is the sample minimum
            thresholds[i] = level == 0.0 ? min : percentile.evaluate(level * PERCENTILE_SCALE);
        }
        return new QuantileThresholds(thresholds);
    }

    public int size() {
        return thresholds.length;
    }

    public double get(final int index) {
        return thresholds[index];
    }

    public double[] toArray() {
        return Arrays.copyOf(thresholds, thresholds.length);
    }

    @Override
    public String toString() {
        return Arrays.toString(thresholds);
    }
}
