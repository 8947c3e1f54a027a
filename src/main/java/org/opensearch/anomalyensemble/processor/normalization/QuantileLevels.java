/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package org.opensearch.anomalyensemble.processor.normalization;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

import com.google.common.collect.ImmutableList;
import com.google.common.primitives.Doubles;

import lombok.EqualsAndHashCode;
import lombok.NonNull;

/**
 * Ordered, strictly increasing quantile levels from [0, 1] that partition the empirical distribution of scores.
 * Every normalized score is one of these levels.
 */
@EqualsAndHashCode
public final class QuantileLevels {
    private static final int DEFAULT_NUMBER_OF_LEVELS = 101;

    /**
     * 0.00, 0.01, ..., 1.00
     */
    public static final QuantileLevels DEFAULT = evenlySpaced(DEFAULT_NUMBER_OF_LEVELS);

    private final double[] levels;

    private QuantileLevels(final double[] levels) {
        this.levels = levels;
    }

    public static QuantileLevels of(@NonNull final double... levels) {
        double[] copy = Arrays.copyOf(levels, levels.length);
        validate(copy);
        return new QuantileLevels(copy);
    }

    public static QuantileLevels of(@NonNull final List<? extends Number> levels) {
        double[] values = new double[levels.size()];
        for (int i = 0; i < values.length; i++) {
            Number level = levels.get(i);
            if (Objects.isNull(level)) {
                throw new IllegalArgumentException(String.format(Locale.ROOT, "quantile level at position %d is null", i));
            }
            values[i] = level.doubleValue();
        }
        validate(values);
        return new QuantileLevels(values);
    }

    /**
     * Levels i / (count - 1) for i in [0, count), first one is 0.0 and last one is 1.0
     * @param count number of levels, at least 2
     * @return evenly spaced levels
     */
    public static QuantileLevels evenlySpaced(final int count) {
        if (count < 2) {
            throw new IllegalArgumentException(String.format(Locale.ROOT, "number of evenly spaced quantiles must be at least 2, got %d", count));
        }
        double[] values = new double[count];
        for (int i = 0; i < count; i++) {
            values[i] = (double) i / (count - 1);
        }
        return new QuantileLevels(values);
    }

    /**
     * Levels start, start + step, ... up to and including stop when stop is reachable with given step
     * @param start first level
     * @param stop upper limit for last level
     * @param step distance between levels, must be positive
     * @return levels from range
     */
    public static QuantileLevels range(final double start, final double stop, final double step) {
        if (!(step > 0) || Double.isInfinite(step)) {
            throw new IllegalArgumentException(String.format(Locale.ROOT, "step of quantile range must be positive, got %s", step));
        }
        if (!Double.isFinite(start) || !Double.isFinite(stop)) {
            throw new IllegalArgumentException(String.format(Locale.ROOT, "bounds of quantile range must be finite, got %s and %s", start, stop));
        }
        if (stop < start) {
            throw new IllegalArgumentException(String.format(Locale.ROOT, "quantile range is empty, start %s is above stop %s", start, stop));
        }
        // decimal arithmetic so that range(0, 1, 0.01) gives the same levels as i / 100
        BigDecimal decimalStart = BigDecimal.valueOf(start);
        BigDecimal decimalStep = BigDecimal.valueOf(step);
        int count = BigDecimal.valueOf(stop).subtract(decimalStart).divide(decimalStep, 0, RoundingMode.FLOOR).intValueExact() + 1;
        double[] values = new double[count];
        for (int i = 0; i < count; i++) {
            values[i] = decimalStart.add(decimalStep.multiply(BigDecimal.valueOf(i))).doubleValue();
        }
        validate(values);
        return new QuantileLevels(values);
    }

    public int size() {
        return levels.length;
    }

    public double get(final int index) {
        return levels[index];
    }

    public double last() {
        return levels[levels.length - 1];
    }

    public double[] toArray() {
        return Arrays.copyOf(levels, levels.length);
    }

    public List<Double> asList() {
        return ImmutableList.copyOf(Doubles.asList(levels));
    }

    /**
     * Check if value is exactly one of the levels
     */
    public boolean contains(final double value) {
        return Arrays.binarySearch(levels, value) >= 0;
    }

    @Override
    public String toString() {
        if (levels.length <= 4) {
            return Arrays.toString(levels);
        }
        return String.format(Locale.ROOT, "[%s, %s, ..., %s] (%d levels)", levels[0], levels[1], last(), levels.length);
    }

    private static void validate(final double[] levels) {
        if (levels.length == 0) {
            throw new IllegalArgumentException("quantiles must not be empty");
        }
        for (int i = 0; i < levels.length; i++) {
            double level = levels[i];
            if (Double.isNaN(level) || level < 0.0 || level > 1.0) {
                throw new IllegalArgumentException(String.format(Locale.ROOT, "quantile level %s is not in range [0, 1]", level));
            }
            if (i > 0 && level <= levels[i - 1]) {
                throw new IllegalArgumentException(
                    String.format(
                        Locale.ROOT,
                        "quantiles must be strictly increasing, level %s at position %d follows %s",
                        level,
                        i,
                        levels[i - 1]
                    )
                );
            }
        }
    }
}
