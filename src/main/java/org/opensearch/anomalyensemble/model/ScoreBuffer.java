/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package org.opensearch.anomalyensemble.model;

import java.util.Arrays;
import java.util.Locale;

import ai.djl.ndarray.types.Shape;
import lombok.Getter;
import lombok.NonNull;

/**
 * Mutable float64 output buffer with a fixed shape. Used by callers that want normalized scores written
 * into memory they own instead of a freshly allocated array. Not thread safe.
 */
public final class ScoreBuffer {
    @Getter
    private final Shape shape;
    private final double[] values;

    private ScoreBuffer(final Shape shape, final double[] values) {
        this.shape = shape;
        this.values = values;
    }

    public static ScoreBuffer zeros(@NonNull final Shape shape) {
        if (shape.size() > Integer.MAX_VALUE) {
            throw new IllegalArgumentException(String.format(Locale.ROOT, "shape %s is too large for a score buffer", shape));
        }
        double[] values = new double[(int) Math.max(shape.size(), 0)];
        ScoreArray.validateShape(shape, values.length);
        return new ScoreBuffer(shape, values);
    }

    /**
     * Create zero filled buffer with the same shape as given scores
     */
    public static ScoreBuffer zerosLike(@NonNull final ScoreArray scores) {
        return new ScoreBuffer(scores.getShape(), new double[scores.size()]);
    }

    public int size() {
        return values.length;
    }

    public double get(final int flatIndex) {
        return values[flatIndex];
    }

    public void set(final int flatIndex, final double value) {
        values[flatIndex] = value;
    }

    public void fill(final double value) {
        Arrays.fill(values, value);
    }

    /**
     * Snapshot of current buffer content as immutable float64 score array
     */
    public ScoreArray toScoreArray() {
        return ScoreArray.of(shape, ScoreDataType.FLOAT64, values);
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "ScoreBuffer(shape=%s)", shape);
    }
}
