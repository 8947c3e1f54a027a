/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package org.opensearch.anomalyensemble;

import java.util.Arrays;
import java.util.List;

import org.junit.Assert;
import org.junit.function.ThrowingRunnable;
import org.junit.runner.RunWith;
import org.opensearch.anomalyensemble.model.ScoreArray;
import org.opensearch.anomalyensemble.model.ScoreDataType;

import com.carrotsearch.randomizedtesting.JUnit3MethodProvider;
import com.carrotsearch.randomizedtesting.RandomizedRunner;
import com.carrotsearch.randomizedtesting.RandomizedTest;
import com.carrotsearch.randomizedtesting.annotations.TestMethodProviders;

import ai.djl.ndarray.types.Shape;

/**
 * Base class for tests, runs every public no-arg method which name starts with "test" under randomized runner
 */
@RunWith(RandomizedRunner.class)
@TestMethodProviders({ JUnit3MethodProvider.class })
public abstract class AnomalyEnsembleTestBase extends Assert {

    protected static final double DELTA_FOR_ASSERTION = 1e-9;

    /**
     * Run code that is expected to fail and return the failure for further checks
     */
    protected static <T extends Throwable> T expectThrows(final Class<T> expectedType, final ThrowingRunnable runnable) {
        return assertThrows(expectedType, runnable);
    }

    protected static double randomDouble() {
        return RandomizedTest.randomDouble();
    }

    protected static int randomIntBetween(final int min, final int max) {
        return RandomizedTest.randomIntBetween(min, max);
    }

    protected static <T> T randomFrom(final List<T> values) {
        return RandomizedTest.randomFrom(values);
    }

    /**
     * Random float64 scores of given shape, values are from [0, 1)
     */
    protected static ScoreArray randomScores(final long... dimensions) {
        Shape shape = new Shape(dimensions);
        double[] values = new double[(int) shape.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = randomDouble();
        }
        return ScoreArray.of(shape, ScoreDataType.FLOAT64, values);
    }

    /**
     * Random distinct scores in ascending order
     */
    protected static double[] randomDistinctSortedScores(final int size) {
        double[] values = new double[size];
        double value = randomDouble();
        for (int i = 0; i < size; i++) {
            value += 0.001 + randomDouble();
            values[i] = value;
        }
        Arrays.sort(values);
        return values;
    }
}
