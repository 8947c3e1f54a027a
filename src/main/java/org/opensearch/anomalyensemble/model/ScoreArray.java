/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package org.opensearch.anomalyensemble.model;

import java.lang.reflect.Array;
import java.util.Arrays;
import java.util.Locale;
import java.util.Objects;

import ai.djl.ndarray.types.Shape;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;

/**
 * Immutable N-dimensional array of anomaly scores. Elements are stored flat in row-major order,
 * the shape describes how the flat sequence maps to positions. Rank and element type are dynamic.
 */
@EqualsAndHashCode
public final class ScoreArray {
    @Getter
    private final Shape shape;
    @Getter
    private final ScoreDataType dataType;
    private final double[] values;

    private ScoreArray(final Shape shape, final ScoreDataType dataType, final double[] values) {
        this.shape = shape;
        this.dataType = dataType;
        this.values = values;
    }

    /**
     * Create score array of arbitrary rank from flat row-major values
     * @param shape shape of the array, product of dimensions must match number of values
     * @param dataType element type of the array
     * @param values flat values, copied
     * @return new score array
     */
    public static ScoreArray of(@NonNull final Shape shape, @NonNull final ScoreDataType dataType, @NonNull final double[] values) {
        validateShape(shape, values.length);
        return new ScoreArray(shape, dataType, Arrays.copyOf(values, values.length));
    }

    public static ScoreArray of(@NonNull final double[] values) {
        return new ScoreArray(new Shape(values.length), ScoreDataType.FLOAT64, Arrays.copyOf(values, values.length));
    }

    public static ScoreArray of(@NonNull final float[] values) {
        double[] copy = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            copy[i] = values[i];
        }
        return new ScoreArray(new Shape(values.length), ScoreDataType.FLOAT32, copy);
    }

    public static ScoreArray of(@NonNull final int[] values) {
        return new ScoreArray(new Shape(values.length), ScoreDataType.INT32, Arrays.stream(values).asDoubleStream().toArray());
    }

    /**
     * Values above 2^53 in magnitude lose precision as they are held as doubles
     */
    public static ScoreArray of(@NonNull final long[] values) {
        return new ScoreArray(new Shape(values.length), ScoreDataType.INT64, Arrays.stream(values).asDoubleStream().toArray());
    }

    public static ScoreArray of(@NonNull final double[][] values) {
        int columns = columnCount(values.length, values.length == 0 ? 0 : lengthOf(values[0]));
        double[] flat = new double[values.length * columns];
        for (int row = 0; row < values.length; row++) {
            checkRowLength(row, lengthOf(values[row]), columns);
            System.arraycopy(values[row], 0, flat, row * columns, columns);
        }
        return new ScoreArray(new Shape(values.length, columns), ScoreDataType.FLOAT64, flat);
    }

    public static ScoreArray of(@NonNull final float[][] values) {
        int columns = columnCount(values.length, values.length == 0 ? 0 : lengthOf(values[0]));
        double[] flat = new double[values.length * columns];
        for (int row = 0; row < values.length; row++) {
            checkRowLength(row, lengthOf(values[row]), columns);
            for (int column = 0; column < columns; column++) {
                flat[row * columns + column] = values[row][column];
            }
        }
        return new ScoreArray(new Shape(values.length, columns), ScoreDataType.FLOAT32, flat);
    }

    public static ScoreArray of(@NonNull final int[][] values) {
        int columns = columnCount(values.length, values.length == 0 ? 0 : lengthOf(values[0]));
        double[] flat = new double[values.length * columns];
        for (int row = 0; row < values.length; row++) {
            checkRowLength(row, lengthOf(values[row]), columns);
            for (int column = 0; column < columns; column++) {
                flat[row * columns + column] = values[row][column];
            }
        }
        return new ScoreArray(new Shape(values.length, columns), ScoreDataType.INT32, flat);
    }

    /**
     * Total number of elements
     */
    public int size() {
        return values.length;
    }

    public int rank() {
        return shape.dimension();
    }

    /**
     * Get element by its position in the flat row-major sequence
     * @param flatIndex 0-based index in flat sequence
     * @return value of the element
     */
    public double get(final int flatIndex) {
        return values[flatIndex];
    }

    /**
     * Get element by its N-dimensional index
     * @param index one 0-based index per dimension
     * @return value of the element
     */
    public double getAt(final long... index) {
        if (index.length != shape.dimension()) {
            throw new IllegalArgumentException(
                String.format(Locale.ROOT, "index of rank %d does not match array of rank %d", index.length, shape.dimension())
            );
        }
        int flatIndex = 0;
        for (int dimension = 0; dimension < index.length; dimension++) {
            long dimensionSize = shape.get(dimension);
            if (index[dimension] < 0 || index[dimension] >= dimensionSize) {
                throw new IndexOutOfBoundsException(
                    String.format(Locale.ROOT, "index %d is out of bounds for dimension %d of size %d", index[dimension], dimension, dimensionSize)
                );
            }
            flatIndex = (int) (flatIndex * dimensionSize + index[dimension]);
        }
        return values[flatIndex];
    }

    /**
     * Copy of elements in flat row-major order
     */
    public double[] toDoubleArray() {
        return Arrays.copyOf(values, values.length);
    }

    /**
     * Copy of elements as matrix, only defined for arrays of rank 2
     */
    public double[][] toDoubleMatrix() {
        if (shape.dimension() != 2) {
            throw new IllegalStateException(String.format(Locale.ROOT, "array of shape %s is not a matrix", shape));
        }
        int rows = (int) shape.get(0);
        int columns = (int) shape.get(1);
        double[][] matrix = new double[rows][];
        for (int row = 0; row < rows; row++) {
            matrix[row] = Arrays.copyOfRange(values, row * columns, (row + 1) * columns);
        }
        return matrix;
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "ScoreArray(shape=%s, dataType=%s)", shape, dataType);
    }

    static void validateShape(final Shape shape, final int numberOfValues) {
        if (shape.dimension() == 0) {
            throw new IllegalArgumentException("shape of score array must have at least one dimension");
        }
        for (long dimensionSize : shape.getShape()) {
            if (dimensionSize < 0) {
                throw new IllegalArgumentException(String.format(Locale.ROOT, "shape %s has negative dimension", shape));
            }
        }
        if (shape.size() != numberOfValues) {
            throw new IllegalArgumentException(
                String.format(Locale.ROOT, "shape %s requires %d values but %d were provided", shape, shape.size(), numberOfValues)
            );
        }
    }

    private static int lengthOf(final Object row) {
        Objects.requireNonNull(row, "rows of score matrix must not be null");
        return Array.getLength(row);
    }

    private static int columnCount(final int rows, final int columns) {
        if ((long) rows * columns > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("score matrix is too large");
        }
        return columns;
    }

    private static void checkRowLength(final int row, final int actualLength, final int expectedLength) {
        if (actualLength != expectedLength) {
            throw new IllegalArgumentException(
                String.format(Locale.ROOT, "score matrix is jagged, row %d has %d columns, expected %d", row, actualLength, expectedLength)
            );
        }
    }
}
