/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package org.opensearch.anomalyensemble.processor.combination;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

import org.opensearch.anomalyensemble.model.ScoreArray;

/**
 * Collection of utility methods for score combination technique classes
 */
public class ScoreCombinationUtil {
    public static final int MIN_NUMBER_OF_SCORE_ARRAYS = 2;
    public static final int MAX_NUMBER_OF_SCORE_ARRAYS = 4;

    /**
     * Validate config parameters for this technique
     * @param actualParams map of parameters in form of name-value
     * @param supportedParams collection of parameters that we should validate against, typically that's what is supported by exact technique
     */
    public void validateParams(final Map<String, Object> actualParams, final Set<String> supportedParams) {
        if (Objects.isNull(actualParams) || actualParams.isEmpty()) {
            return;
        }
        // check if only supported params are passed
        Optional<String> optionalNotSupportedParam = actualParams.keySet()
            .stream()
            .filter(paramName -> !supportedParams.contains(paramName))
            .findFirst();
        if (optionalNotSupportedParam.isPresent()) {
            throw new IllegalArgumentException(
                String.format(
                    Locale.ROOT,
                    "provided parameter for combination technique is not supported. supported parameters are [%s]",
                    supportedParams.stream().sorted().collect(Collectors.joining(","))
                )
            );
        }
    }

    /**
     * Validate that score arrays can be stacked: between 2 and 4 arrays without NaN, all of them with the same shape and element type
     * @param scoreArrays score arrays of detectors
     */
    public void validateScoreArrays(final List<ScoreArray> scoreArrays) {
        if (Objects.isNull(scoreArrays)) {
            throw new IllegalArgumentException("score arrays must not be null");
        }
        if (scoreArrays.size() < MIN_NUMBER_OF_SCORE_ARRAYS || scoreArrays.size() > MAX_NUMBER_OF_SCORE_ARRAYS) {
            throw new IllegalArgumentException(
                String.format(
                    Locale.ROOT,
                    "number of score arrays must be between %d and %d, got %d",
                    MIN_NUMBER_OF_SCORE_ARRAYS,
                    MAX_NUMBER_OF_SCORE_ARRAYS,
                    scoreArrays.size()
                )
            );
        }
        for (int i = 0; i < scoreArrays.size(); i++) {
            if (Objects.isNull(scoreArrays.get(i))) {
                throw new IllegalArgumentException(String.format(Locale.ROOT, "score array at position %d is null", i));
            }
        }
        for (int i = 0; i < scoreArrays.size(); i++) {
            ScoreArray scoreArray = scoreArrays.get(i);
            for (int position = 0; position < scoreArray.size(); position++) {
                if (Double.isNaN(scoreArray.get(position))) {
                    throw new IllegalArgumentException(
                        String.format(Locale.ROOT, "score array at position %d contains NaN at element %d", i, position)
                    );
                }
            }
        }
        ScoreArray first = scoreArrays.get(0);
        for (int i = 1; i < scoreArrays.size(); i++) {
            ScoreArray scoreArray = scoreArrays.get(i);
            if (!first.getShape().equals(scoreArray.getShape())) {
                throw new IllegalArgumentException(
                    String.format(
                        Locale.ROOT,
                        "all score arrays must have the same shape, array at position %d has shape %s, expected %s",
                        i,
                        scoreArray.getShape(),
                        first.getShape()
                    )
                );
            }
            if (first.getDataType() != scoreArray.getDataType()) {
                throw new IllegalArgumentException(
                    String.format(
                        Locale.ROOT,
                        "all score arrays must have the same element type, array at position %d is of type %s, expected %s",
                        i,
                        scoreArray.getDataType(),
                        first.getDataType()
                    )
                );
            }
        }
    }
}
