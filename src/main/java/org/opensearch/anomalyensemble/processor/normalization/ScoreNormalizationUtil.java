/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package org.opensearch.anomalyensemble.processor.normalization;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

import org.opensearch.anomalyensemble.model.ScoreArray;
import org.opensearch.anomalyensemble.model.ScoreBuffer;
import org.opensearch.anomalyensemble.processor.normalization.bounds.OutOfRangeMode;

/**
 * Collection of utility methods for score normalization technique classes
 */
public class ScoreNormalizationUtil {

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
                    "provided parameter for normalization technique is not supported. supported parameters are [%s]",
                    String.join(",", supportedParams.stream().sorted().toArray(String[]::new))
                )
            );
        }
    }

    /**
     * Read quantile levels from parameters, default levels are used when parameter is absent
     * @param params map of parameters in form of name-value
     * @param paramName name of parameter with collection of numbers
     * @return quantile levels
     */
    public QuantileLevels getQuantileLevels(final Map<String, Object> params, final String paramName) {
        if (Objects.isNull(params) || !params.containsKey(paramName)) {
            return QuantileLevels.DEFAULT;
        }
        Object value = params.get(paramName);
        if (!(value instanceof List)) {
            throw new IllegalArgumentException(String.format(Locale.ROOT, "parameter [%s] must be a collection of numbers", paramName));
        }
        List<?> levels = (List<?>) value;
        if (levels.stream().anyMatch(level -> !(level instanceof Number))) {
            throw new IllegalArgumentException(String.format(Locale.ROOT, "parameter [%s] must be a collection of numbers", paramName));
        }
        return QuantileLevels.of(levels.stream().map(Number.class::cast).collect(Collectors.toList()));
    }

    /**
     * Read out of range mode from parameters, default mode is used when parameter is absent
     */
    public OutOfRangeMode getOutOfRangeMode(final Map<String, Object> params, final String paramName) {
        if (Objects.isNull(params) || !params.containsKey(paramName)) {
            return OutOfRangeMode.DEFAULT;
        }
        Object value = params.get(paramName);
        if (!(value instanceof String)) {
            throw new IllegalArgumentException(String.format(Locale.ROOT, "parameter [%s] must be a string", paramName));
        }
        return OutOfRangeMode.fromString((String) value);
    }

    /**
     * Check that scores can be normalized: at least one element and only finite values
     */
    public void validateScores(final ScoreArray scores) {
        if (Objects.isNull(scores)) {
            throw new IllegalArgumentException("scores must not be null");
        }
        if (scores.size() == 0) {
            throw new IllegalArgumentException("scores must contain at least one element");
        }
        for (int i = 0; i < scores.size(); i++) {
            if (!Double.isFinite(scores.get(i))) {
                throw new IllegalArgumentException(
                    String.format(Locale.ROOT, "scores must be finite numbers, found %s at position %d", scores.get(i), i)
                );
            }
        }
    }

    /**
     * Check that output buffer can hold normalized scores
     */
    public void validateOutput(final ScoreBuffer output, final ScoreArray scores) {
        if (Objects.isNull(output)) {
            throw new IllegalArgumentException("output buffer must not be null");
        }
        if (!output.getShape().equals(scores.getShape())) {
            throw new IllegalArgumentException(
                String.format(
                    Locale.ROOT,
                    "output buffer shape %s does not match scores shape %s",
                    output.getShape(),
                    scores.getShape()
                )
            );
        }
    }
}
