/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package org.opensearch.anomalyensemble.processor.normalization.bounds;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

import org.apache.commons.lang3.StringUtils;

/**
 * Defines quantile level assigned to a score that is greater than the highest quantile threshold.
 * That happens when the last quantile level is below 1.0.
 */
public enum OutOfRangeMode {
    /**
     * Score is set to 0.0, which is not one of the quantile levels
     */
    ZERO,
    /**
     * Score is set to the highest quantile level
     */
    TOP_QUANTILE;

    public static final OutOfRangeMode DEFAULT = ZERO;

    public static String getValidValues() {
        return Arrays.stream(values()).map(mode -> mode.name().toLowerCase(Locale.ROOT)).collect(Collectors.joining(", "));
    }

    public static OutOfRangeMode fromString(String value) {
        if (StringUtils.isBlank(value)) {
            return DEFAULT;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(
                String.format(Locale.ROOT, "invalid mode: %s, valid values are: %s", value, getValidValues())
            );
        }
    }

    @Override
    public String toString() {
        return name().toLowerCase(Locale.ROOT);
    }
}
