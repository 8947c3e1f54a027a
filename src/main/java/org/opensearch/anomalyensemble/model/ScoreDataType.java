/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package org.opensearch.anomalyensemble.model;

import java.util.Locale;

/**
 * Element type of a score array. Values are held as doubles regardless of type, the type is kept so that
 * arrays produced by different detectors can be checked for compatibility before they are combined.
 */
public enum ScoreDataType {
    INT32,
    INT64,
    FLOAT32,
    FLOAT64;

    @Override
    public String toString() {
        return name().toLowerCase(Locale.ROOT);
    }
}
