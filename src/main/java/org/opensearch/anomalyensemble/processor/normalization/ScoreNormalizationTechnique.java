/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package org.opensearch.anomalyensemble.processor.normalization;

import org.opensearch.anomalyensemble.model.ScoreArray;
import org.opensearch.anomalyensemble.model.ScoreBuffer;

/**
 * Abstracts normalization of raw detector scores into comparable scale
 */
public interface ScoreNormalizationTechnique {

    /**
     * Normalize scores into newly allocated float64 array of the same shape. Input is not mutated.
     * @param scores raw scores of a single detector
     * @return normalized scores
     */
    ScoreArray normalize(final ScoreArray scores);

    /**
     * Normalize scores into caller provided buffer. Only the buffer is mutated.
     * @param output buffer with the same shape as scores
     * @param scores raw scores of a single detector
     * @return the same buffer that has been passed in
     */
    ScoreBuffer normalizeInto(final ScoreBuffer output, final ScoreArray scores);

    String techniqueName();

    /**
     * Human readable description of technique and its effective parameters
     */
    String describe();
}
