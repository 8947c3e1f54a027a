/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package org.opensearch.anomalyensemble.processor.combination;

public interface ScoreCombinationTechnique {

    /**
     * Defines combination function specific to this technique
     * @param scores scores of all detectors at a single position
     * @return combined score
     */
    double combine(final double[] scores);

    String techniqueName();

    String describe();
}
