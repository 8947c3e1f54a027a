/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package org.opensearch.anomalyensemble.util;

import java.util.HashMap;
import java.util.Map;

import org.opensearch.anomalyensemble.AnomalyEnsembleTestBase;

public class ConfigurationUtilsTests extends AnomalyEnsembleTestBase {
    private static final String TYPE = "type";
    private static final String TAG = "tag";

    public void testReadOptionalMap_whenPresent_thenReturnedAndRemoved() {
        Map<String, Object> configuration = new HashMap<>();
        configuration.put("clause", Map.of("technique", "max"));

        Map<String, Object> clause = ConfigurationUtils.readOptionalMap(TYPE, TAG, configuration, "clause");

        assertEquals(Map.of("technique", "max"), clause);
        assertTrue(configuration.isEmpty());
    }

    public void testReadOptionalMap_whenAbsent_thenNull() {
        assertNull(ConfigurationUtils.readOptionalMap(TYPE, TAG, new HashMap<>(), "clause"));
    }

    public void testReadOptionalMap_whenNotMap_thenFail() {
        Map<String, Object> configuration = new HashMap<>();
        configuration.put("clause", 42);

        IllegalArgumentException exception = expectThrows(
            IllegalArgumentException.class,
            () -> ConfigurationUtils.readOptionalMap(TYPE, TAG, configuration, "clause")
        );
        assertEquals("[tag] of type [type]: [clause] property isn't a map, but of type [java.lang.Integer]", exception.getMessage());
    }

    public void testReadStringProperty_whenPresentOrAbsent_thenValueOrDefault() {
        Map<String, Object> configuration = new HashMap<>();
        configuration.put("technique", "median");

        assertEquals("median", ConfigurationUtils.readStringProperty(TYPE, TAG, configuration, "technique", "mean"));
        assertEquals("mean", ConfigurationUtils.readStringProperty(TYPE, TAG, configuration, "technique", "mean"));
    }

    public void testReadStringProperty_whenNotString_thenFail() {
        Map<String, Object> configuration = new HashMap<>();
        configuration.put("technique", 1.5);

        IllegalArgumentException exception = expectThrows(
            IllegalArgumentException.class,
            () -> ConfigurationUtils.readStringProperty(TYPE, TAG, configuration, "technique", "mean")
        );
        assertEquals("[tag] of type [type]: [technique] property isn't a string, but of type [java.lang.Double]", exception.getMessage());
    }

    public void testCheckNoUnsupportedProperties_whenLeftovers_thenFail() {
        ConfigurationUtils.checkNoUnsupportedProperties(TYPE, TAG, new HashMap<>());
        ConfigurationUtils.checkNoUnsupportedProperties(TYPE, TAG, null);

        IllegalArgumentException exception = expectThrows(
            IllegalArgumentException.class,
            () -> ConfigurationUtils.checkNoUnsupportedProperties(TYPE, TAG, Map.of("foo", "bar"))
        );
        assertEquals("[tag] of type [type] doesn't support one or more provided configuration parameters [foo]", exception.getMessage());
    }
}
