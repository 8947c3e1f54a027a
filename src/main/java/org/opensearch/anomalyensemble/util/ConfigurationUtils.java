/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package org.opensearch.anomalyensemble.util;

import java.util.Locale;
import java.util.Map;
import java.util.Objects;

import lombok.AccessLevel;
import lombok.NoArgsConstructor;

/**
 * Reads typed properties from user provided configuration. Every read property is removed from the configuration,
 * so whatever is left after all reads is not supported.
 */
@NoArgsConstructor(access = AccessLevel.PRIVATE)
public final class ConfigurationUtils {

    /**
     * Read optional map property
     * @param type type of the configured component, used in error messages
     * @param tag tag of the configured component, used in error messages
     * @param configuration configuration to read from
     * @param propertyName name of the property
     * @return map or null if property is absent
     */
    @SuppressWarnings("unchecked")
    public static Map<String, Object> readOptionalMap(
        final String type,
        final String tag,
        final Map<String, Object> configuration,
        final String propertyName
    ) {
        Object value = configuration.remove(propertyName);
        if (Objects.isNull(value)) {
            return null;
        }
        if (!(value instanceof Map)) {
            throw newConfigurationException(
                type,
                tag,
                propertyName,
                String.format(Locale.ROOT, "property isn't a map, but of type [%s]", value.getClass().getName())
            );
        }
        return (Map<String, Object>) value;
    }

    /**
     * Read string property, default value is returned when property is absent
     */
    public static String readStringProperty(
        final String type,
        final String tag,
        final Map<String, Object> configuration,
        final String propertyName,
        final String defaultValue
    ) {
        Object value = configuration.remove(propertyName);
        if (Objects.isNull(value)) {
            return defaultValue;
        }
        if (!(value instanceof String)) {
            throw newConfigurationException(
                type,
                tag,
                propertyName,
                String.format(Locale.ROOT, "property isn't a string, but of type [%s]", value.getClass().getName())
            );
        }
        return (String) value;
    }

    /**
     * Fail if configuration still has properties after all supported ones have been read
     */
    public static void checkNoUnsupportedProperties(final String type, final String tag, final Map<String, Object> configuration) {
        if (Objects.nonNull(configuration) && !configuration.isEmpty()) {
            throw new IllegalArgumentException(
                String.format(
                    Locale.ROOT,
                    "[%s] of type [%s] doesn't support one or more provided configuration parameters %s",
                    tag,
                    type,
                    configuration.keySet()
                )
            );
        }
    }

    public static IllegalArgumentException newConfigurationException(
        final String type,
        final String tag,
        final String propertyName,
        final String reason
    ) {
        return new IllegalArgumentException(String.format(Locale.ROOT, "[%s] of type [%s]: [%s] %s", tag, type, propertyName, reason));
    }
}
