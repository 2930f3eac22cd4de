/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.engraving.io;

import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.Validate;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One entry of the event list of a voice, e.g. a note or a clef, with its properties as plain strings
 */
public final class ImportEvent {
    private final String name;
    private final Map<String, String> properties;

    public ImportEvent(String name, Map<String, String> properties) {
        Validate.notBlank(name, "event name must not be blank");
        this.name = name;
        this.properties = Collections.unmodifiableMap(new LinkedHashMap<>(properties));
    }

    /**
     * @param keyValues alternating property names and values
     */
    public static ImportEvent of(String name, String... keyValues) {
        Validate.isTrue(keyValues.length % 2 == 0, "properties of %s need a value for each key", name);
        Map<String, String> properties = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            properties.put(keyValues[i], keyValues[i + 1]);
        }
        return new ImportEvent(name, properties);
    }

    public String getName() {
        return name;
    }

    public Map<String, String> getProperties() {
        return properties;
    }

    public boolean has(String key) {
        return properties.containsKey(key);
    }

    /**
     * @return the property or an empty string if it is not set
     */
    public String getString(String key) {
        return StringUtils.defaultString(properties.get(key));
    }

    public int getInt(String key, int defaultValue) {
        String value = properties.get(key);
        if (StringUtils.isBlank(value))
            return defaultValue;
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Property " + key + " of " + name + " is not a number: " + value, e);
        }
    }

    @Override
    public String toString() {
        return name + properties;
    }
}
