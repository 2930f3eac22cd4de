/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.engraving;

import org.apache.commons.lang3.Validate;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Layer content the engine has no dedicated kind for, e.g. a dot of division. It takes part in the layout through its
 * duration only. Attributes are kept as plain strings in the order they were set
 */
public class GenericLayerElement extends LayerElement {
    private final String name;
    private final Map<String, String> attributes = new LinkedHashMap<>();

    public GenericLayerElement(String name) {
        super(NodeKind.GENERIC_ELEMENT);
        this.name = name;
    }

    private GenericLayerElement(GenericLayerElement other) {
        super(other);
        this.name = other.name;
        this.attributes.putAll(other.attributes);
    }

    @Override
    public GenericLayerElement copyAttributes() {
        return new GenericLayerElement(this);
    }

    public String getName() {
        return name;
    }

    public void setAttribute(String key, String value) {
        Validate.notBlank(key, "attribute name must not be blank");
        if (value == null)
            attributes.remove(key);
        else
            attributes.put(key, value);
    }

    /**
     * @return the attribute or null if it is not set
     */
    public String getAttribute(String key) {
        return attributes.get(key);
    }

    public Map<String, String> getAttributes() {
        return Collections.unmodifiableMap(attributes);
    }
}
