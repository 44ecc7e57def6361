package com.codeprint.runtime;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import com.codeprint.code.ResolutionFailureException;

/** A named namespace. Functions defined in a module use its attribute map as their globals. */
public final class ScriptModule implements HasAttributes {
    public final String name;
    private final Map<String, Object> attributes = new LinkedHashMap<>();

    public ScriptModule(String name) {
        this.name = Objects.requireNonNull(name, "name");
    }

    public ScriptModule define(String attr, Object value) {
        attributes.put(attr, value);
        return this;
    }

    /** Live namespace map; functions built over it observe later definitions. */
    public Map<String, Object> namespace() {
        return attributes;
    }

    public Map<String, Object> attributesView() {
        return Collections.unmodifiableMap(attributes);
    }

    @Override
    public boolean hasAttribute(String attr) {
        return attributes.containsKey(attr);
    }

    @Override
    public Object getAttribute(String attr) {
        if (!attributes.containsKey(attr)) {
            throw new ResolutionFailureException("module '" + name + "' has no attribute '" + attr + "'");
        }
        return attributes.get(attr);
    }

    @Override
    public String toString() {
        return "<module '" + name + "'>";
    }
}
