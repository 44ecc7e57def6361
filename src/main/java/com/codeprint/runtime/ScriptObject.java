package com.codeprint.runtime;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import com.codeprint.code.ResolutionFailureException;

/**
 * Instance of a {@link ScriptClass}. Attribute lookup checks the instance fields first,
 * then the class; functions found on the class come back bound to this instance.
 */
public final class ScriptObject implements HasAttributes {
    public final ScriptClass type;
    public final Map<String, Object> fields = new LinkedHashMap<>();

    public ScriptObject(ScriptClass type) {
        this.type = Objects.requireNonNull(type, "type");
    }

    public ScriptObject set(String field, Object value) {
        fields.put(field, value);
        return this;
    }

    @Override
    public boolean hasAttribute(String attr) {
        return fields.containsKey(attr) || type.hasAttribute(attr);
    }

    @Override
    public Object getAttribute(String attr) {
        if (fields.containsKey(attr)) return fields.get(attr);
        if (!type.hasAttribute(attr)) {
            throw new ResolutionFailureException("'" + type.name + "' object has no attribute '" + attr + "'");
        }
        Object member = type.getAttribute(attr);
        if (member instanceof CodeFunction) {
            return ((CodeFunction) member).bind(this);
        }
        return member;
    }

    @Override
    public String toString() {
        return "<" + type.name + " object>";
    }
}
