package com.codeprint.runtime;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import com.codeprint.code.ResolutionFailureException;

/** Stateless class descriptor: ordered members (methods and class attributes). */
public final class ScriptClass implements HasAttributes {
    public final String name;
    private final LinkedHashMap<String, Object> members = new LinkedHashMap<>();

    public ScriptClass(String name) {
        this.name = Objects.requireNonNull(name, "name");
    }

    public ScriptClass member(String memberName, Object value) {
        members.put(memberName, value);
        return this;
    }

    public Map<String, Object> members() {
        return Collections.unmodifiableMap(members);
    }

    public ScriptObject newInstance() {
        return new ScriptObject(this);
    }

    @Override
    public boolean hasAttribute(String attr) {
        return members.containsKey(attr);
    }

    @Override
    public Object getAttribute(String attr) {
        if (!members.containsKey(attr)) {
            throw new ResolutionFailureException("type object '" + name + "' has no attribute '" + attr + "'");
        }
        return members.get(attr);
    }

    @Override
    public String toString() {
        return "<class '" + name + "'>";
    }
}
