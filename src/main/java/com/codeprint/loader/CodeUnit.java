package com.codeprint.loader;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import com.codeprint.runtime.CodeFunction;
import com.codeprint.runtime.ScriptModule;

/** A loaded code unit: its module namespace and its functions in declaration order. */
public final class CodeUnit {
    public final ScriptModule module;
    public final String filename;
    private final Map<String, CodeFunction> functions;

    CodeUnit(ScriptModule module, String filename, LinkedHashMap<String, CodeFunction> functions) {
        this.module = module;
        this.filename = filename;
        this.functions = Collections.unmodifiableMap(functions);
    }

    public Map<String, CodeFunction> functions() {
        return functions;
    }

    public CodeFunction function(String name) {
        CodeFunction fn = functions.get(name);
        if (fn == null) {
            throw new IllegalArgumentException("No function '" + name + "' in " + module.name
                    + " (have " + functions.keySet() + ")");
        }
        return fn;
    }
}
