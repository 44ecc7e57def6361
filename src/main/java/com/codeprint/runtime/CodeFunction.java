package com.codeprint.runtime;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import com.codeprint.code.CodeObject;

/**
 * A callable: compiled code bound to the namespace it was defined in, the cells it
 * closes over and, for bound methods, its receiver.
 */
public final class CodeFunction {
    public final CodeObject code;
    public final Map<String, Object> globals;
    public final List<Cell> closure;
    private final Object receiver;
    private final boolean bound;

    public CodeFunction(CodeObject code, Map<String, Object> globals) {
        this(code, globals, Collections.<Cell>emptyList());
    }

    public CodeFunction(CodeObject code, Map<String, Object> globals, List<Cell> closure) {
        this(code, globals, closure, null, false);
    }

    private CodeFunction(CodeObject code, Map<String, Object> globals, List<Cell> closure, Object receiver, boolean bound) {
        this.code = Objects.requireNonNull(code, "code");
        this.globals = Objects.requireNonNull(globals, "globals"); // shared, never copied
        this.closure = Collections.unmodifiableList(new ArrayList<>(closure));
        this.receiver = receiver;
        this.bound = bound;
    }

    /** Returns a bound method: same code, globals and closure, with the given receiver. */
    public CodeFunction bind(Object receiver) {
        return new CodeFunction(code, globals, closure, receiver, true);
    }

    public boolean isBoundMethod() {
        return bound;
    }

    public Object receiver() {
        if (!bound) throw new IllegalStateException(code.name + " is not a bound method");
        return receiver;
    }

    public String qualifiedName() {
        return code.filename + ":" + code.name;
    }

    @Override
    public String toString() {
        return bound ? "<bound method " + code.name + " of " + receiver + ">" : "<function " + code.name + ">";
    }
}
