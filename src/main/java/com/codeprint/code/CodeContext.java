package com.codeprint.code;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.codeprint.runtime.Cell;
import com.codeprint.runtime.CodeFunction;

/**
 * Snapshot of the bindings a callable's code can see.
 *
 * globalBindings is a read-only view of the function's live namespace (not a copy).
 * cellBindings maps every captured name either to the captured value or, for cells
 * defined by the function itself, to the name. localBindings is only the seed the
 * walker starts each pass from; every walk mutates its own copy.
 */
public final class CodeContext {
    public static final String RECEIVER_NAME = "self";

    private final Map<String, Object> globalBindings;
    private final Map<String, SymbolicValue> cellBindings;
    private final Map<String, SymbolicValue> localBindings;

    public CodeContext(Map<String, Object> globalBindings,
                       Map<String, SymbolicValue> cellBindings,
                       Map<String, SymbolicValue> localBindings) {
        this.globalBindings = Collections.unmodifiableMap(globalBindings);
        this.cellBindings = Collections.unmodifiableMap(new LinkedHashMap<>(cellBindings));
        this.localBindings = Collections.unmodifiableMap(new LinkedHashMap<>(localBindings));
    }

    /**
     * Builds the context of a function.
     *
     * @throws ContractViolationException if the function's free variables and closure cells
     *         differ in count
     */
    public static CodeContext of(CodeFunction fn) {
        CodeObject code = fn.code;

        Map<String, SymbolicValue> cells = new LinkedHashMap<>();

        // No value exists yet for a cell this very function defines; use its name.
        for (String cellVar : code.cellVars) {
            cells.put(cellVar, SymbolicValue.partialName(cellVar));
        }

        List<String> freeVars = code.freeVars;
        List<Cell> closure = fn.closure;
        if (freeVars.size() != closure.size()) {
            throw new ContractViolationException(
                    code.name + " declares " + freeVars.size() + " free variable(s) " + freeVars
                            + " but its closure holds " + closure.size() + " cell(s)");
        }
        for (int i = 0; i < freeVars.size(); i++) {
            cells.put(freeVars.get(i), SymbolicValue.concrete(closure.get(i).getContents()));
        }

        Map<String, SymbolicValue> locals = new LinkedHashMap<>();
        if (fn.isBoundMethod()) {
            locals.put(RECEIVER_NAME, SymbolicValue.concrete(fn.receiver()));
        }

        return new CodeContext(fn.globals, cells, locals);
    }

    public Map<String, Object> globalBindings() {
        return globalBindings;
    }

    public Map<String, SymbolicValue> cellBindings() {
        return cellBindings;
    }

    public Map<String, SymbolicValue> localBindings() {
        return localBindings;
    }
}
