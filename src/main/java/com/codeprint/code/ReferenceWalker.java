package com.codeprint.code;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import com.codeprint.debug.Debug;

/**
 * Finds the objects and names a callable's code refers to.
 *
 * The instruction stream names attributes separately from the value they are read from:
 * {@code foo.bar} shows up as a load of {@code foo} followed by a load of attribute
 * {@code bar}. The walker replays the stream over a single symbolic "top of stack" register
 * to link the two, resolving against the bindings in a {@link CodeContext} where it can and
 * falling back to the dotted name where it cannot. Nothing is executed.
 *
 * A walker holds only its collaborators; each call to {@link #extractReferences} keeps its
 * state in a private {@link Walk}, so one walker may serve concurrent callers.
 */
public final class ReferenceWalker {

    private final ModuleResolver modules;
    private final AttributeResolver attributes;
    private final DiagnosticSink diagnostics;

    public ReferenceWalker(ModuleResolver modules, AttributeResolver attributes, DiagnosticSink diagnostics) {
        this.modules = Objects.requireNonNull(modules, "modules");
        this.attributes = Objects.requireNonNull(attributes, "attributes");
        this.diagnostics = Objects.requireNonNull(diagnostics, "diagnostics");
    }

    /**
     * Walks every instruction of {@code code} once, in order. Never throws for a reference it
     * cannot resolve: the failure goes to the diagnostic sink and the reference is dropped.
     */
    public ReferenceList extractReferences(CodeObject code, CodeContext context) {
        Walk walk = new Walk(code, context);
        for (Instruction op : code.instructions) {
            walk.step(op);
        }
        return walk.finish();
    }

    private final class Walk {
        private final CodeObject code;
        private final Map<String, Object> globals;
        private final Map<String, SymbolicValue> cells;
        private final Map<String, SymbolicValue> locals;

        private SymbolicValue tos = SymbolicValue.empty();
        private Integer lineno;
        private final List<SymbolicValue> refs = new ArrayList<>();

        Walk(CodeObject code, CodeContext context) {
            this.code = code;
            this.globals = context.globalBindings();
            this.cells = context.cellBindings();
            this.locals = new LinkedHashMap<>(context.localBindings());
        }

        void step(Instruction op) {
            // Keep the previous line when this one has none, so failures point near their source.
            if (op.line != null) lineno = op.line;

            try {
                dispatch(op);
            } catch (RuntimeException | LinkageError e) {
                report(e);
                tos = SymbolicValue.empty();
            }
        }

        ReferenceList finish() {
            commit();
            return new ReferenceList(refs);
        }

        private void dispatch(Instruction op) {
            String name = op.operand;

            switch (op.kind()) {
                case LOAD_GLOBAL:
                    push(globals.containsKey(name)
                            ? SymbolicValue.concrete(globals.get(name))
                            : SymbolicValue.partialName(name));
                    break;

                case LOAD_CAPTURED: {
                    SymbolicValue cell = cells.get(name);
                    if (cell == null) {
                        throw new ResolutionFailureException("free variable '" + name + "' has no binding in " + code.name);
                    }
                    push(cell);
                    break;
                }

                case IMPORT_MODULE:
                    push(importModule(name));
                    break;

                case LOAD_ATTRIBUTE:
                    loadAttribute(name);
                    break;

                case DELETE_LOCAL:
                    if (!tos.isEmpty()) {
                        locals.remove(name);
                        tos = SymbolicValue.empty();
                    }
                    break;

                case STORE_LOCAL:
                    if (!tos.isEmpty()) {
                        locals.put(name, tos);
                        tos = SymbolicValue.empty();
                    }
                    break;

                case LOAD_LOCAL:
                    if (locals.containsKey(name)) {
                        push(locals.get(name));
                    } else {
                        commit();
                    }
                    break;

                default:
                    // Anything else is assumed to consume whatever was pending.
                    commit();
                    break;
            }
        }

        private void loadAttribute(String attr) {
            switch (tos.type) {
                case EMPTY:
                    refs.add(SymbolicValue.partialName(attr));
                    break;
                case PARTIAL_NAME:
                    tos = tos.withAttribute(attr);
                    break;
                default:
                    tos = SymbolicValue.concrete(attributes.getAttribute(tos.value, attr));
                    break;
            }
        }

        private SymbolicValue importModule(String moduleName) {
            try {
                return SymbolicValue.concrete(modules.resolve(moduleName));
            } catch (ImportFailureException e) {
                Debug.get().d(DebugDiagnosticSink.TAG, "import of " + moduleName + " in " + code.name
                        + " not resolvable, using its name: " + e.getMessage());
                return SymbolicValue.partialName(moduleName);
            }
        }

        /** Commits the pending value, then makes {@code next} the pending value. */
        private void push(SymbolicValue next) {
            commit();
            tos = next;
        }

        private void commit() {
            if (!tos.isEmpty()) {
                refs.add(tos);
                tos = SymbolicValue.empty();
            }
        }

        private void report(Throwable e) {
            String failure = e.getClass().getSimpleName() + ": " + e.getMessage();
            Diagnostic d = new Diagnostic(code.name, code.filename, lineno, failure, e);
            try {
                diagnostics.report(d);
            } catch (RuntimeException sinkFailure) {
                Debug.get().e(DebugDiagnosticSink.TAG, "diagnostic sink failed while reporting: " + d, sinkFailure);
            }
        }
    }
}
