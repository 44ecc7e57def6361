package com.codeprint.code;

/** Resolves the operand of an import instruction to a module object. */
@FunctionalInterface
public interface ModuleResolver {
    /** @throws ImportFailureException if no module of that name can be found */
    Object resolve(String moduleName);
}
