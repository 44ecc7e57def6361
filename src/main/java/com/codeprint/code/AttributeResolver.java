package com.codeprint.code;

/** Looks up {@code target.name} on a resolved runtime value. */
@FunctionalInterface
public interface AttributeResolver {
    /** @throws ResolutionFailureException if the attribute cannot be read */
    Object getAttribute(Object target, String name);
}
