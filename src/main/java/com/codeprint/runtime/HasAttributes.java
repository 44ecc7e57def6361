package com.codeprint.runtime;

/** A runtime value whose attributes can be looked up by name. */
public interface HasAttributes {
    boolean hasAttribute(String name);

    /** @throws com.codeprint.code.ResolutionFailureException when the attribute does not exist */
    Object getAttribute(String name);
}
