package com.codeprint.protocol.util;

/**
 * Turns values of one type into canonical hashing tokens.
 * Implementations feed tokens through {@link ReferenceFingerprint.Tokens} only, and recurse
 * into nested values with {@link ReferenceFingerprint.Tokens#value(Object)}.
 */
@FunctionalInterface
public interface TokenSerializer<T> {
    void serialize(T value, ReferenceFingerprint.Tokens out);
}
