package com.codeprint.code;

import java.util.Objects;

/**
 * The walker's working register: nothing pending, a resolved runtime value, or a
 * dotted name that could not be resolved.
 */
public final class SymbolicValue {
    public enum Type { EMPTY, CONCRETE, PARTIAL_NAME }

    private static final SymbolicValue EMPTY = new SymbolicValue(Type.EMPTY, null);

    public final Type type;
    public final Object value;

    private SymbolicValue(Type type, Object value) {
        this.type = type;
        this.value = value;
    }

    public static SymbolicValue empty() { return EMPTY; }
    public static SymbolicValue concrete(Object v) { return new SymbolicValue(Type.CONCRETE, v); }
    public static SymbolicValue partialName(String s) { return new SymbolicValue(Type.PARTIAL_NAME, Objects.requireNonNull(s, "name")); }

    public Type getType() { return type; }

    public boolean isEmpty() { return type == Type.EMPTY; }

    public Object asConcrete() {
        if (type != Type.CONCRETE) throw new IllegalStateException("Expected concrete value, got " + type);
        return value;
    }

    public String asPartialName() {
        if (type != Type.PARTIAL_NAME) throw new IllegalStateException("Expected partial name, got " + type);
        return (String) value;
    }

    /** Appends an attribute to a partial name: {@code a.b} + {@code c} gives {@code a.b.c}. */
    public SymbolicValue withAttribute(String attr) {
        return partialName(asPartialName() + "." + attr);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SymbolicValue)) return false;
        SymbolicValue other = (SymbolicValue) o;
        return type == other.type && Objects.equals(value, other.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, value);
    }

    @Override
    public String toString() {
        switch (type) {
            case EMPTY:
                return "<empty>";
            case PARTIAL_NAME:
                return "name(" + value + ")";
            default:
                return "value(" + value + ")";
        }
    }
}
