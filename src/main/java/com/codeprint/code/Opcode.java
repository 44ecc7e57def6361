package com.codeprint.code;

import java.util.Collections;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Named opcodes of a compiled callable. Every opcode belongs to one {@link Kind};
 * the reference walker only ever dispatches on the kind.
 */
public enum Opcode {
    LOAD_GLOBAL(Kind.LOAD_GLOBAL),
    LOAD_NAME(Kind.LOAD_GLOBAL),

    LOAD_DEREF(Kind.LOAD_CAPTURED),
    LOAD_CLOSURE(Kind.LOAD_CAPTURED),

    IMPORT_NAME(Kind.IMPORT_MODULE),

    LOAD_ATTR(Kind.LOAD_ATTRIBUTE),
    LOAD_METHOD(Kind.LOAD_ATTRIBUTE),
    IMPORT_FROM(Kind.LOAD_ATTRIBUTE),

    DELETE_FAST(Kind.DELETE_LOCAL),
    STORE_FAST(Kind.STORE_LOCAL),
    LOAD_FAST(Kind.LOAD_LOCAL),

    LOAD_CONST(Kind.OTHER),
    CALL_FUNCTION(Kind.OTHER),
    CALL_METHOD(Kind.OTHER),
    RETURN_VALUE(Kind.OTHER),
    POP_TOP(Kind.OTHER),
    STORE_ATTR(Kind.OTHER),
    STORE_GLOBAL(Kind.OTHER),
    STORE_DEREF(Kind.OTHER),
    MAKE_FUNCTION(Kind.OTHER),
    BUILD_TUPLE(Kind.OTHER),
    BINARY_ADD(Kind.OTHER),
    COMPARE_OP(Kind.OTHER),
    JUMP(Kind.OTHER),
    POP_JUMP_IF_FALSE(Kind.OTHER),
    NOP(Kind.OTHER);

    /** Opcode categories the reference walker distinguishes. */
    public enum Kind {
        LOAD_GLOBAL,
        LOAD_CAPTURED,
        IMPORT_MODULE,
        LOAD_ATTRIBUTE,
        DELETE_LOCAL,
        STORE_LOCAL,
        LOAD_LOCAL,
        OTHER
    }

    private static final Map<String, Opcode> BY_NAME;
    static {
        Map<String, Opcode> map = new HashMap<>();
        for (Opcode op : values()) map.put(op.name(), op);
        BY_NAME = Collections.unmodifiableMap(map);
    }

    public final Kind kind;

    Opcode(Kind kind) {
        this.kind = kind;
    }

    public static Opcode fromName(String opname) {
        if (opname == null) throw new IllegalArgumentException("opname is null");
        Opcode op = BY_NAME.get(opname.trim().toUpperCase(Locale.ROOT));
        if (op == null) throw new IllegalArgumentException("Unknown opcode: " + opname);
        return op;
    }
}
