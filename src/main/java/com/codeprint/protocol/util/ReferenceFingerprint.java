package com.codeprint.protocol.util;

import java.lang.reflect.Method;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Function;

import com.codeprint.code.Instruction;
import com.codeprint.code.ReferenceList;
import com.codeprint.code.SymbolicValue;
import com.codeprint.runtime.CodeFunction;
import com.codeprint.runtime.ScriptClass;
import com.codeprint.runtime.ScriptModule;
import com.codeprint.runtime.ScriptObject;

/**
 * Folds references into a hex digest.
 *
 * Every value becomes a sequence of canonical string tokens that are fed, in order, into a
 * {@link MessageDigest} and optionally echoed to a {@link FingerprintTrace}. JSON-like values
 * (null, booleans, numbers, strings, lists, maps) have fixed encodings, integral numbers exact;
 * every other type goes
 * through a registered {@link TokenSerializer}, falling back to its class name and
 * {@code String.valueOf}.
 *
 * Functions are hashed by their instructions, constants and, recursively, the references
 * their own code makes. A function or class already being hashed further up emits a
 * back-reference token instead of recursing again.
 */
public final class ReferenceFingerprint {

    private final String algorithm;
    private final Function<CodeFunction, ReferenceList> referenceSource;
    private final Map<Class<?>, TokenSerializer<?>> serializers = new LinkedHashMap<>();

    /**
     * @param algorithm       digest name, e.g. "md5" or "sha-256"
     * @param referenceSource extracts the references of a function met while hashing
     */
    public ReferenceFingerprint(String algorithm, Function<CodeFunction, ReferenceList> referenceSource) {
        this.algorithm = normalizeAlg(algorithm);
        this.referenceSource = Objects.requireNonNull(referenceSource, "referenceSource");
        // fail now rather than on first use
        newDigest();
        registerDefaults();
    }

    /**
     * Registers (or replaces) the serializer for values of {@code type} and its subtypes. An exact
     * type match wins; otherwise the most recently registered assignable type does.
     */
    public synchronized <T> ReferenceFingerprint register(Class<T> type, TokenSerializer<? super T> serializer) {
        serializers.remove(type);
        serializers.put(type, serializer);
        return this;
    }

    public String algorithm() {
        return algorithm;
    }

    // ---------- public API ----------

    public String fingerprint(ReferenceList refs) {
        return fingerprint(refs, null);
    }

    public String fingerprint(ReferenceList refs, FingerprintTrace trace) {
        Tokens out = new Tokens(newDigest(), trace);
        out.references(refs);
        return toHex(out.md.digest());
    }

    /** Fingerprint of a function: its code plus, recursively, everything it references. */
    public String fingerprint(CodeFunction fn) {
        return fingerprint(fn, null);
    }

    public String fingerprint(CodeFunction fn, FingerprintTrace trace) {
        Tokens out = new Tokens(newDigest(), trace);
        out.value(fn);
        return toHex(out.md.digest());
    }

    // ---------- token stream ----------

    /** One hashing pass. Not shared between threads. */
    public final class Tokens {
        private final MessageDigest md;
        private final FingerprintTrace trace;
        private final IdentityHashMap<Object, Boolean> inProgress = new IdentityHashMap<>();

        private Tokens(MessageDigest md, FingerprintTrace trace) {
            this.md = md;
            this.trace = trace;
        }

        public void put(String token) {
            if (trace != null) trace.step(token);
            // length-framed so token text can never pass for token boundaries
            byte[] bytes = token.getBytes(StandardCharsets.UTF_8);
            md.update((bytes.length + ":").getBytes(StandardCharsets.US_ASCII));
            md.update(bytes);
        }

        public void references(ReferenceList refs) {
            put("[");
            for (int i = 0; i < refs.size(); i++) {
                SymbolicValue ref = refs.get(i);
                put("i:");
                put(Integer.toString(i));
                put("=");
                if (ref.getType() == SymbolicValue.Type.PARTIAL_NAME) {
                    put("P:");
                    put(ref.asPartialName());
                } else {
                    value(ref.asConcrete());
                }
                put(";");
            }
            put("]");
        }

        public void value(Object v) {
            if (v == null) { put("N"); return; }

            if (v instanceof Boolean) { put(((Boolean) v) ? "T" : "F"); return; }

            if (v instanceof Number) {
                number((Number) v);
                return;
            }

            if (v instanceof String || v instanceof Character) {
                put("S:");
                put(v.toString());
                return;
            }

            if (v instanceof List) {
                if (backReference(v)) return;
                put("L:");
                inProgress.put(v, Boolean.TRUE);
                try {
                    list((List<?>) v);
                } finally {
                    inProgress.remove(v);
                }
                return;
            }

            if (v instanceof Map) {
                if (backReference(v)) return;
                put("M:");
                inProgress.put(v, Boolean.TRUE);
                try {
                    map((Map<?, ?>) v);
                } finally {
                    inProgress.remove(v);
                }
                return;
            }

            TokenSerializer<Object> serializer = serializerFor(v.getClass());
            if (serializer == null) {
                put("X:");
                put(v.getClass().getName());
                put(String.valueOf(v));
                return;
            }

            if (backReference(v)) return;
            Object key = identityKey(v);
            inProgress.put(key, Boolean.TRUE);
            try {
                serializer.serialize(v, this);
            } finally {
                inProgress.remove(key);
            }
        }

        private boolean backReference(Object v) {
            if (!inProgress.containsKey(identityKey(v))) return false;
            put("R:");
            put(backReferenceName(v));
            return true;
        }

        private void number(Number n) {
            if (n instanceof Double || n instanceof Float) {
                put("D:");
                put(Double.toString(n.doubleValue()));
            } else if (n instanceof Integer || n instanceof Long || n instanceof Short || n instanceof Byte
                    || n instanceof BigInteger || n instanceof AtomicInteger || n instanceof AtomicLong) {
                put("I:");
                put(n.toString());
            } else if (n instanceof BigDecimal) {
                put("B:");
                put(((BigDecimal) n).toPlainString());
            } else {
                put("X:");
                put(n.getClass().getName());
                put(n.toString());
            }
        }

        private void list(List<?> list) {
            put("[");
            for (int i = 0; i < list.size(); i++) {
                put("i:");
                put(Integer.toString(i));
                put("=");
                value(list.get(i));
                put(";");
            }
            put("]");
        }

        private void map(Map<?, ?> map) {
            put("{");
            List<Map.Entry<?, ?>> entries = new ArrayList<>(map.entrySet());
            entries.sort(Comparator.comparing(e -> String.valueOf(e.getKey())));
            for (Map.Entry<?, ?> e : entries) {
                put("k:");
                put(String.valueOf(e.getKey()));
                put("=");
                value(e.getValue());
                put(";");
            }
            put("}");
        }
    }

    // ---------------- serializers ----------------

    @SuppressWarnings("unchecked")
    private synchronized TokenSerializer<Object> serializerFor(Class<?> type) {
        TokenSerializer<?> exact = serializers.get(type);
        if (exact != null) return (TokenSerializer<Object>) exact;
        // newest registration first
        List<Map.Entry<Class<?>, TokenSerializer<?>>> entries = new ArrayList<>(serializers.entrySet());
        for (int i = entries.size() - 1; i >= 0; i--) {
            Map.Entry<Class<?>, TokenSerializer<?>> e = entries.get(i);
            if (e.getKey().isAssignableFrom(type)) return (TokenSerializer<Object>) e.getValue();
        }
        return null;
    }

    private void registerDefaults() {
        register(CodeFunction.class, (fn, out) -> {
            out.put("F:");
            out.put(fn.qualifiedName());
            out.put("code:");
            for (Instruction op : fn.code.instructions) {
                // line numbers are left out: moving code around must not invalidate
                out.put(op.opcode.name());
                if (op.operand != null) {
                    out.put("a:");
                    out.put(op.operand);
                }
                out.put(";");
            }
            out.put("consts:");
            out.list(fn.code.constants);
            out.put("refs:");
            out.references(referenceSource.apply(fn));
        });

        register(ScriptClass.class, (cls, out) -> {
            out.put("C:");
            out.put(cls.name);
            out.put("{");
            for (Map.Entry<String, Object> e : cls.members().entrySet()) {
                out.put("m:");
                out.put(e.getKey());
                out.put("=");
                out.value(e.getValue());
                out.put(";");
            }
            out.put("}");
        });

        // Modules are hashed by name; their contents are covered by the references into them.
        register(ScriptModule.class, (module, out) -> {
            out.put("MOD:");
            out.put(module.name);
        });

        register(ScriptObject.class, (obj, out) -> {
            out.put("O:");
            out.value(obj.type);
            out.put("fields:");
            out.map(obj.fields);
        });

        register(Class.class, (type, out) -> {
            out.put("J:");
            out.put(type.getName());
        });

        register(Method.class, (method, out) -> {
            out.put("JM:");
            out.put(method.getDeclaringClass().getName() + "#" + method.getName());
            for (Class<?> p : method.getParameterTypes()) {
                out.put("p:");
                out.put(p.getName());
            }
        });

        register(Enum.class, (constant, out) -> {
            out.put("E:");
            out.put(constant.getDeclaringClass().getName() + "." + constant.name());
        });
    }

    // ---------------- helpers ----------------

    private static Object identityKey(Object v) {
        return (v instanceof CodeFunction) ? ((CodeFunction) v).code : v;
    }

    private static String backReferenceName(Object v) {
        if (v instanceof CodeFunction) return ((CodeFunction) v).qualifiedName();
        if (v instanceof ScriptClass) return ((ScriptClass) v).name;
        return v.getClass().getName();
    }

    private MessageDigest newDigest() {
        try {
            return MessageDigest.getInstance(algorithm);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalArgumentException("fingerprint: unsupported algorithm: " + algorithm, e);
        }
    }

    private static String normalizeAlg(String alg) {
        if (alg == null) throw new IllegalArgumentException("fingerprint: algorithm is null");
        String a = alg.trim().toUpperCase(Locale.ROOT).replace("_", "-");

        // allow both forms: SHA256 / SHA-256, etc.
        if (a.equals("SHA1")) return "SHA-1";
        if (a.equals("SHA256")) return "SHA-256";
        if (a.equals("SHA512")) return "SHA-512";
        return a;
    }

    private static String toHex(byte[] bytes) {
        char[] hex = "0123456789abcdef".toCharArray();
        char[] out = new char[bytes.length * 2];
        for (int i = 0; i < bytes.length; i++) {
            int v = bytes[i] & 0xFF;
            out[i * 2] = hex[v >>> 4];
            out[i * 2 + 1] = hex[v & 0x0F];
        }
        return new String(out);
    }
}
