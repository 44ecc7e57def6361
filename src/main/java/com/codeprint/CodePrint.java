package com.codeprint;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import com.codeprint.code.AttributeResolver;
import com.codeprint.code.CodeContext;
import com.codeprint.code.DebugDiagnosticSink;
import com.codeprint.code.DiagnosticSink;
import com.codeprint.code.ModuleResolver;
import com.codeprint.code.ReferenceList;
import com.codeprint.code.ReferenceWalker;
import com.codeprint.protocol.util.FingerprintTrace;
import com.codeprint.protocol.util.ReferenceFingerprint;
import com.codeprint.protocol.util.TokenSerializer;
import com.codeprint.runtime.CodeFunction;
import com.codeprint.runtime.DefaultAttributeResolver;
import com.codeprint.runtime.ModuleRegistry;

/**
 * Entry point for fingerprinting callables.
 *
 * <pre>
 * CodePrint cp = new CodePrint();
 * ReferenceList refs = cp.references(fn);   // what fn touches
 * String key = cp.fingerprint(fn);          // cache key for fn's behaviour
 * </pre>
 *
 * Configure with the setters before use; the engine is then safe to share.
 */
public class CodePrint {

    public static final String DEFAULT_ALGORITHM = "md5";

    private ModuleResolver moduleResolver;
    private AttributeResolver attributeResolver = DefaultAttributeResolver.INSTANCE;
    private DiagnosticSink diagnosticSink = DebugDiagnosticSink.INSTANCE;
    private String algorithm = DEFAULT_ALGORITHM;
    private final Map<Class<?>, TokenSerializer<?>> customSerializers = new LinkedHashMap<>();

    private volatile ReferenceWalker walker;
    private volatile ReferenceFingerprint fingerprint;

    public CodePrint() {
        this(new ModuleRegistry());
    }

    public CodePrint(ModuleResolver moduleResolver) {
        this.moduleResolver = Objects.requireNonNull(moduleResolver, "moduleResolver");
    }

    public synchronized void setModuleResolver(ModuleResolver resolver) {
        this.moduleResolver = Objects.requireNonNull(resolver, "resolver");
        this.walker = null;
    }

    public synchronized void setAttributeResolver(AttributeResolver resolver) {
        this.attributeResolver = Objects.requireNonNull(resolver, "resolver");
        this.walker = null;
    }

    /** Where unresolvable references are reported. Null restores the Debug hub sink. */
    public synchronized void setDiagnosticSink(DiagnosticSink sink) {
        this.diagnosticSink = (sink == null) ? DebugDiagnosticSink.INSTANCE : sink;
        this.walker = null;
    }

    public synchronized void setAlgorithm(String algorithm) {
        this.algorithm = Objects.requireNonNull(algorithm, "algorithm");
        this.fingerprint = null;
    }

    public ModuleResolver getModuleResolver() {
        return moduleResolver;
    }

    /** Adds a per-type serializer to this engine's fingerprinting. */
    public synchronized <T> CodePrint registerSerializer(Class<T> type, TokenSerializer<? super T> serializer) {
        customSerializers.put(Objects.requireNonNull(type, "type"), Objects.requireNonNull(serializer, "serializer"));
        this.fingerprint = null;
        return this;
    }

    /**
     * Ordered references of {@code fn}'s code.
     *
     * @throws com.codeprint.code.ContractViolationException if fn's closure does not match
     *         its captured variable names
     */
    public ReferenceList references(CodeFunction fn) {
        CodeContext context = CodeContext.of(fn);
        return walker().extractReferences(fn.code, context);
    }

    public String fingerprint(CodeFunction fn) {
        return fingerprinter().fingerprint(fn);
    }

    public String fingerprint(CodeFunction fn, FingerprintTrace trace) {
        return fingerprinter().fingerprint(fn, trace);
    }

    public String fingerprint(ReferenceList refs) {
        return fingerprinter().fingerprint(refs);
    }

    private ReferenceWalker walker() {
        ReferenceWalker w = walker;
        if (w == null) {
            synchronized (this) {
                if (walker == null) {
                    walker = new ReferenceWalker(moduleResolver, attributeResolver, diagnosticSink);
                }
                w = walker;
            }
        }
        return w;
    }

    private ReferenceFingerprint fingerprinter() {
        ReferenceFingerprint f = fingerprint;
        if (f == null) {
            synchronized (this) {
                if (fingerprint == null) {
                    ReferenceFingerprint created = new ReferenceFingerprint(algorithm, this::references);
                    for (Map.Entry<Class<?>, TokenSerializer<?>> e : customSerializers.entrySet()) {
                        registerUnchecked(created, e.getKey(), e.getValue());
                    }
                    fingerprint = created;
                }
                f = fingerprint;
            }
        }
        return f;
    }

    @SuppressWarnings("unchecked")
    private static void registerUnchecked(ReferenceFingerprint target, Class<?> type, TokenSerializer<?> serializer) {
        target.register((Class<Object>) type, (TokenSerializer<Object>) serializer);
    }
}
