package com.codeprint.code;

/** Receives non-fatal resolution failures while references are extracted. */
@FunctionalInterface
public interface DiagnosticSink {
    void report(Diagnostic diagnostic);
}
