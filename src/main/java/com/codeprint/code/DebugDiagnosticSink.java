package com.codeprint.code;

import com.codeprint.debug.Debug;

/** Default sink: forwards each diagnostic to the Debug hub as a warning. */
public final class DebugDiagnosticSink implements DiagnosticSink {
    public static final String TAG = "codeprint.references";

    public static final DebugDiagnosticSink INSTANCE = new DebugDiagnosticSink();

    private DebugDiagnosticSink() {}

    @Override
    public void report(Diagnostic diagnostic) {
        Debug.get().w(TAG, diagnostic.message(), diagnostic.cause);
    }
}
