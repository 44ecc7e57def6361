package com.codeprint.code;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public final class DiagnosticCollector implements DiagnosticSink {
    private final List<Diagnostic> diagnostics = new ArrayList<>();

    @Override
    public synchronized void report(Diagnostic diagnostic) {
        diagnostics.add(diagnostic);
    }

    public synchronized List<Diagnostic> diagnostics() {
        return Collections.unmodifiableList(new ArrayList<>(diagnostics));
    }

    public synchronized void clear() {
        diagnostics.clear();
    }
}
