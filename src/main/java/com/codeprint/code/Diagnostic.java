package com.codeprint.code;

/** A reference the walker could not resolve; reported, never thrown. */
public final class Diagnostic {
    public final String callableName;
    public final String filename;
    /** Last source line seen before the failure, or null if none was seen yet. */
    public final Integer line;
    public final String failure;
    public final Throwable cause;

    public Diagnostic(String callableName, String filename, Integer line, String failure, Throwable cause) {
        this.callableName = callableName;
        this.filename = filename;
        this.line = line;
        this.failure = failure;
        this.cause = cause;
    }

    /** Human readable form used by the default sink. */
    public String message() {
        return "Found a code reference in file " + filename
                + " at line " + (line == null ? "?" : line.toString())
                + " that cannot be hashed when hashing " + callableName + "."
                + " The reference is left out of the fingerprint, so changes to it"
                + " will not invalidate the cache.\n" + failure;
    }

    @Override
    public String toString() {
        return callableName + " (" + filename + ":" + (line == null ? "?" : line.toString()) + "): " + failure;
    }
}
