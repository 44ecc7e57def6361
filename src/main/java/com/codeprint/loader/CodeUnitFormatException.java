package com.codeprint.loader;

/** A code unit document is malformed; the message names the offending JSON path. */
public class CodeUnitFormatException extends RuntimeException {
    public final String path;

    public CodeUnitFormatException(String path, String message) {
        super(path + ": " + message);
        this.path = path;
    }

    public CodeUnitFormatException(String path, String message, Throwable cause) {
        super(path + ": " + message, cause);
        this.path = path;
    }
}
