package com.codeprint.code;

public class ImportFailureException extends RuntimeException {
    public final String moduleName;

    public ImportFailureException(String moduleName, String message) {
        super(message);
        this.moduleName = moduleName;
    }

    public ImportFailureException(String moduleName, String message, Throwable cause) {
        super(message, cause);
        this.moduleName = moduleName;
    }
}
