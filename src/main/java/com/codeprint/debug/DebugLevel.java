package com.codeprint.debug;

public enum DebugLevel {
    TRACE, DEBUG, INFO, WARN, ERROR
}
