package com.algoscript.debug;

public enum DebugLevel {
    TRACE,
    DEBUG,
    INFO,
    WARN,
    ERROR;

    public boolean atLeast(DebugLevel min) {
        return ordinal() >= min.ordinal();
    }
}
