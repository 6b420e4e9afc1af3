package com.algoscript.debug;

import java.io.PrintStream;

/** Writes "[LEVEL] tag: message" lines to a stream, dropping anything below the minimum level. */
public final class ConsoleDebugSink implements DebugSink {

    private final PrintStream out;
    private final DebugLevel minLevel;

    public ConsoleDebugSink(PrintStream out, DebugLevel minLevel) {
        this.out = out;
        this.minLevel = (minLevel == null) ? DebugLevel.WARN : minLevel;
    }

    @Override
    public void log(DebugLevel level, String tag, String message, Throwable error) {
        if (!level.atLeast(minLevel)) return;
        out.println("[" + level + "] " + tag + ": " + message);
        if (error != null && !minLevel.atLeast(DebugLevel.INFO)) {
            error.printStackTrace(out);
        }
    }
}
