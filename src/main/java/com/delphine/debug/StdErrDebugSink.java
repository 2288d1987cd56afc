package com.delphine.debug;

import java.io.PrintStream;

/** Writes debug lines at or above a minimum level to a stream (stderr by default). */
public final class StdErrDebugSink implements DebugSink {

    private final DebugLevel minLevel;
    private final PrintStream out;

    public StdErrDebugSink(DebugLevel minLevel) {
        this(minLevel, System.err);
    }

    public StdErrDebugSink(DebugLevel minLevel, PrintStream out) {
        this.minLevel = (minLevel == null) ? DebugLevel.INFO : minLevel;
        this.out = out;
    }

    @Override
    public void log(DebugLevel level, String tag, String message, Throwable error) {
        if (!level.atLeast(minLevel)) return;
        out.println("[" + level + "] " + tag + ": " + message);
        if (error != null) error.printStackTrace(out);
    }
}
