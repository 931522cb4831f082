package com.useless.debug;

import java.io.PrintStream;

/** Writes every record at or above a threshold to a stream, one line each. */
public final class StreamDebugSink implements DebugSink {
    private final PrintStream out;
    private final DebugLevel threshold;

    public StreamDebugSink(PrintStream out, DebugLevel threshold) {
        this.out = out;
        this.threshold = (threshold == null) ? DebugLevel.TRACE : threshold;
    }

    @Override
    public void log(DebugLevel level, String tag, String message, Throwable error) {
        if (!level.atLeast(threshold)) return;
        out.println("[" + level + "] " + tag + ": " + message);
        if (error != null) error.printStackTrace(out);
    }
}
