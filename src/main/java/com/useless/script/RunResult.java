package com.useless.script;

import java.util.Map;

import com.useless.script.error.ErrorValue;
import com.useless.script.parser.Value;

public class RunResult {
    private final ExitCode exitCode;
    private final ErrorValue error;
    private final Map<String, Value> globals;
    private final long seed;
    private final int ticks;

    public RunResult(ExitCode exitCode, ErrorValue error, Map<String, Value> globals, long seed, int ticks) {
        this.exitCode = exitCode;
        this.error = error;
        this.globals = globals;
        this.seed = seed;
        this.ticks = ticks;
    }

    public ExitCode exitCode() { return exitCode; }

    /** The error that ended the run, or null. */
    public ErrorValue error() { return error; }

    /** Global bindings when the run ended, in declaration order. */
    public Map<String, Value> globals() { return globals; }

    /** The seed the run used; replaying it reproduces the run. */
    public long seed() { return seed; }

    public int ticks() { return ticks; }

    public boolean succeeded() { return exitCode == ExitCode.SUCCESS; }

    @Override
    public String toString() {
        return "RunResult{" + exitCode + ", seed=" + seed + ", ticks=" + ticks
                + (error == null ? "" : ", error=" + error) + "}";
    }
}
