package com.useless.script;

/** Process exit codes for a script run. */
public enum ExitCode {
    SUCCESS(0),
    UNCAUGHT_ERROR(1),
    FATAL(2),
    USAGE(64),
    PARSE_ERROR(65),
    UNREADABLE_SCRIPT(66);

    private final int code;

    ExitCode(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }
}
