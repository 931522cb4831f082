package com.useless.script.error;

/**
 * Every way a script can fail at runtime. Only fatal kinds pass through {@code catch}.
 */
public enum ErrorKind {
    NAME_NOT_FOUND("NameNotFound", false),
    TYPE_MISMATCH("TypeMismatch", false),
    DIVISION_BY_ZERO("DivisionByZero", false),
    INDEX_OUT_OF_VACATION("IndexOutOfVacation", false),
    EMPTY_RECORD_ACCESS("EmptyRecordAccess", false),
    PROMISE_ABANDONED("PromiseAbandoned", false),
    PROMISE_REJECTED("PromiseRejected", false),
    SAVE_ALWAYS_FAILS("SaveAlwaysFails", true),
    TEAPOT_ERROR("TeapotError", false),
    CALL_DEPTH_EXCEEDED("CallDepthExceeded", false);

    private final String displayName;
    private final boolean fatal;

    ErrorKind(String displayName, boolean fatal) {
        this.displayName = displayName;
        this.fatal = fatal;
    }

    /** The name scripts see in the {@code kind} field of a caught error. */
    public String displayName() {
        return displayName;
    }

    public boolean isFatal() {
        return fatal;
    }
}
