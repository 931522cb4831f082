package com.useless.script.error;

/**
 * Runtime failure raised while evaluating a script. Carries an {@link ErrorValue}
 * so the evaluator can bind it to a {@code catch} variable or reject a promise with it.
 */
public class ScriptError extends RuntimeException {
    private static final long serialVersionUID = 1L;

    public static final String BROWSER_MESSAGE =
            "Failed to open browser tab. Either your internet is as reliable as a chocolate teapot, "
                    + "or the universe is working exactly as intended.";

    private final ErrorValue error;

    public ScriptError(ErrorValue error) {
        super(error.toString());
        this.error = error;
    }

    public ScriptError(ErrorKind kind, String message) {
        this(new ErrorValue(kind, message));
    }

    public ErrorValue error() { return error; }
    public ErrorKind kind() { return error.kind(); }
    public boolean isFatal() { return error.isFatal(); }

    /** Same failure, with the line attached if it had none. */
    public ScriptError atLine(int line) {
        if (error.line() != null) return this;
        return new ScriptError(error.atLine(line));
    }

    public static ScriptError nameNotFound(String name) {
        return new ScriptError(ErrorKind.NAME_NOT_FOUND,
                "Variable '" + name + "' not found. Have you tried looking under the couch?");
    }

    public static ScriptError onVacation(String name) {
        return new ScriptError(ErrorKind.NAME_NOT_FOUND,
                "Variable '" + name + " (it's on vacation)' not found. Have you tried looking under the couch?");
    }

    public static ScriptError typeMismatch(String message) {
        return new ScriptError(ErrorKind.TYPE_MISMATCH, message);
    }

    public static ScriptError divisionByZero() {
        return new ScriptError(ErrorKind.DIVISION_BY_ZERO,
                "Division by zero. Congratulations, you've broken mathematics! 🎉");
    }

    public static ScriptError indexOutOfVacation(long index, int length) {
        return new ScriptError(ErrorKind.INDEX_OUT_OF_VACATION,
                "Index " + index + " is on vacation. The array only has " + length + " element(s) and they're all busy.");
    }

    public static ScriptError emptyRecordAccess(String key) {
        return new ScriptError(ErrorKind.EMPTY_RECORD_ACCESS,
                "Tried to read '" + key + "' from an empty record. There's nothing here but dust bunnies.");
    }

    public static ScriptError promiseAbandoned() {
        return new ScriptError(ErrorKind.PROMISE_ABANDONED,
                "The promise was abandoned. It said it would call, but it never did.");
    }

    public static ScriptError promiseRejected() {
        return new ScriptError(ErrorKind.PROMISE_REJECTED,
                "The promise changed its mind. Task failed successfully!");
    }

    public static ScriptError saveAlwaysFails() {
        return new ScriptError(ErrorKind.SAVE_ALWAYS_FAILS,
                "Saving is overrated. Maybe try writing it down with a crayon instead? 📝");
    }

    public static ScriptError teapot() {
        return new ScriptError(ErrorKind.TEAPOT_ERROR,
                "Error 418: I'm a teapot. Yes, really. No, I won't make coffee. ☕");
    }

    public static ScriptError callDepthExceeded(int depth) {
        return new ScriptError(ErrorKind.CALL_DEPTH_EXCEEDED,
                "Max call depth (" + depth + ") exceeded. It's functions all the way down.");
    }
}
