package com.useless.script.parser;

/** Source text that is not a valid program. Never reaches a script's {@code catch}. */
public class ParseException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    private final int line;

    public ParseException(int line, String message) {
        super("[line " + line + "] " + message);
        this.line = line;
    }

    public int line() {
        return line;
    }
}
