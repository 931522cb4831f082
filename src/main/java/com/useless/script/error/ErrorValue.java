package com.useless.script.error;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import com.useless.script.parser.Value;

/**
 * Immutable description of a runtime failure: what kind, a human message, and
 * (when known) the source line that raised it.
 */
public final class ErrorValue {
    private final ErrorKind kind;
    private final String message;
    private final Integer line;

    public ErrorValue(ErrorKind kind, String message, Integer line) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.message = (message == null) ? "" : message;
        this.line = line;
    }

    public ErrorValue(ErrorKind kind, String message) {
        this(kind, message, null);
    }

    public ErrorKind kind() { return kind; }
    public String message() { return message; }
    public Integer line() { return line; }
    public boolean isFatal() { return kind.isFatal(); }

    /** Attaches a line number unless one is already recorded. */
    public ErrorValue atLine(int line) {
        if (this.line != null) return this;
        return new ErrorValue(kind, message, line);
    }

    /** The record a {@code catch} variable is bound to. */
    public Value toRecord() {
        Map<String, Value> m = new LinkedHashMap<>();
        m.put("kind", Value.string(kind.displayName()));
        m.put("message", Value.string(message));
        if (line != null) m.put("line", Value.number(line));
        return Value.record(m);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ErrorValue)) return false;
        ErrorValue other = (ErrorValue) o;
        return kind == other.kind && message.equals(other.message) && Objects.equals(line, other.line);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, message, line);
    }

    @Override
    public String toString() {
        String where = (line == null) ? "" : " [line " + line + "]";
        return kind.displayName() + where + ": " + message;
    }
}
