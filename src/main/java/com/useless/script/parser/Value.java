package com.useless.script.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import com.useless.script.async.PromiseHandle;
import com.useless.script.error.ScriptError;

/**
 * Runtime value: a tagged union over {@link Type}.
 *
 * Arrays and records are immutable once built, so passing one around behaves
 * exactly like handing out a private copy.
 */
public final class Value {
    public enum Type { NUMBER, BOOL, STRING, NULL, ARRAY, RECORD, FUNC, PROMISE }

    private static final Value NIL = new Value(Type.NULL, null);
    private static final Value TRUE = new Value(Type.BOOL, Boolean.TRUE);
    private static final Value FALSE = new Value(Type.BOOL, Boolean.FALSE);

    public final Type type;
    public final Object value;

    private Value(Type type, Object value) {
        this.type = type;
        this.value = value;
    }

    public static Value number(double d) { return new Value(Type.NUMBER, d); }
    public static Value bool(boolean b) { return b ? TRUE : FALSE; }
    public static Value string(String s) { return new Value(Type.STRING, Objects.requireNonNull(s, "string")); }
    public static Value nil() { return NIL; }
    public static Value func(ScriptFunction f) { return new Value(Type.FUNC, Objects.requireNonNull(f, "function")); }
    public static Value promise(PromiseHandle h) { return new Value(Type.PROMISE, Objects.requireNonNull(h, "promise")); }

    public static Value array(List<Value> items) {
        return new Value(Type.ARRAY, Collections.unmodifiableList(new ArrayList<>(items)));
    }

    public static Value record(Map<String, Value> fields) {
        return new Value(Type.RECORD, Collections.unmodifiableMap(new LinkedHashMap<>(fields)));
    }

    public Type getType() { return type; }

    /** Lower-case name used in error messages. */
    public String typeName() {
        switch (type) {
            case NUMBER: return "number";
            case BOOL: return "boolean";
            case STRING: return "text";
            case NULL: return "null";
            case ARRAY: return "array";
            case RECORD: return "record";
            case FUNC: return "function";
            case PROMISE: return "promise";
            default: throw new IllegalStateException("Unknown value type: " + type);
        }
    }

    public double asNumber() {
        if (type != Type.NUMBER) throw mismatch("number");
        return (double) value;
    }

    public boolean asBool() {
        if (type != Type.BOOL) throw mismatch("boolean");
        return (boolean) value;
    }

    public String asString() {
        if (type != Type.STRING) throw mismatch("text");
        return (String) value;
    }

    @SuppressWarnings("unchecked")
    public List<Value> asArray() {
        if (type != Type.ARRAY) throw mismatch("array");
        return (List<Value>) value;
    }

    @SuppressWarnings("unchecked")
    public Map<String, Value> asRecord() {
        if (type != Type.RECORD) throw mismatch("record");
        return (Map<String, Value>) value;
    }

    public ScriptFunction asFunction() {
        if (type != Type.FUNC) throw mismatch("function");
        return (ScriptFunction) value;
    }

    public PromiseHandle asPromise() {
        if (type != Type.PROMISE) throw mismatch("promise");
        return (PromiseHandle) value;
    }

    private ScriptError mismatch(String expected) {
        return ScriptError.typeMismatch("Expected " + expected + ", got " + typeName());
    }

    public boolean isScalar() {
        return type == Type.NUMBER || type == Type.BOOL || type == Type.STRING || type == Type.NULL;
    }

    /** Truthiness used by every boolean context; applied before any chaos. */
    public boolean coerceBoolean() {
        switch (type) {
            case BOOL: return asBool();
            case NULL: return false;
            case NUMBER: {
                double d = asNumber();
                return d != 0.0 && !Double.isNaN(d);
            }
            case STRING: return !asString().isEmpty();
            default: return true;
        }
    }

    /**
     * Script-level equality. A boolean compared with another scalar uses that
     * scalar's truthiness; null equals only null; other cross-type pairs are a
     * {@code TypeMismatch}.
     */
    public static boolean scriptEquals(Value a, Value b) {
        if (a.type == b.type) return a.equals(b);

        if (a.isScalar() && b.isScalar()) {
            if (a.type == Type.NULL || b.type == Type.NULL) return false;
            if (a.type == Type.BOOL) return a.asBool() == b.coerceBoolean();
            if (b.type == Type.BOOL) return b.asBool() == a.coerceBoolean();
            // number vs text
        }
        throw ScriptError.typeMismatch("Cannot compare " + a.typeName() + " with " + b.typeName()
                + ". Apples and oranges, except worse.");
    }

    public static boolean lessThan(Value a, Value b) {
        if (a.type == b.type) {
            switch (a.type) {
                case NUMBER: return a.asNumber() < b.asNumber();
                case STRING: return a.asString().compareTo(b.asString()) < 0;
                case BOOL: return !a.asBool() && b.asBool();
                default: break;
            }
        }
        throw ScriptError.typeMismatch("Cannot order " + a.typeName() + " against " + b.typeName()
                + ". Math is hard, let's go shopping!");
    }

    /**
     * Structural equality for scalars and containers (record keys in any order),
     * identity for functions and promises.
     */
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Value)) return false;
        Value other = (Value) o;
        if (type != other.type) return false;
        switch (type) {
            case NULL: return true;
            case NUMBER: return asNumber() == other.asNumber();
            case FUNC: return value == other.value;
            default: return value.equals(other.value);
        }
    }

    @Override
    public int hashCode() {
        switch (type) {
            case NULL: return 0;
            case FUNC: return System.identityHashCode(value);
            case NUMBER: {
                double d = asNumber();
                return Double.hashCode(d == 0.0 ? 0.0 : d);
            }
            default: return Objects.hash(type, value);
        }
    }

    @Override
    public String toString() {
        switch (type) {
            case NUMBER:
                return Double.toString(asNumber());
            case BOOL:
                return Boolean.toString(asBool());
            case STRING:
                return '"' + asString() + '"';
            case ARRAY:
                return asArray().toString();
            case RECORD:
                return asRecord().toString();
            case FUNC:
                return "<function " + asFunction().name + ">";
            case PROMISE:
                return "<" + asPromise() + ">";
            default:
                return "null";
        }
    }
}
