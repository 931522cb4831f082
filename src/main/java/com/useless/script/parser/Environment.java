package com.useless.script.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.useless.script.error.ScriptError;

/**
 * One lexical scope. Scopes chain to their parent; the chain ends at the global scope.
 *
 * Closures hold a reference to the scope they were created in, so an assignment made
 * through any holder is visible to all of them.
 */
public class Environment {
    public final Environment parent;
    private final Map<String, Value> values = new LinkedHashMap<>();

    /** Global scope. */
    public Environment() {
        this.parent = null;
    }

    private Environment(Environment parent) {
        this.parent = parent;
    }

    public Environment childScope() {
        return new Environment(this);
    }

    /** Binds in this scope. Redeclaring a name in the same scope overwrites it. */
    public void define(String name, Value value) {
        values.put(name, value);
    }

    public Value get(String name) {
        for (Environment e = this; e != null; e = e.parent) {
            Value v = e.values.get(name);
            if (v != null) return v;
        }
        throw ScriptError.nameNotFound(name);
    }

    public boolean exists(String name) {
        for (Environment e = this; e != null; e = e.parent) {
            if (e.values.containsKey(name)) return true;
        }
        return false;
    }

    /** Overwrites the nearest existing binding. */
    public void assign(String name, Value value) {
        for (Environment e = this; e != null; e = e.parent) {
            if (e.values.containsKey(name)) {
                e.values.put(name, value);
                return;
            }
        }
        throw ScriptError.nameNotFound(name);
    }

    /** Merged view of the whole chain, nearest binding wins. */
    public Map<String, Value> snapshot() {
        List<Environment> chain = new ArrayList<>();
        for (Environment e = this; e != null; e = e.parent) chain.add(e);
        Collections.reverse(chain);

        Map<String, Value> out = new LinkedHashMap<>();
        for (Environment e : chain) out.putAll(e.values);
        return out;
    }
}
