package com.useless.script.async;

/** Opaque reference from a script value into the scheduler's promise table. */
public final class PromiseHandle {
    final int id;

    PromiseHandle(int id) {
        this.id = id;
    }

    public int id() { return id; }

    @Override
    public boolean equals(Object o) {
        return (o instanceof PromiseHandle) && ((PromiseHandle) o).id == id;
    }

    @Override
    public int hashCode() {
        return Integer.hashCode(id);
    }

    @Override
    public String toString() {
        return "promise#" + id;
    }
}
