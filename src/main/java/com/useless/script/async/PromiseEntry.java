package com.useless.script.async;

import java.util.ArrayList;
import java.util.List;

import com.useless.script.error.ErrorValue;
import com.useless.script.parser.Value;

/**
 * One row of the promise table. Mutated only by {@link PromiseScheduler}.
 */
public final class PromiseEntry {
    final PromiseHandle handle;
    final String label;
    final long createdAt;
    final long timeoutMillis;
    final boolean taskBacked;
    final boolean mindChange;

    PromiseState state = PromiseState.PENDING;
    Value value;
    ErrorValue error;
    boolean changedMind;
    int settledTick = -1;

    final List<Suspension> waiters = new ArrayList<>();

    PromiseEntry(PromiseHandle handle, String label, long createdAt, long timeoutMillis,
                 Value value, boolean taskBacked, boolean mindChange) {
        this.handle = handle;
        this.label = label;
        this.createdAt = createdAt;
        this.timeoutMillis = timeoutMillis;
        this.value = value;
        this.taskBacked = taskBacked;
        this.mindChange = mindChange;
    }

    public PromiseHandle handle() { return handle; }
    public PromiseState state() { return state; }
    public long createdAt() { return createdAt; }
    public long timeoutMillis() { return timeoutMillis; }
    public boolean hasMindChangeFlag() { return mindChange; }
    public boolean hasChangedMind() { return changedMind; }
    public int settledTick() { return settledTick; }

    /** The resolution value; meaningful once {@link PromiseState#RESOLVED}. */
    public Value value() { return value; }

    /** The rejection; meaningful once {@link PromiseState#REJECTED}. */
    public ErrorValue error() { return error; }

    @Override
    public String toString() {
        return handle + "(" + label + ", " + state + ")";
    }

    static final class Suspension {
        final long seq;
        final Waiter waiter;

        Suspension(long seq, Waiter waiter) {
            this.seq = seq;
            this.waiter = waiter;
        }
    }
}
