package com.useless.script.async;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;

import com.useless.debug.Debug;
import com.useless.script.chaos.ChaosPolicy;
import com.useless.script.chaos.PromiseFate;
import com.useless.script.error.ErrorValue;
import com.useless.script.error.ScriptError;
import com.useless.script.parser.Value;

/**
 * Cooperative, single-threaded owner of every promise in a run.
 *
 * <p>Two kinds of promise live here. Chaos-settled ones come from {@code promise(v, t)} and
 * are decided by {@link #tick()}. Task-backed ones belong to an async function call and are
 * settled by that task through {@link #resolve} or {@link #reject}.</p>
 *
 * <p>Parked tasks are woken through a FIFO ready queue. Tasks whose promises settle in the
 * same step wake in the order they suspended.</p>
 */
public class PromiseScheduler {
    private static final Debug.Tagged LOG = Debug.tag("scheduler");

    public static final long TICK_MILLIS = 10;
    public static final int DEFAULT_MAX_TICKS = 100_000;
    public static final long DEFAULT_TIMEOUT_MILLIS = 1000;

    private final ChaosPolicy chaos;
    private final VirtualClock clock = new VirtualClock();
    private final List<PromiseEntry> entries = new ArrayList<>();
    private final Deque<Resumption> ready = new ArrayDeque<>();

    private long suspensionSeq;
    private int ticks;
    private int maxTicks = DEFAULT_MAX_TICKS;

    public PromiseScheduler(ChaosPolicy chaos) {
        this.chaos = chaos;
    }

    public void setMaxTicks(int maxTicks) {
        if (maxTicks < 1) throw new IllegalArgumentException("maxTicks must be positive");
        this.maxTicks = maxTicks;
    }

    public int ticks() { return ticks; }
    public long now() { return clock.now(); }

    // ---------------------------------------------------------------------
    // Creation and lookup
    // ---------------------------------------------------------------------

    /** A promise that chaos will settle with {@code value}, or abandon. */
    public PromiseHandle promise(Value value, long timeoutMillis) {
        if (timeoutMillis < 0) throw new IllegalArgumentException("timeout must be >= 0");
        PromiseHandle h = new PromiseHandle(entries.size());
        boolean mindChange = chaos.flagMindChange();
        entries.add(new PromiseEntry(h, "promise", clock.now(), timeoutMillis, value, false, mindChange));
        LOG.d("%s created (timeout %dms%s)", h, timeoutMillis, mindChange ? ", may change its mind" : "");
        return h;
    }

    /** A promise settled by the task that runs {@code label}. */
    public PromiseHandle deferred(String label) {
        PromiseHandle h = new PromiseHandle(entries.size());
        entries.add(new PromiseEntry(h, label, clock.now(), Long.MAX_VALUE, Value.nil(), true, false));
        LOG.d("%s created for async %s", h, label);
        return h;
    }

    public PromiseEntry entry(PromiseHandle h) {
        if (h == null || h.id < 0 || h.id >= entries.size() || entries.get(h.id).handle != h) {
            throw new IllegalStateException("Unknown promise handle: " + h);
        }
        return entries.get(h.id);
    }

    public PromiseState state(PromiseHandle h) {
        return entry(h).state;
    }

    public int pendingCount() {
        int n = 0;
        for (PromiseEntry e : entries) if (e.state == PromiseState.PENDING) n++;
        return n;
    }

    // ---------------------------------------------------------------------
    // Task-backed settlement
    // ---------------------------------------------------------------------

    public void resolve(PromiseHandle h, Value value) {
        PromiseEntry e = entry(h);
        if (e.state != PromiseState.PENDING) {
            LOG.d("%s already %s, ignoring resolution", h, e.state);
            return;
        }
        e.value = value;
        settle(e, PromiseState.RESOLVED);
        wake(List.of(e));
    }

    public void reject(PromiseHandle h, ErrorValue error) {
        PromiseEntry e = entry(h);
        if (e.state != PromiseState.PENDING) {
            LOG.d("%s already %s, ignoring rejection", h, e.state);
            return;
        }
        e.error = error;
        settle(e, PromiseState.REJECTED);
        wake(List.of(e));
    }

    // ---------------------------------------------------------------------
    // Suspension
    // ---------------------------------------------------------------------

    /** Parks {@code waiter} until {@code h} settles. A settled promise wakes it on the next drain. */
    public void suspend(Waiter waiter, PromiseHandle h) {
        PromiseEntry e = entry(h);
        PromiseEntry.Suspension s = new PromiseEntry.Suspension(suspensionSeq++, waiter);
        if (e.state.isSettled()) {
            ready.add(new Resumption(s, e));
        } else {
            e.waiters.add(s);
        }
    }

    // ---------------------------------------------------------------------
    // Driving
    // ---------------------------------------------------------------------

    /**
     * Runs until nothing is pending and no task is ready. Errors thrown by a resumed task
     * (an uncaught top-level error, or a fatal one) propagate to the caller.
     */
    public void run() {
        while (true) {
            drainReady();
            if (pendingCount() == 0) return;

            if (!hasPendingChaos()) {
                abandonPending(true, "async tasks are only waiting on each other");
                continue;
            }
            if (ticks >= maxTicks) {
                abandonPending(false, "tick budget of " + maxTicks + " exhausted");
                continue;
            }
            tick();
        }
    }

    public void drainReady() {
        Resumption r;
        while ((r = ready.poll()) != null) {
            r.suspension.waiter.resume(r.entry);
        }
    }

    /** One step of virtual time: settle draws, timeouts, then mind changes. */
    public void tick() {
        ticks++;
        long now = clock.advance(TICK_MILLIS);
        List<PromiseEntry> settled = new ArrayList<>();

        for (PromiseEntry e : entries) {
            if (e.taskBacked) continue;

            if (e.state == PromiseState.PENDING) {
                PromiseFate fate = chaos.promiseTick();
                if (fate == PromiseFate.RESOLVE) {
                    settle(e, PromiseState.RESOLVED);
                } else if (fate == PromiseFate.ABANDON) {
                    settle(e, PromiseState.ABANDONED);
                } else if (now - e.createdAt > e.timeoutMillis) {
                    LOG.d("%s timed out after %dms", e.handle, now - e.createdAt);
                    settle(e, PromiseState.ABANDONED);
                }
                if (e.state.isSettled()) settled.add(e);
            } else if (canChangeMind(e) && chaos.mindChangeFlip()) {
                changeMind(e);
            }
        }

        wake(settled);
    }

    private boolean canChangeMind(PromiseEntry e) {
        return e.mindChange && !e.changedMind && e.settledTick < ticks
                && (e.state == PromiseState.RESOLVED || e.state == PromiseState.REJECTED);
    }

    private void changeMind(PromiseEntry e) {
        e.changedMind = true;
        if (e.state == PromiseState.RESOLVED) {
            e.state = PromiseState.REJECTED;
            e.error = ScriptError.promiseRejected().error();
        } else {
            e.state = PromiseState.RESOLVED;
        }
        LOG.d("%s changed its mind, now %s", e.handle, e.state);
    }

    private void settle(PromiseEntry e, PromiseState state) {
        e.state = state;
        e.settledTick = ticks;
        LOG.d("%s %s at %dms", e.handle, state, clock.now());
    }

    private void wake(List<PromiseEntry> settled) {
        List<Resumption> woken = new ArrayList<>();
        for (PromiseEntry e : settled) {
            for (PromiseEntry.Suspension s : e.waiters) woken.add(new Resumption(s, e));
            e.waiters.clear();
        }
        woken.sort(Comparator.comparingLong(r -> r.suspension.seq));
        ready.addAll(woken);
    }

    private boolean hasPendingChaos() {
        for (PromiseEntry e : entries) {
            if (!e.taskBacked && e.state == PromiseState.PENDING) return true;
        }
        return false;
    }

    private void abandonPending(boolean taskBacked, String reason) {
        LOG.w("abandoning pending promises: %s", reason);
        List<PromiseEntry> settled = new ArrayList<>();
        for (PromiseEntry e : entries) {
            if (e.taskBacked == taskBacked && e.state == PromiseState.PENDING) {
                settle(e, PromiseState.ABANDONED);
                settled.add(e);
            }
        }
        wake(settled);
    }

    private static final class Resumption {
        final PromiseEntry.Suspension suspension;
        final PromiseEntry entry;

        Resumption(PromiseEntry.Suspension suspension, PromiseEntry entry) {
            this.suspension = suspension;
            this.entry = entry;
        }
    }
}
