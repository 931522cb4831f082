package com.useless.script.async;

/** Simulated milliseconds. Only the scheduler moves it. */
public final class VirtualClock {
    private long nowMillis;

    public long now() {
        return nowMillis;
    }

    public long advance(long millis) {
        if (millis < 0) {
            throw new IllegalArgumentException("Cannot advance time by a negative amount");
        }
        nowMillis += millis;
        return nowMillis;
    }
}
