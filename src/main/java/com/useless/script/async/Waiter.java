package com.useless.script.async;

/** A parked script task, woken once the promise it awaits has settled. */
public interface Waiter {
    void resume(PromiseEntry settled);
}
