package com.useless.script.chaos;

/** Outcome of one scheduler tick for a pending promise. */
public enum PromiseFate {
    RESOLVE,
    ABANDON,
    STAY_PENDING
}
