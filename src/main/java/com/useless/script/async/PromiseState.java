package com.useless.script.async;

public enum PromiseState {
    PENDING,
    RESOLVED,
    REJECTED,
    ABANDONED;

    public boolean isSettled() {
        return this != PENDING;
    }
}
