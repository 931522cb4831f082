package com.useless.script.chaos;

import com.useless.script.error.ScriptError;

public enum ArithOp {
    ADD,
    SUBTRACT,
    MULTIPLY,
    DIVIDE;

    public double apply(double a, double b) {
        switch (this) {
            case ADD: return a + b;
            case SUBTRACT: return a - b;
            case MULTIPLY: return a * b;
            case DIVIDE:
                if (b == 0.0) throw ScriptError.divisionByZero();
                return a / b;
            default: throw new IllegalStateException("Unknown arithmetic op: " + this);
        }
    }
}
