package com.useless.script.chaos;

/** Every place where the runtime asks the chaos policy for a decision. */
public enum ChaosPoint {
    EXPRESSION_RESULT,
    BOOLEAN_FORM,
    ARITHMETIC,
    CONTAINER_INDEX,
    RECORD_FIELD,
    COMPARISON_MISMATCH,
    PRINT,
    TEAPOT,
    PARTY_NUMBER,
    VARIABLE_VACATION,
    LET_LOSS,
    PROMISE_TICK,
    MIND_CHANGE_FLAG,
    MIND_CHANGE_FLIP
}
