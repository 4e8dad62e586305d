package com.d2stacks.core.result;

/**
 * Success payload of operations that produce no value.
 */
public enum Unit {
    UNIT;

    public static Unit unit() {
        return UNIT;
    }
}
