package com.signalplatform.common.model;

/**
 * Vote cast by a single sub-signal evaluator.
 */
public enum SignalDirection {

    UP(+1),
    DOWN(-1),
    NEUTRAL(0);

    private final int sign;

    SignalDirection(int sign) {
        this.sign = sign;
    }

    /** +1 for UP, -1 for DOWN, 0 for NEUTRAL. */
    public int sign() {
        return sign;
    }
}
