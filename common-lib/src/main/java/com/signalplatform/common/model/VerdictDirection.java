package com.signalplatform.common.model;

/**
 * Final recommendation of a refresh cycle.
 *
 * <ul>
 *   <li>UP  : weighted score cleared the up threshold</li>
 *   <li>DOWN: weighted score cleared the down threshold</li>
 *   <li>SKIP: no actionable recommendation this window (includes insufficient data)</li>
 * </ul>
 */
public enum VerdictDirection {
    UP,
    DOWN,
    SKIP;

    public boolean isDirectional() {
        return this != SKIP;
    }
}
