package com.signalplatform.common.decision;

import com.signalplatform.common.model.SubSignalResult;
import com.signalplatform.common.model.Verdict;

import java.time.Instant;
import java.util.List;

/**
 * Strategy contract for turning one cycle's sub-signal votes into a verdict.
 *
 * <p>Implementations must be:
 * <ul>
 *   <li><b>Stateless</b>: configuration is fixed at construction; safe to call concurrently</li>
 *   <li><b>Pure</b>     : no logging, no reactive types, no side effects</li>
 *   <li><b>Total</b>    : any input, including an empty list, yields a {@link Verdict}</li>
 * </ul>
 */
public interface DecisionEngine {

    /**
     * @param signals   votes actually produced this cycle; failed sources are absent, not NEUTRAL
     * @param timestamp cycle timestamp stamped on the verdict
     * @return a verdict, never {@code null}
     */
    Verdict decide(List<SubSignalResult> signals, Instant timestamp);
}
