package com.signalplatform.common.evaluator;

import com.signalplatform.common.model.SignalKind;
import com.signalplatform.common.model.SourceKind;
import com.signalplatform.common.model.SourceSnapshot;
import com.signalplatform.common.model.SubSignalResult;

import java.util.Map;
import java.util.Optional;

/**
 * Maps one source snapshot of a cycle to a directional vote.
 *
 * <p>Implementations must be stateless and side-effect free: same snapshots, same result.
 * An empty result means the source failed or is missing; such a signal carries no weight at all
 * rather than a NEUTRAL vote.
 */
public interface SubSignalEvaluator {

    SignalKind signal();

    double weight();

    Optional<SubSignalResult> evaluate(Map<SourceKind, SourceSnapshot> snapshots);
}
