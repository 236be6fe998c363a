package com.signalplatform.common.decision;

import com.signalplatform.common.model.SignalDirection;
import com.signalplatform.common.model.SignalKind;
import com.signalplatform.common.model.SubSignalResult;
import com.signalplatform.common.model.Verdict;
import com.signalplatform.common.model.VerdictDirection;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * {@link DecisionEngine} combining sub-signals through fixed per-signal weights.
 *
 * <h3>Algorithm</h3>
 * <ol>
 *   <li>{@code weightedScore = Σ weight × strength × sign(direction)}, with UP=+1, DOWN=−1,
 *       NEUTRAL=0.</li>
 *   <li>{@code totalAvailableWeight = Σ weight} over the signals present. NEUTRAL votes count;
 *       failed sources are not in the input and do not.</li>
 *   <li>{@code normalizedScore = weightedScore / totalAvailableWeight}, or 0 when no weight is
 *       available → result in [−1.0, +1.0].</li>
 *   <li>Direction from {@link DecisionThresholds}; {@code confidence = min(1, |normalizedScore|)}.</li>
 * </ol>
 *
 * <p>A SKIP is only possible strictly inside (−downThreshold, +upThreshold), so its confidence is
 * always below the threshold on its own side. Zero available weight yields SKIP, confidence 0 and
 * {@code insufficientData = true}.
 *
 * <p>Signals are summed in canonical {@link SignalKind} order, so the verdict is bit-identical
 * for every permutation of the same input. This class is stateless and thread-safe.
 */
public class WeightedVotingDecisionEngine implements DecisionEngine {

    private final DecisionThresholds thresholds;

    public WeightedVotingDecisionEngine(DecisionThresholds thresholds) {
        this.thresholds = Objects.requireNonNull(thresholds, "thresholds");
    }

    public DecisionThresholds thresholds() {
        return thresholds;
    }

    @Override
    public Verdict decide(List<SubSignalResult> signals, Instant timestamp) {
        List<SubSignalResult> ordered = canonicalOrder(signals);

        double weightedScore = 0.0;
        double totalWeight   = 0.0;
        int up = 0, down = 0, neutral = 0;

        for (SubSignalResult s : ordered) {
            weightedScore += s.contribution();
            totalWeight   += s.weight();
            if (s.direction() == SignalDirection.UP)        up++;
            else if (s.direction() == SignalDirection.DOWN) down++;
            else                                            neutral++;
        }

        if (totalWeight <= 0.0) {
            return new Verdict(VerdictDirection.SKIP, 0.0, weightedScore, 0.0, totalWeight,
                               ordered, up, down, neutral, true, timestamp);
        }

        double normalizedScore = clamp(weightedScore / totalWeight);
        VerdictDirection direction = deriveDirection(normalizedScore);
        double confidence = Math.min(1.0, Math.abs(normalizedScore));

        return new Verdict(direction, confidence, weightedScore, normalizedScore, totalWeight,
                           ordered, up, down, neutral, false, timestamp);
    }

    private VerdictDirection deriveDirection(double normalizedScore) {
        if (normalizedScore >=  thresholds.upThreshold())   return VerdictDirection.UP;
        if (normalizedScore <= -thresholds.downThreshold()) return VerdictDirection.DOWN;
        return VerdictDirection.SKIP;
    }

    private static List<SubSignalResult> canonicalOrder(List<SubSignalResult> signals) {
        if (signals == null || signals.isEmpty()) {
            return List.of();
        }
        Set<SignalKind> seen = EnumSet.noneOf(SignalKind.class);
        List<SubSignalResult> ordered = new ArrayList<>(signals.size());
        for (SubSignalResult s : signals) {
            Objects.requireNonNull(s, "signal result");
            if (!seen.add(s.signal())) {
                throw new IllegalArgumentException("Duplicate sub-signal in one cycle: " + s.signal());
            }
            ordered.add(s);
        }
        ordered.sort(Comparator.comparing(SubSignalResult::signal));
        return ordered;
    }

    // Floating-point safety: |weightedScore| <= totalWeight mathematically.
    private static double clamp(double score) {
        return Math.max(-1.0, Math.min(1.0, score));
    }
}
