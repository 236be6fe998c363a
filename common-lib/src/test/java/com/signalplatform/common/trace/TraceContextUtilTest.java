package com.signalplatform.common.trace;

import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class TraceContextUtilTest {

    @Test
    void cycleIdVisibleInsidePipeline() {
        Mono<String> pipeline = Mono.deferContextual(ctx -> Mono.just(TraceContextUtil.getCycleId(ctx)));

        StepVerifier.create(TraceContextUtil.withCycleId(pipeline, "cycle-7"))
            .expectNext("cycle-7")
            .verifyComplete();
    }

    @Test
    void missingCycleId_defaultsToUnknown() {
        StepVerifier.create(Mono.deferContextual(ctx -> Mono.just(TraceContextUtil.getCycleId(ctx))))
            .expectNext("unknown")
            .verifyComplete();
    }

    @Test
    void mdcPopulatedOnlyDuringAction() {
        AtomicReference<String> seen = new AtomicReference<>();
        TraceContextUtil.withMdc("cycle-9", () -> seen.set(MDC.get(TraceContextUtil.CYCLE_ID_KEY)));

        assertEquals("cycle-9", seen.get());
        assertNull(MDC.get(TraceContextUtil.CYCLE_ID_KEY));
    }
}
