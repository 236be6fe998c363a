package com.signalplatform.marketdata.source;

import com.signalplatform.common.model.SnapshotPayload;
import com.signalplatform.common.model.SourceKind;
import reactor.core.publisher.Mono;

/**
 * Fetches one category of market data.
 *
 * <p>Each call performs a fresh request and either emits one payload or signals an error:
 * {@link com.signalplatform.common.exception.SourceFetchException} for a payload that could not
 * be interpreted, any other exception for transport failures. Implementations do not retry and
 * do not apply their own deadline; the caller owns both.
 *
 * @param <P> payload type
 */
public interface SourceClient<P extends SnapshotPayload> {

    SourceKind kind();

    Mono<P> fetch();
}
