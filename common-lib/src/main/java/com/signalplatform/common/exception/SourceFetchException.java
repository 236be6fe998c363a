package com.signalplatform.common.exception;

import com.signalplatform.common.model.FetchFailure;
import com.signalplatform.common.model.SourceKind;

/**
 * Raised by a source client when one fetch cannot produce a payload. The refresh coordinator
 * turns it into a {@code Failed} snapshot; it never escapes a cycle.
 */
public class SourceFetchException extends RuntimeException {

    private final SourceKind kind;
    private final FetchFailure reason;

    public SourceFetchException(SourceKind kind, FetchFailure reason, String message) {
        super("[" + kind.key() + "] " + message);
        this.kind   = kind;
        this.reason = reason;
    }

    public SourceFetchException(SourceKind kind, FetchFailure reason, String message, Throwable cause) {
        super("[" + kind.key() + "] " + message, cause);
        this.kind   = kind;
        this.reason = reason;
    }

    public static SourceFetchException malformed(SourceKind kind, String message) {
        return new SourceFetchException(kind, FetchFailure.MALFORMED_PAYLOAD, message);
    }

    public static SourceFetchException malformed(SourceKind kind, String message, Throwable cause) {
        return new SourceFetchException(kind, FetchFailure.MALFORMED_PAYLOAD, message, cause);
    }

    public SourceKind getKind() {
        return kind;
    }

    public FetchFailure getReason() {
        return reason;
    }
}
