package com.signalplatform.common.model;

/**
 * Why a source produced no payload in a cycle.
 */
public enum FetchFailure {
    /** The per-source timeout expired before the source answered. */
    TIMEOUT,
    /** Connection, HTTP status or other transport-level error. */
    TRANSPORT,
    /** The source answered but the body could not be turned into a payload. */
    MALFORMED_PAYLOAD
}
