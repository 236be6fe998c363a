package com.signalplatform.common.exception;

/**
 * The read cache was queried before the first refresh cycle published a state. Distinct from a
 * SKIP verdict, which is a published answer.
 */
public class CacheUnpopulatedException extends RuntimeException {

    public CacheUnpopulatedException() {
        super("Data not yet available. Please wait for the first refresh.");
    }
}
