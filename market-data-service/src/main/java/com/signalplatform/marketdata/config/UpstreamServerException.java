package com.signalplatform.marketdata.config;

/**
 * An upstream host answered with a 5xx status. Treated as a transport failure.
 */
public class UpstreamServerException extends RuntimeException {

    private final String host;
    private final int status;

    public UpstreamServerException(String host, int status) {
        super("Upstream server error: host=" + host + " status=" + status);
        this.host   = host;
        this.status = status;
    }

    public String getHost() {
        return host;
    }

    public int getStatus() {
        return status;
    }
}
