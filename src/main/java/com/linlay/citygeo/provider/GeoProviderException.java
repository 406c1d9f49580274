package com.linlay.citygeo.provider;

/**
 * Failure of one upstream geocoding call. {@code statusCode} is {@code -1} when no HTTP
 * status was received (transport or decode failure).
 */
public class GeoProviderException extends RuntimeException {

    public static final int NO_STATUS = -1;

    private final int statusCode;
    private final boolean retryable;

    public GeoProviderException(String message, int statusCode, boolean retryable) {
        this(message, statusCode, retryable, null);
    }

    public GeoProviderException(String message, int statusCode, boolean retryable, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
        this.retryable = retryable;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
