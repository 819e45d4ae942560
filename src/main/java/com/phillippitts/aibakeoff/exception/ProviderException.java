package com.phillippitts.aibakeoff.exception;

/**
 * Thrown when a call to an external provider fails.
 * This may occur due to a missing credential, a non-2xx response, a malformed body,
 * or a streaming protocol failure.
 */
public class ProviderException extends BakeoffException {

    /** Sentinel for failures that did not involve an HTTP response. */
    public static final int NO_STATUS = -1;

    private final String providerName;
    private final int httpStatus;

    public ProviderException(String message) {
        this(message, "unknown", NO_STATUS, null);
    }

    public ProviderException(String message, String providerName) {
        this(message, providerName, NO_STATUS, null);
    }

    public ProviderException(String message, String providerName, Throwable cause) {
        this(message, providerName, NO_STATUS, cause);
    }

    public ProviderException(String message, String providerName, int httpStatus, Throwable cause) {
        super(message, cause);
        this.providerName = providerName == null ? "unknown" : providerName;
        this.httpStatus = httpStatus;
    }

    public String getProviderName() {
        return providerName;
    }

    /**
     * Returns the HTTP status of the failed response, or {@link #NO_STATUS}.
     */
    public int getHttpStatus() {
        return httpStatus;
    }

    public boolean hasHttpStatus() {
        return httpStatus != NO_STATUS;
    }
}
