package com.phillippitts.freefleet.exception;

/**
 * Thrown when a provider or metadata source cannot be reached or answers with a non-2xx status.
 * Callers treat the source as empty for the current pass.
 */
public class ProviderFetchException extends FreeFleetException {

    private final String providerId;
    private final int statusCode;

    public ProviderFetchException(String providerId, int statusCode, String statusText) {
        super(providerId + " API error: " + statusCode + " " + statusText);
        this.providerId = providerId;
        this.statusCode = statusCode;
    }

    public ProviderFetchException(String providerId, String message, Throwable cause) {
        super(providerId + " request failed: " + message, cause);
        this.providerId = providerId;
        this.statusCode = -1;
    }

    public String getProviderId() {
        return providerId;
    }

    /** HTTP status, or -1 for network-level failures. */
    public int getStatusCode() {
        return statusCode;
    }
}
