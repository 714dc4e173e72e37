package com.positionintel.common.exception;

/**
 * Upstream observation source failed or timed out. The position cascade absorbs it as a
 * tier downgrade; trend lookups, which have no fallback, surface it to the caller.
 */
public class ProviderUnavailableException extends PositionIntelException {
    private final String providerId;

    public ProviderUnavailableException(String providerId, String subjectId, Throwable cause) {
        super(subjectId, "provider " + providerId + " unavailable: " + cause, cause);
        this.providerId = providerId;
    }

    public String getProviderId() {
        return providerId;
    }
}
