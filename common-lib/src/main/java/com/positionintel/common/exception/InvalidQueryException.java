package com.positionintel.common.exception;

/**
 * Malformed position request (blank subject, negative or oversized window).
 * Raised before any cache or provider access and never cached.
 */
public class InvalidQueryException extends PositionIntelException {

    public InvalidQueryException(String subjectId, String message) {
        super(subjectId, message);
    }
}
