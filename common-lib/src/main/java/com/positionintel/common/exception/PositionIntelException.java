package com.positionintel.common.exception;

public class PositionIntelException extends RuntimeException {
    private final String subjectId;

    public PositionIntelException(String subjectId, String message) {
        super("[" + subjectId + "] " + message);
        this.subjectId = subjectId;
    }

    public PositionIntelException(String subjectId, String message, Throwable cause) {
        super("[" + subjectId + "] " + message, cause);
        this.subjectId = subjectId;
    }

    public String getSubjectId() {
        return subjectId;
    }
}
