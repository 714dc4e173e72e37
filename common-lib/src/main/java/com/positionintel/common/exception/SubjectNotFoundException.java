package com.positionintel.common.exception;

/**
 * No observations resolved and no baseline is configured for the subject.
 * Distinct from a {@code BASELINE} tier result, which is a value, not an absence.
 */
public class SubjectNotFoundException extends PositionIntelException {

    public SubjectNotFoundException(String subjectId) {
        super(subjectId, "no observations and no configured baseline");
    }
}
