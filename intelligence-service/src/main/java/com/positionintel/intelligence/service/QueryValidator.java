package com.positionintel.intelligence.service;

import com.positionintel.common.exception.InvalidQueryException;

/** Rejects blank subjects and windows outside {@code [0, maxWindowDays]}. */
final class QueryValidator {

    private final int maxWindowDays;

    QueryValidator(int maxWindowDays) {
        this.maxWindowDays = maxWindowDays;
    }

    void validate(String subjectId, int windowDays) {
        if (subjectId == null || subjectId.isBlank()) {
            throw new InvalidQueryException(String.valueOf(subjectId), "subjectId must not be blank");
        }
        if (windowDays < 0) {
            throw new InvalidQueryException(subjectId, "windowDays must not be negative: " + windowDays);
        }
        if (windowDays > maxWindowDays) {
            throw new InvalidQueryException(subjectId,
                "windowDays " + windowDays + " exceeds maximum " + maxWindowDays);
        }
    }
}
