package org.bloodmatch.engine.domain.exception;

/**
 * Failure kinds reported by the matching engine.
 * Each code carries the HTTP status the boundary layer answers with.
 */
public enum ErrorCode {
    INVALID_BLOOD_TYPE(400),
    INVALID_SITE(400),
    INVALID_URGENCY(400),
    MISSING_FIELD(400),
    INVALID_FIELD(400),
    NO_COMPATIBLE_DONORS(404),
    NO_ELIGIBLE_DONORS(404),
    QUEUE_EMPTY(404);

    private final int httpStatus;

    ErrorCode(int httpStatus) {
        this.httpStatus = httpStatus;
    }

    public int getHttpStatus() {
        return httpStatus;
    }
}
