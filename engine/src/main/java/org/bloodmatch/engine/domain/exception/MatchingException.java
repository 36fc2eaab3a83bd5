package org.bloodmatch.engine.domain.exception;

import java.util.Objects;

/**
 * Recoverable failure of a single engine request.
 * Never leaves engine state partially modified.
 */
public class MatchingException extends RuntimeException {

    private final ErrorCode code;

    public MatchingException(ErrorCode code, String message) {
        super(message);
        this.code = Objects.requireNonNull(code, "code must not be null");
    }

    public ErrorCode getCode() {
        return code;
    }

    public static MatchingException invalidBloodType(String raw) {
        return new MatchingException(ErrorCode.INVALID_BLOOD_TYPE, "Invalid blood group: " + raw);
    }

    public static MatchingException invalidSite(String site) {
        return new MatchingException(ErrorCode.INVALID_SITE, "Unknown location: " + site);
    }

    public static MatchingException invalidUrgency(Object urgency) {
        return new MatchingException(ErrorCode.INVALID_URGENCY,
                "Urgency level must be an integer between 1 and 5, got: " + urgency);
    }

    public static MatchingException missingField(String field) {
        return new MatchingException(ErrorCode.MISSING_FIELD, "Missing required field: " + field);
    }

    public static MatchingException invalidField(String field, String reason) {
        return new MatchingException(ErrorCode.INVALID_FIELD, "Invalid field " + field + ": " + reason);
    }
}
