package org.bloodmatch.requestgenerator.model;

import java.time.Instant;
import java.util.Objects;

/**
 * A generated emergency request to be submitted to the engine.
 */
public final class EmergencyRequest {

    private final int number;
    private final int urgency;
    private final String bloodGroup;
    private final String location;
    private final Instant createdAt;

    public EmergencyRequest(int number, int urgency, String bloodGroup, String location, Instant createdAt) {
        this.number = number;
        this.urgency = Math.max(1, Math.min(5, urgency));
        this.bloodGroup = Objects.requireNonNull(bloodGroup, "bloodGroup must not be null");
        this.location = Objects.requireNonNull(location, "location must not be null");
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt must not be null");
    }

    public int getNumber() {
        return number;
    }

    public int getUrgency() {
        return urgency;
    }

    public String getBloodGroup() {
        return bloodGroup;
    }

    public String getLocation() {
        return location;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    @Override
    public String toString() {
        return String.format("EmergencyRequest{#%d, urgency=%d, blood=%s, location=%s}",
                number, urgency, bloodGroup, location);
    }
}
