package org.bloodmatch.engine.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.bloodmatch.engine.domain.model.EmergencyTicket;

import java.time.Instant;

/**
 * DTO for a queued emergency ticket.
 */
public final class TicketDto {

    @JsonProperty("id")
    private final String id;

    @JsonProperty("urgency_level")
    private final int urgencyLevel;

    @JsonProperty("sequence")
    private final long sequence;

    @JsonProperty("patient")
    private final PatientDto patient;

    @JsonProperty("timestamp")
    private final Instant timestamp;

    private TicketDto(EmergencyTicket ticket) {
        this.id = ticket.getId();
        this.urgencyLevel = ticket.getUrgency();
        this.sequence = ticket.getSequence();
        this.patient = PatientDto.from(ticket.getPatient());
        this.timestamp = ticket.getSubmittedAt();
    }

    public static TicketDto from(EmergencyTicket ticket) {
        return new TicketDto(ticket);
    }

    public String getId() {
        return id;
    }

    public int getUrgencyLevel() {
        return urgencyLevel;
    }

    public long getSequence() {
        return sequence;
    }

    public PatientDto getPatient() {
        return patient;
    }

    public Instant getTimestamp() {
        return timestamp;
    }
}
