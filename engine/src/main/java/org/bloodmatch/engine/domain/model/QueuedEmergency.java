package org.bloodmatch.engine.domain.model;

import java.util.Objects;

/**
 * A freshly queued emergency ticket and the queue size observed under the
 * same lock that inserted it.
 */
public final class QueuedEmergency {

    private final EmergencyTicket ticket;
    private final int queueSize;

    public QueuedEmergency(EmergencyTicket ticket, int queueSize) {
        this.ticket = Objects.requireNonNull(ticket, "ticket must not be null");
        this.queueSize = queueSize;
    }

    public EmergencyTicket getTicket() {
        return ticket;
    }

    /**
     * Number of queued tickets, this one included, right after insertion.
     */
    public int getQueueSize() {
        return queueSize;
    }
}
