package org.bloodmatch.engine.domain.model;

import org.bloodmatch.engine.domain.exception.MatchingException;

import java.util.Objects;
import java.util.Optional;

/**
 * Result of processing one emergency ticket.
 * The ticket is consumed whether or not a donor was found.
 */
public final class EmergencyOutcome {

    private final EmergencyTicket ticket;
    private final MatchRecord match;
    private final MatchingException failure;
    private final int remaining;

    private EmergencyOutcome(EmergencyTicket ticket, MatchRecord match, MatchingException failure, int remaining) {
        this.ticket = Objects.requireNonNull(ticket, "ticket must not be null");
        this.match = match;
        this.failure = failure;
        this.remaining = remaining;
    }

    public static EmergencyOutcome matched(EmergencyTicket ticket, MatchRecord match, int remaining) {
        return new EmergencyOutcome(ticket, Objects.requireNonNull(match, "match must not be null"), null, remaining);
    }

    public static EmergencyOutcome unmatched(EmergencyTicket ticket, MatchingException failure, int remaining) {
        return new EmergencyOutcome(ticket, null, Objects.requireNonNull(failure, "failure must not be null"),
                remaining);
    }

    public EmergencyTicket getTicket() {
        return ticket;
    }

    public boolean isMatched() {
        return match != null;
    }

    public Optional<MatchRecord> getMatch() {
        return Optional.ofNullable(match);
    }

    public Optional<MatchingException> getFailure() {
        return Optional.ofNullable(failure);
    }

    /**
     * Tickets left in the queue after this one was removed.
     */
    public int getRemaining() {
        return remaining;
    }
}
