package org.bloodmatch.engine.domain.service;

import org.bloodmatch.engine.domain.model.EmergencyOutcome;
import org.bloodmatch.engine.domain.model.EmergencyTicket;
import org.bloodmatch.engine.domain.model.PatientQuery;

import java.time.Instant;
import java.util.List;

/**
 * Urgency-ordered admission queue for emergency requests.
 * Equal urgencies are served in arrival order.
 */
public interface EmergencyQueue {

    /**
     * Queue a new ticket.
     *
     * @param urgency 1 (most urgent) to 5
     * @param patient validated patient data
     * @param now     submission time
     * @return the queued ticket with its assigned sequence number
     * @throws org.bloodmatch.engine.domain.exception.MatchingException with INVALID_URGENCY
     */
    EmergencyTicket submit(int urgency, PatientQuery patient, Instant now);

    /**
     * Remove the most urgent ticket and try to match it.
     * The ticket is consumed even when no donor is found; the failure is
     * reported in the outcome rather than thrown.
     *
     * @throws org.bloodmatch.engine.domain.exception.MatchingException with QUEUE_EMPTY
     */
    EmergencyOutcome processNext(Instant now);

    /**
     * The queued tickets in priority order. Does not alter the queue.
     */
    List<EmergencyTicket> peekAll();

    int size();
}
