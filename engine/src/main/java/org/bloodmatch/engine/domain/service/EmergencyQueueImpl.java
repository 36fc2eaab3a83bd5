package org.bloodmatch.engine.domain.service;

import org.bloodmatch.engine.domain.exception.ErrorCode;
import org.bloodmatch.engine.domain.exception.MatchingException;
import org.bloodmatch.engine.domain.model.EmergencyOutcome;
import org.bloodmatch.engine.domain.model.EmergencyTicket;
import org.bloodmatch.engine.domain.model.MatchRecord;
import org.bloodmatch.engine.domain.model.PatientQuery;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.PriorityQueue;
import java.util.UUID;
import java.util.function.Supplier;
import java.util.logging.Logger;

/**
 * Binary-heap emergency queue keyed by (urgency, sequence).
 * Not thread-safe; callers serialize access.
 */
public final class EmergencyQueueImpl implements EmergencyQueue {

    private static final Logger LOG = Logger.getLogger(EmergencyQueueImpl.class.getName());

    private final MatchingService matchingService;
    private final Supplier<String> idGenerator;
    private final PriorityQueue<EmergencyTicket> heap = new PriorityQueue<>(EmergencyTicket.PRIORITY_ORDER);
    private long lastSequence = 0;

    public EmergencyQueueImpl(MatchingService matchingService) {
        this(matchingService, () -> UUID.randomUUID().toString());
    }

    public EmergencyQueueImpl(MatchingService matchingService, Supplier<String> idGenerator) {
        this.matchingService = Objects.requireNonNull(matchingService, "matchingService must not be null");
        this.idGenerator = Objects.requireNonNull(idGenerator, "idGenerator must not be null");
    }

    @Override
    public EmergencyTicket submit(int urgency, PatientQuery patient, Instant now) {
        if (!EmergencyTicket.isValidUrgency(urgency)) {
            throw MatchingException.invalidUrgency(urgency);
        }
        EmergencyTicket ticket = new EmergencyTicket(idGenerator.get(), urgency, ++lastSequence, patient, now);
        heap.add(ticket);
        LOG.info(() -> String.format("Queued emergency %s: urgency=%d, patient=%s, queue size=%d",
                ticket.getId(), urgency, patient, heap.size()));
        return ticket;
    }

    @Override
    public EmergencyOutcome processNext(Instant now) {
        EmergencyTicket ticket = heap.poll();
        if (ticket == null) {
            throw new MatchingException(ErrorCode.QUEUE_EMPTY, "No emergency requests in queue");
        }

        try {
            MatchRecord match = matchingService.findBestDonor(ticket, now);
            return EmergencyOutcome.matched(ticket, match, heap.size());
        } catch (MatchingException e) {
            // consumed either way so an unmatchable ticket cannot stall the queue
            LOG.warning(() -> String.format("Emergency %s (urgency %d) dropped without match: %s",
                    ticket.getId(), ticket.getUrgency(), e.getMessage()));
            return EmergencyOutcome.unmatched(ticket, e, heap.size());
        }
    }

    @Override
    public List<EmergencyTicket> peekAll() {
        List<EmergencyTicket> ordered = new ArrayList<>(heap);
        ordered.sort(EmergencyTicket.PRIORITY_ORDER);
        return Collections.unmodifiableList(ordered);
    }

    @Override
    public int size() {
        return heap.size();
    }
}
