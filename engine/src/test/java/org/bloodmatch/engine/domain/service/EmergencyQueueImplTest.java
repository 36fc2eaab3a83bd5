package org.bloodmatch.engine.domain.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import org.bloodmatch.engine.domain.exception.ErrorCode;
import org.bloodmatch.engine.domain.exception.MatchingException;
import org.bloodmatch.engine.domain.model.BloodType;
import org.bloodmatch.engine.domain.model.Donor;
import org.bloodmatch.engine.domain.model.EmergencyOutcome;
import org.bloodmatch.engine.domain.model.EmergencyTicket;
import org.bloodmatch.engine.domain.model.MatchRecord;
import org.bloodmatch.engine.domain.model.PatientQuery;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class EmergencyQueueImplTest {

    private static final Instant NOW = Instant.parse("2026-01-17T10:00:00Z");
    private static final PatientQuery PATIENT = new PatientQuery(BloodType.O_POSITIVE, "Hospital A");

    @Mock
    private MatchingService matchingService;

    private EmergencyQueueImpl queue;

    @BeforeEach
    void setUp() {
        AtomicInteger ids = new AtomicInteger();
        queue = new EmergencyQueueImpl(matchingService, () -> "ticket-" + ids.incrementAndGet());
    }

    @Test
    void processesByUrgencyThenArrival() {
        when(matchingService.findBestDonor(any(EmergencyTicket.class), eq(NOW)))
                .thenAnswer(inv -> matchFor(inv.getArgument(0)));
        EmergencyTicket first3 = queue.submit(3, PATIENT, NOW);
        EmergencyTicket only1 = queue.submit(1, PATIENT, NOW);
        EmergencyTicket second3 = queue.submit(3, PATIENT, NOW);
        EmergencyTicket only2 = queue.submit(2, PATIENT, NOW);

        List<String> order = new ArrayList<>();
        while (queue.size() > 0) {
            order.add(queue.processNext(NOW).getTicket().getId());
        }

        assertThat(order).containsExactly(only1.getId(), only2.getId(), first3.getId(), second3.getId());
    }

    @Test
    void sequenceNumbersIncreaseFromOne() {
        assertThat(queue.submit(5, PATIENT, NOW).getSequence()).isEqualTo(1);
        assertThat(queue.submit(5, PATIENT, NOW).getSequence()).isEqualTo(2);
        assertThat(queue.submit(1, PATIENT, NOW).getSequence()).isEqualTo(3);
    }

    @Test
    void emptyQueueFailsWithoutMatching() {
        assertThatThrownBy(() -> queue.processNext(NOW))
                .isInstanceOf(MatchingException.class)
                .hasFieldOrPropertyWithValue("code", ErrorCode.QUEUE_EMPTY)
                .hasMessage("No emergency requests in queue");
        verifyNoInteractions(matchingService);
    }

    @Test
    void unmatchedTicketIsStillConsumed() {
        MatchingException noDonor = new MatchingException(ErrorCode.NO_ELIGIBLE_DONORS, "No eligible donor found");
        when(matchingService.findBestDonor(any(EmergencyTicket.class), eq(NOW))).thenThrow(noDonor);
        queue.submit(1, PATIENT, NOW);
        queue.submit(4, PATIENT, NOW);

        EmergencyOutcome outcome = queue.processNext(NOW);

        assertThat(outcome.isMatched()).isFalse();
        assertThat(outcome.getMatch()).isEmpty();
        assertThat(outcome.getFailure()).containsSame(noDonor);
        assertThat(outcome.getTicket().getUrgency()).isEqualTo(1);
        assertThat(outcome.getRemaining()).isEqualTo(1);
        assertThat(queue.size()).isEqualTo(1);
    }

    @Test
    void matchedOutcomeCarriesRecord() {
        when(matchingService.findBestDonor(any(EmergencyTicket.class), eq(NOW)))
                .thenAnswer(inv -> matchFor(inv.getArgument(0)));
        EmergencyTicket ticket = queue.submit(2, PATIENT, NOW);

        EmergencyOutcome outcome = queue.processNext(NOW);

        assertThat(outcome.isMatched()).isTrue();
        assertThat(outcome.getMatch()).hasValueSatisfying(m -> assertThat(m.getUrgency()).isEqualTo(2));
        assertThat(outcome.getRemaining()).isZero();
        verify(matchingService).findBestDonor(ticket, NOW);
    }

    @Test
    void peekDoesNotRemoveTickets() {
        queue.submit(4, PATIENT, NOW);
        queue.submit(2, PATIENT, NOW);
        queue.submit(4, PATIENT, NOW);

        List<EmergencyTicket> view = queue.peekAll();

        assertThat(view).extracting(EmergencyTicket::getSequence).containsExactly(2L, 1L, 3L);
        assertThat(queue.peekAll()).extracting(EmergencyTicket::getSequence).containsExactly(2L, 1L, 3L);
        assertThat(queue.size()).isEqualTo(3);
        verifyNoInteractions(matchingService);
    }

    @Test
    void rejectsOutOfRangeUrgency() {
        assertThatThrownBy(() -> queue.submit(0, PATIENT, NOW))
                .isInstanceOf(MatchingException.class)
                .hasFieldOrPropertyWithValue("code", ErrorCode.INVALID_URGENCY);
        assertThatThrownBy(() -> queue.submit(6, PATIENT, NOW))
                .isInstanceOf(MatchingException.class)
                .hasFieldOrPropertyWithValue("code", ErrorCode.INVALID_URGENCY);
        assertThat(queue.size()).isZero();
    }

    private static MatchRecord matchFor(EmergencyTicket ticket) {
        Donor donor = new Donor.Builder()
                .id("d-1")
                .name("Universal")
                .bloodType(BloodType.O_NEGATIVE)
                .site("Hospital A")
                .build();
        return MatchRecord.emergency(NOW, ticket.getUrgency(), ticket.getPatient(), donor, 0.0);
    }
}
