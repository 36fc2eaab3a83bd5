package org.bloodmatch.engine.domain.service;

import org.bloodmatch.engine.domain.model.EmergencyTicket;
import org.bloodmatch.engine.domain.model.MatchRecord;
import org.bloodmatch.engine.domain.model.PatientQuery;

import java.time.Instant;

/**
 * Selects the nearest eligible compatible donor for a patient and commits the match.
 */
public interface MatchingService {

    /**
     * Normalize and validate raw patient input.
     *
     * @throws org.bloodmatch.engine.domain.exception.MatchingException with
     *         INVALID_BLOOD_TYPE or INVALID_SITE
     */
    PatientQuery resolvePatient(String bloodGroup, String site);

    /**
     * Find the best donor for a walk-in request, mark it donated and record the match.
     *
     * @param patient validated patient data
     * @param now     time of the match
     * @return the ledger record of the match
     * @throws org.bloodmatch.engine.domain.exception.MatchingException with
     *         NO_COMPATIBLE_DONORS or NO_ELIGIBLE_DONORS; nothing is changed in that case
     */
    MatchRecord findBestDonor(PatientQuery patient, Instant now);

    /**
     * Same as {@link #findBestDonor(PatientQuery, Instant)} for an emergency ticket.
     * The ledger record carries the ticket's urgency.
     */
    MatchRecord findBestDonor(EmergencyTicket ticket, Instant now);
}
