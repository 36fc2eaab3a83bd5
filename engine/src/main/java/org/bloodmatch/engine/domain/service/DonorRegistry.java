package org.bloodmatch.engine.domain.service;

import org.bloodmatch.engine.domain.model.BloodType;
import org.bloodmatch.engine.domain.model.Donor;
import org.bloodmatch.engine.domain.model.DonorRegistration;

import java.time.LocalDate;
import java.util.List;

/**
 * Owner of all donor records, indexed by blood type.
 * Donors are never removed; their donation history is updated in place.
 * Implementations are not required to be thread-safe.
 */
public interface DonorRegistry {

    /**
     * Validate and store a new donor.
     *
     * @param registration the submitted donor data
     * @return the stored donor
     * @throws org.bloodmatch.engine.domain.exception.MatchingException on an
     *         invalid blood group or unknown site
     */
    Donor register(DonorRegistration registration);

    /**
     * All donors of the given type in registration order.
     */
    List<Donor> listByType(BloodType type);

    /**
     * All donors in registration order.
     */
    List<Donor> listAll();

    /**
     * Whether the donor's cooldown has elapsed on {@code today}.
     * Returns false, never throws, when the donation date is unknown.
     */
    boolean isEligible(Donor donor, LocalDate today);

    /**
     * Record a donation: resets the last donation date and increments the total.
     */
    void markDonated(Donor donor, LocalDate today);

    int size();
}
