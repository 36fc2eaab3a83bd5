package org.bloodmatch.engine.domain.service;

import org.bloodmatch.engine.domain.exception.MatchingException;
import org.bloodmatch.engine.domain.model.BloodType;
import org.bloodmatch.engine.domain.model.Donor;
import org.bloodmatch.engine.domain.model.DonorRegistration;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.function.Supplier;
import java.util.logging.Logger;

/**
 * In-memory donor registry.
 * Keeps a flat registration-ordered list plus a per-type index so that
 * type lookups cost only the number of matching donors.
 */
public final class DonorRegistryImpl implements DonorRegistry {

    private static final Logger LOG = Logger.getLogger(DonorRegistryImpl.class.getName());

    private final DistanceGraph graph;
    private final EligibilityRule eligibilityRule;
    private final Supplier<String> idGenerator;

    private final List<Donor> donors = new ArrayList<>();
    private final Map<BloodType, List<Donor>> byType = new EnumMap<>(BloodType.class);
    private long nextRegistrationOrder = 1;

    public DonorRegistryImpl(DistanceGraph graph, EligibilityRule eligibilityRule) {
        this(graph, eligibilityRule, () -> UUID.randomUUID().toString());
    }

    public DonorRegistryImpl(DistanceGraph graph, EligibilityRule eligibilityRule, Supplier<String> idGenerator) {
        this.graph = Objects.requireNonNull(graph, "graph must not be null");
        this.eligibilityRule = Objects.requireNonNull(eligibilityRule, "eligibilityRule must not be null");
        this.idGenerator = Objects.requireNonNull(idGenerator, "idGenerator must not be null");
        for (BloodType type : BloodType.values()) {
            byType.put(type, new ArrayList<>());
        }
    }

    @Override
    public Donor register(DonorRegistration registration) {
        BloodType type = BloodType.parse(registration.getBloodGroup());
        String site = registration.getSite() == null ? null : registration.getSite().trim();
        if (!graph.containsSite(site)) {
            throw MatchingException.invalidSite(registration.getSite());
        }

        Donor donor = new Donor.Builder()
                .id(idGenerator.get())
                .name(registration.getName())
                .bloodType(type)
                .site(site)
                .registrationOrder(nextRegistrationOrder++)
                .lastDonationDate(parseDonationDate(registration))
                .totalDonations(registration.getTotalDonations())
                .build();

        donors.add(donor);
        byType.get(type).add(donor);
        LOG.info(() -> String.format("Registered donor %s (%s) at %s", donor.getName(), type, site));
        return donor;
    }

    private LocalDate parseDonationDate(DonorRegistration registration) {
        String raw = registration.getLastDonationDate();
        if (raw == null || raw.trim().isEmpty()) {
            LOG.warning(() -> "No last donation date for " + registration.getName() + "; donor stays ineligible");
            return null;
        }
        try {
            return LocalDate.parse(raw.trim());
        } catch (DateTimeParseException e) {
            LOG.warning(() -> String.format("Unparsable last donation date '%s' for %s; donor stays ineligible",
                    raw, registration.getName()));
            return null;
        }
    }

    @Override
    public List<Donor> listByType(BloodType type) {
        return Collections.unmodifiableList(byType.get(Objects.requireNonNull(type, "type must not be null")));
    }

    @Override
    public List<Donor> listAll() {
        return Collections.unmodifiableList(donors);
    }

    @Override
    public boolean isEligible(Donor donor, LocalDate today) {
        return eligibilityRule.isEligible(donor, today);
    }

    @Override
    public void markDonated(Donor donor, LocalDate today) {
        donor.recordDonation(today);
        LOG.fine(() -> String.format("Donor %s donated on %s (total=%d)",
                donor.getId(), today, donor.getTotalDonations()));
    }

    @Override
    public int size() {
        return donors.size();
    }
}
