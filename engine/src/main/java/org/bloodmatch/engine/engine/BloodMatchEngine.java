package org.bloodmatch.engine.engine;

import org.bloodmatch.engine.domain.exception.MatchingException;
import org.bloodmatch.engine.domain.model.BloodType;
import org.bloodmatch.engine.domain.model.BloodTypeStats;
import org.bloodmatch.engine.domain.model.Donor;
import org.bloodmatch.engine.domain.model.DonorRegistration;
import org.bloodmatch.engine.domain.model.EmergencyOutcome;
import org.bloodmatch.engine.domain.model.EmergencyTicket;
import org.bloodmatch.engine.domain.model.MatchRecord;
import org.bloodmatch.engine.domain.model.PatientQuery;
import org.bloodmatch.engine.domain.model.QueuedEmergency;
import org.bloodmatch.engine.domain.service.DistanceGraph;
import org.bloodmatch.engine.domain.service.DonorRegistry;
import org.bloodmatch.engine.domain.service.DonorRegistryImpl;
import org.bloodmatch.engine.domain.service.EligibilityRule;
import org.bloodmatch.engine.domain.service.EmergencyQueue;
import org.bloodmatch.engine.domain.service.EmergencyQueueImpl;
import org.bloodmatch.engine.domain.service.MatchLedger;
import org.bloodmatch.engine.domain.service.MatchLedgerImpl;
import org.bloodmatch.engine.domain.service.MatchingService;
import org.bloodmatch.engine.domain.service.MatchingServiceImpl;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Engine context owning the donor registry, emergency queue and match ledger.
 *
 * Built once at startup and handed to the boundary layer. Every mutating
 * operation runs under one write lock spanning all three structures, so a
 * select-mark-record match sequence is atomic with respect to any other
 * request. Reads share the read lock and return detached snapshots.
 */
public final class BloodMatchEngine {

    private static final Logger LOG = Logger.getLogger(BloodMatchEngine.class.getName());

    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final Clock clock;
    private final DistanceGraph graph;
    private final EligibilityRule eligibilityRule;
    private final DonorRegistry registry;
    private final MatchLedger ledger;
    private final MatchingService matchingService;
    private final EmergencyQueue emergencyQueue;

    private BloodMatchEngine(Clock clock, DistanceGraph graph, EligibilityRule eligibilityRule) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.graph = Objects.requireNonNull(graph, "graph must not be null");
        this.eligibilityRule = Objects.requireNonNull(eligibilityRule, "eligibilityRule must not be null");
        this.registry = new DonorRegistryImpl(graph, eligibilityRule);
        this.ledger = new MatchLedgerImpl(registry);
        this.matchingService = new MatchingServiceImpl(registry, graph, ledger, clock.getZone());
        this.emergencyQueue = new EmergencyQueueImpl(matchingService);
    }

    /**
     * Creates an empty engine over the given site graph.
     */
    public static BloodMatchEngine create(DistanceGraph graph, EligibilityRule eligibilityRule, Clock clock) {
        BloodMatchEngine engine = new BloodMatchEngine(clock, graph, eligibilityRule);
        LOG.info(() -> String.format("Engine created: %d sites, %d-day donation cooldown",
                graph.getSites().size(), eligibilityRule.getCooldownDays()));
        return engine;
    }

    // ---- mutations (write lock) ----

    public Donor registerDonor(DonorRegistration registration) {
        lock.writeLock().lock();
        try {
            return registry.register(registration).snapshot();
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Match a walk-in patient against the donor pool.
     *
     * @throws MatchingException on invalid input or when no donor can be matched
     */
    public MatchRecord match(String bloodGroup, String site) {
        lock.writeLock().lock();
        try {
            PatientQuery patient = matchingService.resolvePatient(bloodGroup, site);
            return matchingService.findBestDonor(patient, clock.instant());
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Validate and queue an emergency ticket.
     *
     * @return the ticket with the queue size right after its insertion
     * @throws MatchingException on invalid urgency, blood group or site
     */
    public QueuedEmergency submitEmergency(int urgency, String bloodGroup, String site) {
        if (!EmergencyTicket.isValidUrgency(urgency)) {
            throw MatchingException.invalidUrgency(urgency);
        }
        lock.writeLock().lock();
        try {
            PatientQuery patient = matchingService.resolvePatient(bloodGroup, site);
            EmergencyTicket ticket = emergencyQueue.submit(urgency, patient, clock.instant());
            return new QueuedEmergency(ticket, emergencyQueue.size());
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Dequeue and process the most urgent ticket.
     *
     * @throws MatchingException with QUEUE_EMPTY when nothing is queued
     */
    public EmergencyOutcome processNextEmergency() {
        lock.writeLock().lock();
        try {
            return emergencyQueue.processNext(clock.instant());
        } finally {
            lock.writeLock().unlock();
        }
    }

    // ---- reads (read lock) ----

    public List<Donor> listDonors() {
        lock.readLock().lock();
        try {
            return snapshots(registry.listAll());
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * @throws MatchingException with INVALID_BLOOD_TYPE for an unknown group
     */
    public List<Donor> listDonorsByType(String bloodGroup) {
        BloodType type = BloodType.parse(bloodGroup);
        lock.readLock().lock();
        try {
            return snapshots(registry.listByType(type));
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<EmergencyTicket> peekEmergencyQueue() {
        lock.readLock().lock();
        try {
            return emergencyQueue.peekAll();
        } finally {
            lock.readLock().unlock();
        }
    }

    public int emergencyQueueSize() {
        lock.readLock().lock();
        try {
            return emergencyQueue.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<BloodTypeStats> statistics() {
        lock.readLock().lock();
        try {
            return ledger.aggregateStats(today());
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Completed matches, most recent first.
     */
    public List<MatchRecord> matchHistory() {
        lock.readLock().lock();
        try {
            return ledger.query();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Whether a donor snapshot is eligible as of the engine clock.
     */
    public boolean isEligible(Donor donor) {
        return eligibilityRule.isEligible(donor, today());
    }

    public Set<String> getSites() {
        return graph.getSites();
    }

    private LocalDate today() {
        return LocalDate.ofInstant(clock.instant(), clock.getZone());
    }

    private static List<Donor> snapshots(List<Donor> donors) {
        return donors.stream().map(Donor::snapshot).collect(Collectors.toList());
    }
}
