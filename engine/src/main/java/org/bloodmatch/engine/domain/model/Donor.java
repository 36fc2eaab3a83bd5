package org.bloodmatch.engine.domain.model;

import java.time.LocalDate;
import java.util.Objects;

/**
 * A registered blood donor.
 *
 * Identity, name, blood type and site never change. The donation history
 * (last donation date and total count) is mutated in place when the donor is
 * matched, and only by the registry that owns the instance. Callers outside
 * the engine only ever see copies taken with {@link #snapshot()}.
 */
public final class Donor {

    private final String id;
    private final String name;
    private final BloodType bloodType;
    private final String site;
    private final long registrationOrder;

    // null when missing or unparsable at registration
    private LocalDate lastDonationDate;
    private int totalDonations;

    private Donor(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id must not be null");
        this.name = Objects.requireNonNull(builder.name, "name must not be null");
        this.bloodType = Objects.requireNonNull(builder.bloodType, "bloodType must not be null");
        this.site = Objects.requireNonNull(builder.site, "site must not be null");
        this.registrationOrder = builder.registrationOrder;
        this.lastDonationDate = builder.lastDonationDate;
        this.totalDonations = builder.totalDonations;
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public BloodType getBloodType() {
        return bloodType;
    }

    public String getSite() {
        return site;
    }

    /**
     * Position of this donor in the registry's global registration sequence.
     */
    public long getRegistrationOrder() {
        return registrationOrder;
    }

    public LocalDate getLastDonationDate() {
        return lastDonationDate;
    }

    public int getTotalDonations() {
        return totalDonations;
    }

    /**
     * Record a donation made on {@code date}. Called by the owning registry only.
     */
    public void recordDonation(LocalDate date) {
        this.lastDonationDate = Objects.requireNonNull(date, "date must not be null");
        this.totalDonations++;
    }

    /**
     * Detached copy of the current state.
     */
    public Donor snapshot() {
        return new Builder()
                .id(id)
                .name(name)
                .bloodType(bloodType)
                .site(site)
                .registrationOrder(registrationOrder)
                .lastDonationDate(lastDonationDate)
                .totalDonations(totalDonations)
                .build();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Donor)) {
            return false;
        }
        return id.equals(((Donor) o).id);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return "Donor{" +
                "id='" + id + '\'' +
                ", name='" + name + '\'' +
                ", bloodType=" + bloodType +
                ", site='" + site + '\'' +
                ", lastDonationDate=" + lastDonationDate +
                ", totalDonations=" + totalDonations +
                '}';
    }

    /**
     * Builder for Donor.
     */
    public static final class Builder {
        private String id;
        private String name;
        private BloodType bloodType;
        private String site;
        private long registrationOrder;
        private LocalDate lastDonationDate;
        private int totalDonations;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder bloodType(BloodType bloodType) {
            this.bloodType = bloodType;
            return this;
        }

        public Builder site(String site) {
            this.site = site;
            return this;
        }

        public Builder registrationOrder(long registrationOrder) {
            this.registrationOrder = registrationOrder;
            return this;
        }

        public Builder lastDonationDate(LocalDate lastDonationDate) {
            this.lastDonationDate = lastDonationDate;
            return this;
        }

        public Builder totalDonations(int totalDonations) {
            if (totalDonations < 0) {
                throw new IllegalArgumentException("totalDonations must not be negative");
            }
            this.totalDonations = totalDonations;
            return this;
        }

        public Donor build() {
            return new Donor(this);
        }
    }
}
