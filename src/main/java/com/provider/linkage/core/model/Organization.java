package com.provider.linkage.core.model;

import java.util.Collections;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Canonical organization in the spine.
 *
 * <p>Identity attributes are fixed at creation by the first-seen record. Linking passes only
 * add record references and the derived segment; once the run completes the organization is
 * {@linkplain #seal() sealed} and every mutator throws {@link IllegalStateException}.</p>
 */
public class Organization {
    private final String orgId;
    private final String primaryIdentifier;
    private final String legalName;
    private final String normalizedName;
    private final String stateCode;
    private final String address;
    private final String zip;
    private final String displayZip;
    private final String phone;
    private final String taxonomyCode;
    private final Set<SourceRecordRef> linkedRecords;
    private Segment segment;
    private volatile boolean sealed;

    private Organization(Builder builder) {
        this.orgId = builder.orgId;
        this.primaryIdentifier = builder.primaryIdentifier;
        this.legalName = builder.legalName;
        this.normalizedName = builder.normalizedName;
        this.stateCode = builder.stateCode != null ? builder.stateCode : "";
        this.address = builder.address;
        this.zip = builder.zip != null ? builder.zip : "";
        this.displayZip = builder.displayZip;
        this.phone = builder.phone != null ? builder.phone : "";
        this.taxonomyCode = builder.taxonomyCode;
        this.linkedRecords = new TreeSet<>();
    }

    public String getOrgId() {
        return orgId;
    }

    public String getPrimaryIdentifier() {
        return primaryIdentifier;
    }

    public boolean hasPrimaryIdentifier() {
        return primaryIdentifier != null;
    }

    public String getLegalName() {
        return legalName;
    }

    public String getNormalizedName() {
        return normalizedName;
    }

    public String getStateCode() {
        return stateCode;
    }

    public String getAddress() {
        return address;
    }

    /**
     * Five-digit match key.
     */
    public String getZip() {
        return zip;
    }

    /**
     * Postal code exactly as the first-seen record published it.
     */
    public String getDisplayZip() {
        return displayZip;
    }

    public String getPhone() {
        return phone;
    }

    public String getTaxonomyCode() {
        return taxonomyCode;
    }

    public synchronized Set<SourceRecordRef> getLinkedRecords() {
        return Collections.unmodifiableSet(new TreeSet<>(linkedRecords));
    }

    public synchronized int getLinkedRecordCount() {
        return linkedRecords.size();
    }

    public Segment getSegment() {
        return segment;
    }

    /**
     * Folds a raw record into this organization.
     *
     * @return true if the reference was not already present
     */
    public synchronized boolean link(SourceRecordRef ref) {
        checkNotSealed();
        return linkedRecords.add(Objects.requireNonNull(ref, "ref is required"));
    }

    public synchronized void assignSegment(Segment segment) {
        checkNotSealed();
        this.segment = Objects.requireNonNull(segment, "segment is required");
    }

    /**
     * Freezes the organization at the end of a pipeline run.
     */
    public void seal() {
        this.sealed = true;
    }

    public boolean isSealed() {
        return sealed;
    }

    private void checkNotSealed() {
        if (sealed) {
            throw new IllegalStateException("Organization " + orgId + " is sealed");
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Organization that = (Organization) o;
        return Objects.equals(orgId, that.orgId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(orgId);
    }

    @Override
    public String toString() {
        return "Organization{" +
                "orgId='" + orgId + '\'' +
                ", legalName='" + legalName + '\'' +
                ", normalizedName='" + normalizedName + '\'' +
                ", stateCode='" + stateCode + '\'' +
                ", segment=" + segment +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String orgId;
        private String primaryIdentifier;
        private String legalName;
        private String normalizedName;
        private String stateCode;
        private String address;
        private String zip;
        private String displayZip;
        private String phone;
        private String taxonomyCode;

        public Builder orgId(String orgId) {
            this.orgId = orgId;
            return this;
        }

        public Builder primaryIdentifier(String primaryIdentifier) {
            this.primaryIdentifier = primaryIdentifier;
            return this;
        }

        public Builder legalName(String legalName) {
            this.legalName = legalName;
            return this;
        }

        public Builder normalizedName(String normalizedName) {
            this.normalizedName = normalizedName;
            return this;
        }

        public Builder stateCode(String stateCode) {
            this.stateCode = stateCode;
            return this;
        }

        public Builder address(String address) {
            this.address = address;
            return this;
        }

        public Builder zip(String zip) {
            this.zip = zip;
            return this;
        }

        public Builder displayZip(String displayZip) {
            this.displayZip = displayZip;
            return this;
        }

        public Builder phone(String phone) {
            this.phone = phone;
            return this;
        }

        public Builder taxonomyCode(String taxonomyCode) {
            this.taxonomyCode = taxonomyCode;
            return this;
        }

        public Organization build() {
            Objects.requireNonNull(orgId, "orgId is required");
            Objects.requireNonNull(legalName, "legalName is required");
            Objects.requireNonNull(normalizedName, "normalizedName is required");
            return new Organization(this);
        }
    }
}
