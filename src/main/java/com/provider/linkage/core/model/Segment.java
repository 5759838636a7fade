package com.provider.linkage.core.model;

/**
 * Mutually exclusive outreach segments. Classification priority is B, A, C, D.
 */
public enum Segment {
    A("Specialty/Behavioral (Home Health, Hospice, Behavioral Health)"),
    B("FQHC/HRSA (Federally Qualified Health Centers, Rural Health Clinics)"),
    C("Health Systems/Hospitals (Large multi-specialty groups, hospital-affiliated)"),
    D("Other (General practices, small clinics, specialty not in A/B/C)");

    private final String description;

    Segment(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }
}
