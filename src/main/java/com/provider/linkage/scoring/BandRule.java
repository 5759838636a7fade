package com.provider.linkage.scoring;

import java.util.List;
import java.util.Objects;

/**
 * Percentile bands of a component.
 *
 * <p>{@code boundaries} are strictly increasing percentiles in (0, 1) splitting the corpus into
 * {@code boundaries.size() + 1} bands. {@code floors} gives the points at the bottom of each
 * band; within a band points rise linearly toward the next band's floor, or toward
 * {@code max} in the top band.</p>
 *
 * @param boundaries percentile boundaries, e.g. {@code [0.5, 0.8, 0.95]}
 * @param floors     points at the bottom of each band, non-decreasing
 * @param max        points at the top of the highest band
 */
public record BandRule(List<Double> boundaries, List<Double> floors, double max) {
    public BandRule {
        Objects.requireNonNull(boundaries, "boundaries is required");
        Objects.requireNonNull(floors, "floors is required");
        boundaries = List.copyOf(boundaries);
        floors = List.copyOf(floors);
        if (floors.size() != boundaries.size() + 1) {
            throw new IllegalArgumentException("Expected " + (boundaries.size() + 1) + " band floors, got " + floors.size());
        }
        double previous = 0.0;
        for (double boundary : boundaries) {
            if (boundary <= previous || boundary >= 1.0) {
                throw new IllegalArgumentException("Band boundaries must be strictly increasing within (0, 1): " + boundaries);
            }
            previous = boundary;
        }
        double floor = 0.0;
        for (double f : floors) {
            if (f < floor) {
                throw new IllegalArgumentException("Band floors must be non-negative and non-decreasing: " + floors);
            }
            floor = f;
        }
        if (max < floor) {
            throw new IllegalArgumentException("Band max " + max + " is below the top floor " + floor);
        }
    }

    public int bandCount() {
        return floors.size();
    }
}
