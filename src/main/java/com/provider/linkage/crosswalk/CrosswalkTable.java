package com.provider.linkage.crosswalk;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Mapping from a foreign key space (for example {@code ccn}) to registry primary identifiers.
 *
 * <p>A foreign key may map to several identifiers and an identifier may be reached from several
 * foreign keys. The table is loaded in full before linking starts and is read-only afterwards,
 * so concurrent lookups need no locking.</p>
 */
public final class CrosswalkTable {

    private final String keySpace;
    private final Map<String, SortedSet<String>> mappings;
    private final int pairCount;

    private CrosswalkTable(Builder builder) {
        this.keySpace = builder.keySpace;
        Map<String, SortedSet<String>> frozen = new HashMap<>();
        int pairs = 0;
        for (Map.Entry<String, TreeSet<String>> entry : builder.mappings.entrySet()) {
            frozen.put(entry.getKey(), Collections.unmodifiableSortedSet(new TreeSet<>(entry.getValue())));
            pairs += entry.getValue().size();
        }
        this.mappings = Collections.unmodifiableMap(frozen);
        this.pairCount = pairs;
    }

    public String getKeySpace() {
        return keySpace;
    }

    /**
     * Primary identifiers mapped from {@code foreignKey}, sorted. Empty when unmapped.
     */
    public SortedSet<String> lookup(String foreignKey) {
        if (foreignKey == null) {
            return Collections.emptySortedSet();
        }
        SortedSet<String> ids = mappings.get(foreignKey.trim());
        return ids != null ? ids : Collections.emptySortedSet();
    }

    public int foreignKeyCount() {
        return mappings.size();
    }

    public int pairCount() {
        return pairCount;
    }

    public static CrosswalkTable empty(String keySpace) {
        return builder(keySpace).build();
    }

    public static Builder builder(String keySpace) {
        return new Builder(keySpace);
    }

    public static class Builder {
        private final String keySpace;
        private final Map<String, TreeSet<String>> mappings = new HashMap<>();

        private Builder(String keySpace) {
            this.keySpace = Objects.requireNonNull(keySpace, "keySpace is required");
        }

        public Builder put(String foreignKey, String primaryIdentifier) {
            Objects.requireNonNull(foreignKey, "foreignKey is required");
            Objects.requireNonNull(primaryIdentifier, "primaryIdentifier is required");
            mappings.computeIfAbsent(foreignKey.trim(), k -> new TreeSet<>()).add(primaryIdentifier.trim());
            return this;
        }

        public CrosswalkTable build() {
            return new CrosswalkTable(this);
        }
    }
}
