package com.provider.linkage.pipeline;

import com.provider.linkage.core.MalformedRecordException;
import com.provider.linkage.core.model.IdentityRecord;
import com.provider.linkage.core.model.MetricRecord;
import com.provider.linkage.crosswalk.CrosswalkTable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Everything one run consumes, fully loaded before the run starts.
 *
 * @param identityRecords registry records from every snapshot
 * @param crosswalks      read-only crosswalk tables keyed by key space
 * @param metricRecords   metric-bearing records from every dataset
 * @param readRejections  rows the readers could not parse; reported, never linked
 */
public record PipelineInput(
        List<IdentityRecord> identityRecords,
        Map<String, CrosswalkTable> crosswalks,
        List<MetricRecord> metricRecords,
        List<MalformedRecordException> readRejections
) {
    public PipelineInput {
        identityRecords = identityRecords != null ? List.copyOf(identityRecords) : List.of();
        crosswalks = crosswalks != null ? Collections.unmodifiableMap(new TreeMap<>(crosswalks)) : Map.of();
        metricRecords = metricRecords != null ? List.copyOf(metricRecords) : List.of();
        readRejections = readRejections != null ? List.copyOf(readRejections) : List.of();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private final List<IdentityRecord> identityRecords = new ArrayList<>();
        private final Map<String, CrosswalkTable> crosswalks = new TreeMap<>();
        private final List<MetricRecord> metricRecords = new ArrayList<>();
        private final List<MalformedRecordException> readRejections = new ArrayList<>();

        public Builder identityRecords(List<IdentityRecord> records) {
            identityRecords.addAll(records);
            return this;
        }

        public Builder identityRecord(IdentityRecord record) {
            identityRecords.add(record);
            return this;
        }

        public Builder crosswalk(CrosswalkTable table) {
            if (crosswalks.putIfAbsent(table.getKeySpace(), table) != null) {
                throw new IllegalArgumentException("Duplicate crosswalk key space: " + table.getKeySpace());
            }
            return this;
        }

        public Builder metricRecords(List<MetricRecord> records) {
            metricRecords.addAll(records);
            return this;
        }

        public Builder metricRecord(MetricRecord record) {
            metricRecords.add(record);
            return this;
        }

        public Builder readRejections(List<MalformedRecordException> rejections) {
            readRejections.addAll(rejections);
            return this;
        }

        public PipelineInput build() {
            return new PipelineInput(identityRecords, crosswalks, metricRecords, readRejections);
        }
    }
}
