package com.provider.linkage.bulk;

import com.provider.linkage.core.MalformedRecordException;

import java.util.List;

/**
 * Result of reading one input file.
 *
 * @param totalRows  data rows seen, excluding the header and blank lines
 * @param records    rows that parsed
 * @param rejections rows that did not, in file order
 */
public record ReadResult<T>(long totalRows, List<T> records, List<MalformedRecordException> rejections) {
    public ReadResult {
        records = records != null ? List.copyOf(records) : List.of();
        rejections = rejections != null ? List.copyOf(rejections) : List.of();
    }

    public boolean hasRejections() {
        return !rejections.isEmpty();
    }

    @Override
    public String toString() {
        return "ReadResult{rows=" + totalRows + ", records=" + records.size()
                + ", rejected=" + rejections.size() + '}';
    }
}
