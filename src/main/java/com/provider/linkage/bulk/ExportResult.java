package com.provider.linkage.bulk;

import java.nio.file.Path;

/**
 * Result of exporting a run.
 *
 * @param outputDir     directory the tables were published to
 * @param organizations rows in {@code organizations.csv}
 * @param networks      rows in {@code networks.csv}
 * @param links         rows in {@code links.csv}
 * @param auditEntries  rows in {@code rejections.csv}
 */
public record ExportResult(
        Path outputDir,
        long organizations,
        long networks,
        long links,
        long auditEntries
) {
    @Override
    public String toString() {
        return "ExportResult{organizations=" + organizations +
                ", networks=" + networks +
                ", links=" + links +
                ", auditEntries=" + auditEntries + '}';
    }
}
