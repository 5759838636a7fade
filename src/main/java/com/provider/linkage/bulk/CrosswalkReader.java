package com.provider.linkage.bulk;

import com.provider.linkage.crosswalk.CrosswalkTable;

import java.util.List;

/**
 * Reads a crosswalk file with columns {@code foreign_key} and {@code primary_identifier}.
 * The key space comes from configuration, not from the file.
 */
public class CrosswalkReader extends CsvRecordReader<CrosswalkReader.Pair> {

    /**
     * One mapping row.
     */
    public record Pair(String foreignKey, String primaryIdentifier) {
    }

    private final String keySpace;

    public CrosswalkReader(String keySpace) {
        super("crosswalk:" + keySpace);
        this.keySpace = keySpace;
    }

    public String getKeySpace() {
        return keySpace;
    }

    @Override
    protected String[] requiredColumns() {
        return new String[]{"foreign_key", "primary_identifier"};
    }

    @Override
    protected Pair parseRow(CsvSupport.Header header, List<String> row, long rowNumber) {
        String recordKey = String.valueOf(rowNumber);
        String foreignKey = header.get(row, "foreign_key");
        String primaryIdentifier = header.get(row, "primary_identifier");
        if (foreignKey == null) {
            throw malformed(recordKey, "foreign_key is blank");
        }
        if (primaryIdentifier == null) {
            throw malformed(recordKey, "primary_identifier is blank");
        }
        return new Pair(foreignKey, primaryIdentifier);
    }

    /**
     * Builds the read-only table from the parsed rows.
     */
    public CrosswalkTable toTable(ReadResult<Pair> result) {
        CrosswalkTable.Builder builder = CrosswalkTable.builder(keySpace);
        for (Pair pair : result.records()) {
            builder.put(pair.foreignKey(), pair.primaryIdentifier());
        }
        return builder.build();
    }
}
