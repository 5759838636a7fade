package com.provider.linkage.bulk;

import com.provider.linkage.core.model.EntityType;
import com.provider.linkage.core.model.IdentityRecord;

import java.util.List;

/**
 * Reads a registry snapshot.
 *
 * <p>Columns: {@code record_key} (optional, defaults to the row number),
 * {@code primary_identifier}, {@code legal_name}, {@code entity_type} (optional, {@code 1}/{@code 2}
 * or a label, defaults to organization when the column is absent), {@code state},
 * {@code address}, {@code zip}, {@code phone}, {@code taxonomy}.</p>
 *
 * <p>{@code sourceOrder} is {@code startOrder + rowNumber}, so files read one after another with
 * increasing start orders keep ascending source-file order across the whole registry.</p>
 */
public class IdentityRecordReader extends CsvRecordReader<IdentityRecord> {

    private final long startOrder;

    public IdentityRecordReader(String sourceName, long startOrder) {
        super(sourceName);
        this.startOrder = startOrder;
    }

    @Override
    protected String[] requiredColumns() {
        return new String[]{"legal_name", "state"};
    }

    @Override
    protected IdentityRecord parseRow(CsvSupport.Header header, List<String> row, long rowNumber) {
        String recordKey = keyOrRow(header, row, rowNumber);
        EntityType entityType = EntityType.ORGANIZATION;
        if (header.has("entity_type")) {
            try {
                entityType = EntityType.fromCode(header.get(row, "entity_type"));
            } catch (IllegalArgumentException e) {
                throw malformed(recordKey, e.getMessage());
            }
        }
        return IdentityRecord.builder()
                .sourceName(getSourceName())
                .recordKey(recordKey)
                .sourceOrder(startOrder + rowNumber)
                .primaryIdentifier(header.get(row, "primary_identifier"))
                .legalName(header.get(row, "legal_name"))
                .entityType(entityType)
                .stateCode(header.get(row, "state"))
                .address(header.get(row, "address"))
                .zip(header.get(row, "zip"))
                .phone(header.get(row, "phone"))
                .taxonomyCode(header.get(row, "taxonomy"))
                .build();
    }
}
