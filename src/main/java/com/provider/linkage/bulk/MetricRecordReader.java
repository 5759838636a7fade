package com.provider.linkage.bulk;

import com.provider.linkage.aggregate.MetricCatalog;
import com.provider.linkage.core.model.MetricRecord;

import java.util.List;

/**
 * Reads a metric dataset.
 *
 * <p>Columns: {@code record_key} (optional, defaults to the row number), {@code primary_identifier},
 * {@code key_space}, {@code foreign_key}, {@code org_name}, {@code state}, {@code metric},
 * {@code value}, {@code unit}, {@code as_of}. A blank {@code value} is kept as a published
 * null. A row must identify its organization by primary identifier, by foreign key or by name.</p>
 */
public class MetricRecordReader extends CsvRecordReader<MetricRecord> {

    public MetricRecordReader(String sourceName) {
        super(sourceName);
    }

    @Override
    protected String[] requiredColumns() {
        return new String[]{"metric", "value"};
    }

    @Override
    protected MetricRecord parseRow(CsvSupport.Header header, List<String> row, long rowNumber) {
        String recordKey = keyOrRow(header, row, rowNumber);
        String metric = header.get(row, "metric");
        if (metric == null || !MetricCatalog.isKnown(metric)) {
            throw malformed(recordKey, "Unknown metric: " + metric);
        }

        String primaryIdentifier = header.get(row, "primary_identifier");
        String keySpace = header.get(row, "key_space");
        String foreignKey = header.get(row, "foreign_key");
        String orgName = header.get(row, "org_name");
        if (foreignKey != null && keySpace == null) {
            throw malformed(recordKey, "foreign_key without key_space");
        }
        if (primaryIdentifier == null && foreignKey == null && orgName == null) {
            throw malformed(recordKey, "No primary identifier, foreign key or name");
        }

        return MetricRecord.builder()
                .sourceName(getSourceName())
                .recordKey(recordKey)
                .primaryIdentifier(primaryIdentifier)
                .foreignKey(keySpace, foreignKey)
                .orgName(orgName)
                .stateCode(header.get(row, "state"))
                .metricName(metric)
                .value(parseValue(recordKey, header.get(row, "value")))
                .unit(header.get(row, "unit"))
                .asOfPeriod(header.get(row, "as_of"))
                .build();
    }

    private Double parseValue(String recordKey, String raw) {
        if (raw == null) {
            return null;
        }
        double value;
        try {
            value = Double.parseDouble(raw.replace(",", "").replace("$", ""));
        } catch (NumberFormatException e) {
            throw malformed(recordKey, "Unparseable value: " + raw);
        }
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            throw malformed(recordKey, "Non-finite value: " + raw);
        }
        return value;
    }
}
