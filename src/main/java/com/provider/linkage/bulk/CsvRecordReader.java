package com.provider.linkage.bulk;

import com.provider.linkage.core.MalformedRecordException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Reads one CSV input file into typed records.
 *
 * <p>The first line is the header. Blank lines are skipped. A row that cannot be parsed is
 * collected as a {@link MalformedRecordException} and reading continues; only I/O failures and
 * a header lacking a required column abort the read.</p>
 *
 * @param <T> record type produced per row
 */
public abstract class CsvRecordReader<T> {
    private static final Logger log = LoggerFactory.getLogger(CsvRecordReader.class);
    private static final int PROGRESS_INTERVAL = 1000;

    private final String sourceName;

    protected CsvRecordReader(String sourceName) {
        this.sourceName = Objects.requireNonNull(sourceName, "sourceName is required");
    }

    public String getSourceName() {
        return sourceName;
    }

    public ReadResult<T> read(Path file, ProgressCallback callback) throws IOException {
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            return read(reader, callback);
        }
    }

    public ReadResult<T> read(Reader reader, ProgressCallback callback) throws IOException {
        ProgressCallback cb = callback != null ? callback : ProgressCallback.NOOP;
        List<T> records = new ArrayList<>();
        List<MalformedRecordException> rejections = new ArrayList<>();
        long totalRows = 0;

        BufferedReader br = reader instanceof BufferedReader b ? b : new BufferedReader(reader);
        String headerLine = br.readLine();
        if (headerLine == null) {
            return new ReadResult<>(0, List.of(), List.of());
        }
        CsvSupport.Header header = new CsvSupport.Header(CsvSupport.parseLine(stripBom(headerLine)));
        try {
            header.require(requiredColumns());
        } catch (IllegalArgumentException e) {
            throw new IOException(sourceName + ": " + e.getMessage(), e);
        }

        String line;
        long rowNumber = 0;
        while ((line = br.readLine()) != null) {
            if (line.isBlank()) {
                continue;
            }
            rowNumber++;
            totalRows++;
            try {
                List<String> row = CsvSupport.parseLine(line);
                records.add(parseRow(header, row, rowNumber));
            } catch (MalformedRecordException e) {
                rejections.add(e);
                log.warn("read.rejected source={} row={} error={}", sourceName, rowNumber, e.getMessage());
            } catch (IllegalArgumentException e) {
                rejections.add(new MalformedRecordException(sourceName, String.valueOf(rowNumber), e.getMessage(), e));
                log.warn("read.rejected source={} row={} error={}", sourceName, rowNumber, e.getMessage());
            }

            if (totalRows % PROGRESS_INTERVAL == 0) {
                cb.onProgress(totalRows, -1, "Read " + totalRows + " rows from " + sourceName);
            }
        }

        ReadResult<T> result = new ReadResult<>(totalRows, records, rejections);
        cb.onProgress(totalRows, totalRows, "Read completed for " + sourceName);
        log.info("read.completed source={} result={}", sourceName, result);
        return result;
    }

    /**
     * Columns the header must contain.
     */
    protected abstract String[] requiredColumns();

    /**
     * Converts one data row.
     *
     * @param rowNumber 1-based position among the data rows
     * @throws MalformedRecordException or {@link IllegalArgumentException} when the row is unusable
     */
    protected abstract T parseRow(CsvSupport.Header header, List<String> row, long rowNumber);

    protected MalformedRecordException malformed(String recordKey, String message) {
        return new MalformedRecordException(sourceName, recordKey, message);
    }

    protected static String keyOrRow(CsvSupport.Header header, List<String> row, long rowNumber) {
        String key = header.get(row, "record_key");
        return key != null ? key : String.valueOf(rowNumber);
    }

    private static String stripBom(String line) {
        return !line.isEmpty() && line.charAt(0) == '\uFEFF' ? line.substring(1) : line;
    }
}
