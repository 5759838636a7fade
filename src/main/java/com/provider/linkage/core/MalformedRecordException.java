package com.provider.linkage.core;

/**
 * Runtime exception thrown when an input record fails basic shape validation
 * (missing required field, unparseable value). Always recovered locally by rejecting
 * the single record; it never aborts a run.
 */
public class MalformedRecordException extends RuntimeException {

    private final String sourceName;
    private final String recordKey;

    public MalformedRecordException(String sourceName, String recordKey, String message) {
        super(message);
        this.sourceName = sourceName;
        this.recordKey = recordKey;
    }

    public MalformedRecordException(String sourceName, String recordKey, String message, Throwable cause) {
        super(message, cause);
        this.sourceName = sourceName;
        this.recordKey = recordKey;
    }

    public String getSourceName() {
        return sourceName;
    }

    public String getRecordKey() {
        return recordKey;
    }
}
