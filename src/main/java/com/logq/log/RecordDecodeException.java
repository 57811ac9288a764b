package com.logq.log;

import java.io.IOException;

/**
 * A visible log line whose payload is not a JSON object. Aborts the whole query.
 */
public class RecordDecodeException extends IOException {
    private final int lineNumber;

    public RecordDecodeException(int lineNumber, String message, Throwable cause) {
        super("Line " + lineNumber + ": " + message, cause);
        this.lineNumber = lineNumber;
    }

    /** 1-based line number within the log. */
    public int lineNumber() {
        return lineNumber;
    }
}
