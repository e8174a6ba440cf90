package com.landscape.connect.bulk;

import java.util.List;

/**
 * Result of a bulk distance import.
 *
 * @param totalRecords     non-blank lines read
 * @param distancesWritten entries handed to the store
 * @param errors           lines that could not be parsed
 */
public record ImportResult(long totalRecords, long distancesWritten, List<ImportError> errors) {

    public ImportResult {
        errors = errors != null ? List.copyOf(errors) : List.of();
    }

    public long errorCount() {
        return errors.size();
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    /**
     * @param lineNumber 1-based line in the input
     * @param line       the offending line
     * @param message    why it was rejected
     */
    public record ImportError(long lineNumber, String line, String message) {}
}
