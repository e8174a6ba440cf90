package com.landscape.connect.bulk;

/**
 * Result of a bulk distance export.
 *
 * @param totalDistances entries written
 */
public record ExportResult(long totalDistances) {
}
