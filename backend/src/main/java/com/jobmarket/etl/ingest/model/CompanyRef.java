package com.jobmarket.etl.ingest.model;

/**
 * Canonical company as resolved within one batch. {@code nameKey} is the comparison key that the
 * {@code companies} table is unique on; {@code displayName} is the preferred original spelling.
 */
public record CompanyRef(
    String nameKey,
    String displayName,
    String website,
    String logoUrl
) {
}
