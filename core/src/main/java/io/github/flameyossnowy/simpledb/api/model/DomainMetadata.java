package io.github.flameyossnowy.simpledb.api.model;

import java.time.Instant;

/**
 * Counts and sizes reported by {@code DomainMetadata}. Sizes are in bytes;
 * the timestamp is when the service computed them.
 */
public record DomainMetadata(
    long itemCount,
    long itemNamesSizeBytes,
    long attributeNameCount,
    long attributeNamesSizeBytes,
    long attributeValueCount,
    long attributeValuesSizeBytes,
    Instant timestamp
) {
}
