package dev.pekelund.zuvp.permits;

import java.util.Objects;

/**
 * Pairs the raw extraction with the record normalized from it, as handed to the validator.
 */
public record PermitCandidate(ExtractionResult extraction, CanonicalRecord record) {

    public PermitCandidate {
        Objects.requireNonNull(extraction, "extraction");
        Objects.requireNonNull(record, "record");
    }
}
