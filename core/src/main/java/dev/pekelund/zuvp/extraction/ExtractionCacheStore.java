package dev.pekelund.zuvp.extraction;

import dev.pekelund.zuvp.permits.ExtractionResult;
import java.util.Optional;

/**
 * Backing store for cached extraction results, keyed by content hash.
 */
public interface ExtractionCacheStore {

    /**
     * @return the cached result, or empty when the entry is missing or cannot be read
     */
    Optional<ExtractionResult> load(String contentHash);

    void save(String contentHash, ExtractionResult result);

    /**
     * @return number of entries removed
     */
    int clear();
}
