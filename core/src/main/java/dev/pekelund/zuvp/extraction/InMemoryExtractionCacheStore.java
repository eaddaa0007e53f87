package dev.pekelund.zuvp.extraction;

import dev.pekelund.zuvp.permits.ExtractionResult;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

public class InMemoryExtractionCacheStore implements ExtractionCacheStore {

    private final ConcurrentMap<String, ExtractionResult> entries = new ConcurrentHashMap<>();

    @Override
    public Optional<ExtractionResult> load(String contentHash) {
        return Optional.ofNullable(entries.get(contentHash));
    }

    @Override
    public void save(String contentHash, ExtractionResult result) {
        entries.put(contentHash, result);
    }

    @Override
    public int clear() {
        int removed = entries.size();
        entries.clear();
        return removed;
    }
}
