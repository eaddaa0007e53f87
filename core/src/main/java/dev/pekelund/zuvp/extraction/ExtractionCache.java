package dev.pekelund.zuvp.extraction;

import dev.pekelund.zuvp.permits.ExtractionResult;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Content-hash keyed cache in front of the external extractor.
 *
 * <p>At most one extraction per hash is in flight; concurrent callers for the same hash wait for that
 * extraction. Successful results are kept until {@link #clear()}. Failures are returned but not stored, so a
 * resubmission of the same bytes calls the extractor again.
 */
public class ExtractionCache {

    private static final Logger LOGGER = LoggerFactory.getLogger(ExtractionCache.class);

    private final ExtractionCacheStore store;
    private final ConcurrentMap<String, CompletableFuture<ExtractionResult>> inFlight = new ConcurrentHashMap<>();

    public ExtractionCache(ExtractionCacheStore store) {
        this.store = Objects.requireNonNull(store, "store");
    }

    public ExtractionResult getOrExtract(String contentHash, Supplier<ExtractionResult> extractor) {
        Objects.requireNonNull(contentHash, "contentHash");
        Objects.requireNonNull(extractor, "extractor");

        Optional<ExtractionResult> cached = store.load(contentHash);
        if (cached.isPresent()) {
            LOGGER.info("Extraction cache hit for {}", contentHash);
            return cached.get();
        }

        CompletableFuture<ExtractionResult> pending = new CompletableFuture<>();
        CompletableFuture<ExtractionResult> existing = inFlight.putIfAbsent(contentHash, pending);
        if (existing != null) {
            LOGGER.info("Extraction for {} already in flight; waiting for it", contentHash);
            return await(existing);
        }

        try {
            ExtractionResult result = store.load(contentHash).orElseGet(() -> extractAndStore(contentHash, extractor));
            pending.complete(result);
            return result;
        } catch (RuntimeException ex) {
            pending.completeExceptionally(ex);
            throw ex;
        } finally {
            inFlight.remove(contentHash, pending);
        }
    }

    public int clear() {
        int removed = store.clear();
        LOGGER.info("Cleared {} extraction cache entries", removed);
        return removed;
    }

    private ExtractionResult extractAndStore(String contentHash, Supplier<ExtractionResult> extractor) {
        LOGGER.info("Extraction cache miss for {}; invoking extractor", contentHash);
        ExtractionResult result = extractor.get();
        if (result == null) {
            result = ExtractionResult.failure("Extractor returned no result");
        }
        if (result.failed()) {
            LOGGER.info("Not caching failed extraction for {}: {}", contentHash, result.error());
            return result;
        }
        try {
            store.save(contentHash, result);
        } catch (ExtractionCacheException ex) {
            LOGGER.warn("Extraction result for {} could not be cached", contentHash, ex);
        }
        return result;
    }

    private ExtractionResult await(CompletableFuture<ExtractionResult> future) {
        try {
            return future.join();
        } catch (CompletionException ex) {
            if (ex.getCause() instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw ex;
        }
    }
}
