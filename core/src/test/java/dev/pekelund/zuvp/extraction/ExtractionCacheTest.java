package dev.pekelund.zuvp.extraction;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import dev.pekelund.zuvp.permits.ExtractionResult;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;
import org.junit.jupiter.api.Test;

class ExtractionCacheTest {

    private static final String HASH = ContentHashes.sha256("žádost".getBytes(StandardCharsets.UTF_8));

    private final InMemoryExtractionCacheStore store = new InMemoryExtractionCacheStore();
    private final ExtractionCache cache = new ExtractionCache(store);

    @Test
    void identicalContentIsExtractedOnce() {
        CountingExtractor extractor = new CountingExtractor(
            () -> ExtractionResult.success(Map.of("applicant_name", "Jan"), "{}"));

        ExtractionResult first = cache.getOrExtract(HASH, extractor);
        ExtractionResult second = cache.getOrExtract(HASH, extractor);

        assertThat(extractor.calls()).isEqualTo(1);
        assertThat(second).isEqualTo(first);
        assertThat(store.load(HASH)).contains(first);
    }

    @Test
    void failedExtractionsAreNotCached() {
        CountingExtractor extractor = new CountingExtractor(() -> ExtractionResult.failure("timeout"));

        assertThat(cache.getOrExtract(HASH, extractor).failed()).isTrue();
        assertThat(cache.getOrExtract(HASH, extractor).failed()).isTrue();

        assertThat(extractor.calls()).isEqualTo(2);
        assertThat(store.load(HASH)).isEmpty();
    }

    @Test
    void concurrentRequestsForOneHashShareOneExtraction() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        CountingExtractor extractor = new CountingExtractor(() -> {
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
            }
            return ExtractionResult.success(Map.of("location", "Husova 12"), "{}");
        });

        ExecutorService executor = Executors.newFixedThreadPool(6);
        try {
            List<Future<ExtractionResult>> results = new ArrayList<>();
            for (int i = 0; i < 6; i++) {
                results.add(executor.submit(() -> cache.getOrExtract(HASH, extractor)));
            }
            Thread.sleep(100);
            release.countDown();
            for (Future<ExtractionResult> result : results) {
                assertThat(result.get(5, TimeUnit.SECONDS).fields()).containsEntry("location", "Husova 12");
            }
        } finally {
            executor.shutdownNow();
        }
        assertThat(extractor.calls()).isEqualTo(1);
    }

    @Test
    void extractorExceptionsPropagateAndAllowRetry() {
        assertThatThrownBy(() -> cache.getOrExtract(HASH, () -> {
            throw new IllegalStateException("extractor crashed");
        })).isInstanceOf(IllegalStateException.class);

        CountingExtractor extractor = new CountingExtractor(() -> ExtractionResult.success(Map.of("a", 1), null));
        assertThat(cache.getOrExtract(HASH, extractor).failed()).isFalse();
        assertThat(extractor.calls()).isEqualTo(1);
    }

    @Test
    void storeFailuresDoNotLoseTheResult() {
        ExtractionCache failingCache = new ExtractionCache(new ExtractionCacheStore() {
            @Override
            public Optional<ExtractionResult> load(String contentHash) {
                return Optional.empty();
            }

            @Override
            public void save(String contentHash, ExtractionResult result) {
                throw new ExtractionCacheException("disk full", null);
            }

            @Override
            public int clear() {
                return 0;
            }
        });

        ExtractionResult result = failingCache.getOrExtract(HASH,
            () -> ExtractionResult.success(Map.of("applicant_name", "Jan"), "{}"));

        assertThat(result.fields()).containsEntry("applicant_name", "Jan");
    }

    @Test
    void clearRemovesEntries() {
        cache.getOrExtract(HASH, () -> ExtractionResult.success(Map.of("a", 1), null));

        assertThat(cache.clear()).isEqualTo(1);
        assertThat(store.load(HASH)).isEmpty();
    }

    private static final class CountingExtractor implements Supplier<ExtractionResult> {

        private final AtomicInteger calls = new AtomicInteger();
        private final Supplier<ExtractionResult> delegate;

        private CountingExtractor(Supplier<ExtractionResult> delegate) {
            this.delegate = delegate;
        }

        @Override
        public ExtractionResult get() {
            calls.incrementAndGet();
            return delegate.get();
        }

        int calls() {
            return calls.get();
        }
    }
}
