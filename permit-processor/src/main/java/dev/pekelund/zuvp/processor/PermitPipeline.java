package dev.pekelund.zuvp.processor;

import dev.pekelund.zuvp.drafts.Draft;
import dev.pekelund.zuvp.drafts.DraftStore;
import dev.pekelund.zuvp.extraction.EntityExtractor;
import dev.pekelund.zuvp.extraction.ExtractionCache;
import dev.pekelund.zuvp.fees.FeeCalculationException;
import dev.pekelund.zuvp.fees.FeeCalculator;
import dev.pekelund.zuvp.fees.VariableSymbolGenerator;
import dev.pekelund.zuvp.normalization.FieldNormalizer;
import dev.pekelund.zuvp.notify.DraftNotifier;
import dev.pekelund.zuvp.permits.CanonicalRecord;
import dev.pekelund.zuvp.permits.ExtractionResult;
import dev.pekelund.zuvp.permits.PermitCandidate;
import dev.pekelund.zuvp.permits.PermitRequest;
import dev.pekelund.zuvp.permits.ValidationResult;
import dev.pekelund.zuvp.processor.ingestion.DocumentIngestionService;
import dev.pekelund.zuvp.processor.ingestion.SubmittedDocument;
import dev.pekelund.zuvp.render.DocumentRenderer;
import dev.pekelund.zuvp.render.RenderException;
import dev.pekelund.zuvp.validation.PermitValidator;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs a submitted document through ingestion, cached extraction, normalization and validation, and for valid
 * submissions through fee calculation, rendering and draft creation.
 *
 * <p>Rejected and incomplete submissions are returned as typed outcomes and leave no draft behind. Ingestion
 * and rendering faults propagate as {@link dev.pekelund.zuvp.processor.ingestion.IngestionException} and
 * {@link RenderException}; a draft is only written once both documents exist.
 */
public class PermitPipeline {

    private static final Logger LOGGER = LoggerFactory.getLogger(PermitPipeline.class);

    private final DocumentIngestionService ingestionService;
    private final ExtractionCache extractionCache;
    private final EntityExtractor entityExtractor;
    private final ExecutorService extractionExecutor;
    private final Duration extractionTimeout;
    private final FieldNormalizer fieldNormalizer;
    private final PermitValidator validator;
    private final FeeCalculator feeCalculator;
    private final DocumentRenderer documentRenderer;
    private final DraftStore draftStore;
    private final DraftNotifier draftNotifier;
    private final Clock clock;

    public PermitPipeline(DocumentIngestionService ingestionService, ExtractionCache extractionCache,
        EntityExtractor entityExtractor, ExecutorService extractionExecutor, Duration extractionTimeout,
        FieldNormalizer fieldNormalizer, PermitValidator validator, FeeCalculator feeCalculator,
        DocumentRenderer documentRenderer, DraftStore draftStore, DraftNotifier draftNotifier, Clock clock) {
        this.ingestionService = Objects.requireNonNull(ingestionService, "ingestionService");
        this.extractionCache = Objects.requireNonNull(extractionCache, "extractionCache");
        this.entityExtractor = Objects.requireNonNull(entityExtractor, "entityExtractor");
        this.extractionExecutor = Objects.requireNonNull(extractionExecutor, "extractionExecutor");
        this.extractionTimeout = Objects.requireNonNull(extractionTimeout, "extractionTimeout");
        this.fieldNormalizer = Objects.requireNonNull(fieldNormalizer, "fieldNormalizer");
        this.validator = Objects.requireNonNull(validator, "validator");
        this.feeCalculator = Objects.requireNonNull(feeCalculator, "feeCalculator");
        this.documentRenderer = Objects.requireNonNull(documentRenderer, "documentRenderer");
        this.draftStore = Objects.requireNonNull(draftStore, "draftStore");
        this.draftNotifier = Objects.requireNonNull(draftNotifier, "draftNotifier");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public PipelineOutcome process(SubmittedDocument document) {
        String requestId = UUID.randomUUID().toString();
        try (PermitProcessingMdc.Context ignored = PermitProcessingMdc.open(requestId)) {
            PermitProcessingMdc.attachFile(document != null ? document.fileName() : null);
            try {
                return run(requestId, document);
            } catch (RuntimeException ex) {
                LOGGER.error("Processing of request {} failed", requestId, ex);
                throw ex;
            }
        }
    }

    private PipelineOutcome run(String requestId, SubmittedDocument document) {
        PermitRequest request = ingestionService.ingest(requestId, document, clock.instant());
        enter(PipelineStage.INGESTED);
        LOGGER.info("Request {} ingested: {} ({})", requestId, request.fileName(), request.mediaKind());

        ExtractionResult extraction = extractionCache.getOrExtract(request.contentHash(),
            () -> extractWithTimeout(document, request));
        enter(PipelineStage.EXTRACTED);
        if (extraction.failed()) {
            LOGGER.info("Extraction for request {} produced an error: {}", requestId, extraction.error());
        } else {
            LOGGER.info("Extraction for request {} produced {} fields", requestId, extraction.fields().size());
        }

        CanonicalRecord record = fieldNormalizer.normalize(extraction);
        enter(PipelineStage.NORMALIZED);

        ValidationResult validation = validator.validate(new PermitCandidate(extraction, record));
        enter(PipelineStage.VALIDATED);

        if (!validation.recognizedDocument()) {
            enter(PipelineStage.REJECTED);
            LOGGER.info("Request {} rejected: {}", requestId, validation.message());
            return PipelineOutcome.rejected(requestId, validation);
        }
        if (!validation.complete()) {
            enter(PipelineStage.INCOMPLETE);
            LOGGER.info("Request {} is incomplete; missing {}", requestId, validation.missingRequired());
            return PipelineOutcome.incomplete(requestId, validation, record);
        }

        enter(PipelineStage.READY);
        long fee = computeFee(record, requestId);
        CanonicalRecord charged = record.withCharges(fee, VariableSymbolGenerator.generate(requestId));
        LOGGER.info("Request {} ready: {} m2 for {} days, fee {} CZK, variable symbol {}", requestId,
            charged.areaSqm().toPlainString(), charged.durationDays(), fee, charged.variableSymbol());

        Map<String, Path> documents = render(charged, requestId);
        enter(PipelineStage.RENDERED);

        Draft draft = draftStore.create(requestId, charged, documents);
        enter(PipelineStage.DRAFTED);
        LOGGER.info("Draft {} created and awaiting approval", draft.id());

        notifyClerk(draft);
        return PipelineOutcome.drafted(requestId, validation, draft);
    }

    private ExtractionResult extractWithTimeout(SubmittedDocument document, PermitRequest request) {
        Future<ExtractionResult> future;
        try {
            future = extractionExecutor.submit(PermitProcessingMdc.propagate(
                () -> entityExtractor.extract(document.content(), request.mediaKind(), request.fileName())));
        } catch (RejectedExecutionException ex) {
            LOGGER.error("Extraction for request {} could not be scheduled", request.id(), ex);
            return ExtractionResult.failure("Extraction could not be scheduled: " + ex.getMessage());
        }
        try {
            return future.get(extractionTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException ex) {
            future.cancel(true);
            LOGGER.warn("Extraction for request {} timed out after {} s", request.id(), extractionTimeout.toSeconds());
            return ExtractionResult.failure("Extraction timed out after " + extractionTimeout.toSeconds() + " s");
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause() != null ? ex.getCause() : ex;
            LOGGER.error("Extractor failed for request {}", request.id(), cause);
            return ExtractionResult.failure("Extraction failed: " + cause.getMessage());
        } catch (InterruptedException ex) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new PermitProcessingException("Interrupted while waiting for extraction of request " + request.id(),
                ex);
        }
    }

    private long computeFee(CanonicalRecord record, String requestId) {
        try {
            return feeCalculator.computeFee(record.areaSqm(), record.durationDays());
        } catch (FeeCalculationException ex) {
            LOGGER.error("Fee for request {} cannot be computed", requestId, ex);
            throw new PermitProcessingException("Fee for request " + requestId + " cannot be computed: "
                + ex.getMessage(), ex);
        }
    }

    private Map<String, Path> render(CanonicalRecord record, String requestId) {
        try {
            return documentRenderer.render(record, requestId);
        } catch (RenderException ex) {
            throw ex;
        } catch (RuntimeException ex) {
            throw new RenderException("Document rendering failed for request " + requestId, ex);
        }
    }

    private void notifyClerk(Draft draft) {
        try {
            draftNotifier.draftCreated(draft);
        } catch (RuntimeException ex) {
            LOGGER.warn("Notifier failed for draft {}", draft.id(), ex);
        }
    }

    public int clearCache() {
        return extractionCache.clear();
    }

    /**
     * Returns the service to its first-run state: drafts with their rendered documents, cached extractions and
     * stored uploads are deleted.
     */
    public PurgeSummary purge() {
        int documents = 0;
        for (Draft draft : draftStore.listAll()) {
            for (String path : draft.documents().values()) {
                if (deleteDocument(Path.of(path))) {
                    documents++;
                }
            }
        }
        int drafts = draftStore.deleteAll();
        int cacheEntries = extractionCache.clear();
        int uploads = ingestionService.clearUploads();
        PurgeSummary summary = new PurgeSummary(drafts, documents, cacheEntries, uploads);
        LOGGER.info("Purged processing state: {}", summary);
        return summary;
    }

    private boolean deleteDocument(Path path) {
        try {
            return Files.deleteIfExists(path);
        } catch (IOException ex) {
            throw new PermitProcessingException("Failed to delete rendered document " + path, ex);
        }
    }

    private static void enter(PipelineStage stage) {
        PermitProcessingMdc.setStage(stage);
        LOGGER.info("Stage {}", stage);
    }
}
