package dev.pekelund.zuvp.processor;

import com.fasterxml.jackson.annotation.JsonProperty;
import dev.pekelund.zuvp.drafts.Draft;
import dev.pekelund.zuvp.drafts.DraftNotFoundException;
import dev.pekelund.zuvp.drafts.DraftStorageException;
import dev.pekelund.zuvp.drafts.DraftStore;
import dev.pekelund.zuvp.extraction.ExtractionCacheException;
import dev.pekelund.zuvp.processor.ingestion.IngestionException;
import dev.pekelund.zuvp.processor.ingestion.SubmittedDocument;
import dev.pekelund.zuvp.render.RenderException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;
import org.springframework.web.server.ResponseStatusException;

/**
 * REST API for submitting permit applications and working with the resulting drafts.
 */
@RestController
@RequestMapping(path = "/api")
public class PermitController {

    private static final Logger LOGGER = LoggerFactory.getLogger(PermitController.class);

    private final PermitPipeline pipeline;
    private final DraftStore draftStore;

    public PermitController(PermitPipeline pipeline, DraftStore draftStore) {
        this.pipeline = pipeline;
        this.draftStore = draftStore;
    }

    @PostMapping(path = "/upload", consumes = MediaType.MULTIPART_FORM_DATA_VALUE,
        produces = MediaType.APPLICATION_JSON_VALUE)
    public PipelineOutcome upload(@RequestPart(name = "file", required = false) MultipartFile file)
        throws IOException {
        if (file == null || file.isEmpty()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "No file selected");
        }
        LOGGER.info("Received upload '{}' ({} bytes)", file.getOriginalFilename(), file.getSize());
        return pipeline.process(new SubmittedDocument(file.getOriginalFilename(), file.getBytes()));
    }

    @GetMapping(path = "/drafts", produces = MediaType.APPLICATION_JSON_VALUE)
    public List<Draft> listDrafts() {
        return draftStore.listAll();
    }

    @PostMapping(path = "/approve/{id}", produces = MediaType.APPLICATION_JSON_VALUE)
    public ApprovalResponse approve(@PathVariable("id") String id) {
        Draft approved = draftStore.approve(id);
        return new ApprovalResponse("approved", approved.id(), approved.approvedAt());
    }

    @GetMapping(path = "/download/{id}/{docType}")
    public ResponseEntity<Resource> download(@PathVariable("id") String id, @PathVariable("docType") String docType) {
        Path path = draftStore.getDocumentPath(id, docType);
        if (!Files.isRegularFile(path)) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "Document file not found for draft " + id);
        }
        ContentDisposition disposition = ContentDisposition.attachment()
            .filename(path.getFileName().toString())
            .build();
        return ResponseEntity.ok()
            .header(HttpHeaders.CONTENT_DISPOSITION, disposition.toString())
            .contentType(MediaType.APPLICATION_PDF)
            .body(new FileSystemResource(path));
    }

    @PostMapping(path = "/clear-cache", produces = MediaType.APPLICATION_JSON_VALUE)
    public Map<String, Object> clearCache() {
        int removed = pipeline.clearCache();
        return Map.of("status", "success", "message", "Cleared " + removed + " cached extractions");
    }

    @PostMapping(path = "/clear-drafts", produces = MediaType.APPLICATION_JSON_VALUE)
    public Map<String, Object> clearDrafts() {
        PurgeSummary summary = pipeline.purge();
        return Map.of("status", "success", "message", String.format(
            "Removed %d drafts, %d documents, %d cached extractions and %d uploads",
            summary.drafts(), summary.documents(), summary.cacheEntries(), summary.uploads()));
    }

    @ExceptionHandler(IngestionException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleIngestionException(IngestionException exception) {
        LOGGER.warn("Upload rejected: {}", exception.getMessage());
        return Map.of("error", exception.getMessage());
    }

    @ExceptionHandler(DraftNotFoundException.class)
    @ResponseStatus(HttpStatus.NOT_FOUND)
    public Map<String, Object> handleDraftNotFound(DraftNotFoundException exception) {
        LOGGER.warn("Draft lookup failed: {}", exception.getMessage());
        return Map.of("error", exception.getMessage());
    }

    @ExceptionHandler(RenderException.class)
    @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
    public Map<String, Object> handleRenderException(RenderException exception) {
        LOGGER.error("Document rendering failed: {}", exception.getMessage());
        return Map.of("error", "Document rendering failed: " + exception.getMessage());
    }

    @ExceptionHandler({DraftStorageException.class, ExtractionCacheException.class, PermitProcessingException.class})
    @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
    public Map<String, Object> handleProcessingFailure(RuntimeException exception) {
        LOGGER.error("Permit processing failed: {}", exception.getMessage());
        return Map.of("error", exception.getMessage());
    }

    public record ApprovalResponse(
        @JsonProperty("status") String status,
        @JsonProperty("draft_id") String draftId,
        @JsonProperty("approved_at") Instant approvedAt
    ) { }
}
