package dev.pekelund.zuvp.processor.ingestion;

import dev.pekelund.zuvp.extraction.ContentHashes;
import dev.pekelund.zuvp.permits.MediaKind;
import dev.pekelund.zuvp.permits.PermitRequest;
import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;

/**
 * Accepts submitted documents: checks the type, stores a copy under the uploads directory and hashes the bytes.
 */
public class DocumentIngestionService {

    private static final Logger LOGGER = LoggerFactory.getLogger(DocumentIngestionService.class);

    private final Path uploadsDirectory;

    public DocumentIngestionService(Path uploadsDirectory) {
        this.uploadsDirectory = Objects.requireNonNull(uploadsDirectory, "uploadsDirectory");
    }

    public PermitRequest ingest(String requestId, SubmittedDocument document, Instant receivedAt) {
        if (document == null || !StringUtils.hasText(document.fileName())) {
            throw new IngestionException("No file selected");
        }
        String fileName = sanitiseFileName(document.fileName());
        MediaKind mediaKind = MediaKind.fromFileName(fileName)
            .orElseThrow(() -> new IngestionException("File type not supported: " + document.fileName()));
        byte[] content = document.content();
        if (content.length == 0) {
            throw new IngestionException("Submitted file is empty: " + document.fileName());
        }

        Path target = uploadsDirectory.resolve(requestId + "_" + fileName);
        try {
            Files.createDirectories(uploadsDirectory);
            Files.write(target, content);
        } catch (IOException ex) {
            throw new IngestionException("Failed to store uploaded file " + fileName, ex);
        }

        String contentHash = ContentHashes.sha256(content);
        LOGGER.info("Stored upload {} ({} bytes, {}) with hash {}", target.getFileName(), content.length, mediaKind,
            contentHash);
        return new PermitRequest(requestId, contentHash, receivedAt, fileName, mediaKind);
    }

    /**
     * Reads a file from disk into a submission, keeping its file name.
     */
    public SubmittedDocument read(Path file) {
        try {
            return new SubmittedDocument(file.getFileName().toString(), Files.readAllBytes(file));
        } catch (IOException ex) {
            throw new IngestionException("Failed to read file " + file, ex);
        }
    }

    public boolean isSupported(Path file) {
        return file != null && file.getFileName() != null
            && MediaKind.fromFileName(file.getFileName().toString()).isPresent();
    }

    /**
     * Deletes every stored upload and returns the number of files removed.
     */
    public int clearUploads() {
        if (!Files.isDirectory(uploadsDirectory)) {
            return 0;
        }
        int removed = 0;
        try (DirectoryStream<Path> files = Files.newDirectoryStream(uploadsDirectory)) {
            for (Path file : files) {
                if (Files.isRegularFile(file)) {
                    Files.delete(file);
                    removed++;
                }
            }
        } catch (IOException ex) {
            throw new IngestionException("Failed to clear uploads in " + uploadsDirectory, ex);
        }
        LOGGER.info("Removed {} stored uploads", removed);
        return removed;
    }

    static String sanitiseFileName(String fileName) {
        String baseName = Path.of(fileName.replace('\\', '/')).getFileName().toString();
        String sanitised = baseName.replaceAll("[^a-zA-Z0-9._-]", "_");
        return StringUtils.hasText(sanitised) ? sanitised : "upload";
    }
}
