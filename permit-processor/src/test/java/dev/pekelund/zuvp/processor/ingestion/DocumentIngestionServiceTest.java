package dev.pekelund.zuvp.processor.ingestion;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import dev.pekelund.zuvp.extraction.ContentHashes;
import dev.pekelund.zuvp.permits.MediaKind;
import dev.pekelund.zuvp.permits.PermitRequest;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class DocumentIngestionServiceTest {

    private static final Instant RECEIVED = Instant.parse("2025-07-01T08:00:00Z");

    @TempDir
    Path dataDir;

    private Path uploads;
    private DocumentIngestionService service;

    @BeforeEach
    void setUp() {
        uploads = dataDir.resolve("uploads");
        service = new DocumentIngestionService(uploads);
    }

    @Test
    void storesUploadAndHashesContent() throws IOException {
        byte[] content = "Žadatel: Jan Novák".getBytes(StandardCharsets.UTF_8);

        PermitRequest request = service.ingest("req-1", new SubmittedDocument("zadost.txt", content), RECEIVED);

        assertThat(request.id()).isEqualTo("req-1");
        assertThat(request.mediaKind()).isEqualTo(MediaKind.TEXT);
        assertThat(request.fileName()).isEqualTo("zadost.txt");
        assertThat(request.receivedAt()).isEqualTo(RECEIVED);
        assertThat(request.contentHash()).isEqualTo(ContentHashes.sha256(content)).hasSize(64);
        assertThat(Files.readAllBytes(uploads.resolve("req-1_zadost.txt"))).isEqualTo(content);
    }

    @Test
    void identicalBytesHashIdenticallyRegardlessOfName() {
        byte[] content = "same bytes".getBytes(StandardCharsets.UTF_8);

        PermitRequest first = service.ingest("req-1", new SubmittedDocument("a.txt", content), RECEIVED);
        PermitRequest second = service.ingest("req-2", new SubmittedDocument("b.txt", content), RECEIVED);

        assertThat(first.contentHash()).isEqualTo(second.contentHash());
    }

    @Test
    void resolvesMediaKindCaseInsensitively() {
        PermitRequest request = service.ingest("req-1", new SubmittedDocument("SCAN.JPEG", new byte[] {1}),
            RECEIVED);

        assertThat(request.mediaKind()).isEqualTo(MediaKind.IMAGE);
    }

    @Test
    void rejectsUnsupportedExtension() {
        assertThatThrownBy(() -> service.ingest("req-1", new SubmittedDocument("virus.exe", new byte[] {1}),
            RECEIVED))
            .isInstanceOf(IngestionException.class)
            .hasMessage("File type not supported: virus.exe");
        assertThat(uploads).doesNotExist();
    }

    @Test
    void rejectsMissingFileName() {
        assertThatThrownBy(() -> service.ingest("req-1", new SubmittedDocument("", new byte[] {1}), RECEIVED))
            .isInstanceOf(IngestionException.class)
            .hasMessage("No file selected");
    }

    @Test
    void rejectsEmptyContent() {
        assertThatThrownBy(() -> service.ingest("req-1", new SubmittedDocument("zadost.pdf", new byte[0]),
            RECEIVED))
            .isInstanceOf(IngestionException.class)
            .hasMessage("Submitted file is empty: zadost.pdf");
    }

    @Test
    void sanitisesPathsAndUnusualCharacters() {
        assertThat(DocumentIngestionService.sanitiseFileName("../../etc/passwd.txt")).isEqualTo("passwd.txt");
        assertThat(DocumentIngestionService.sanitiseFileName("C:\\Users\\jan\\žádost o zábor.pdf"))
            .isEqualTo("__dost_o_z_bor.pdf");
    }

    @Test
    void readsFileFromDisk() throws IOException {
        Path file = Files.writeString(dataDir.resolve("zadost.txt"), "obsah");

        SubmittedDocument document = service.read(file);

        assertThat(document.fileName()).isEqualTo("zadost.txt");
        assertThat(document.content()).isEqualTo("obsah".getBytes(StandardCharsets.UTF_8));
    }

    @Test
    void reportsSupportedFiles() {
        assertThat(service.isSupported(Path.of("inbox", "zadost.docx"))).isTrue();
        assertThat(service.isSupported(Path.of("inbox", "notes.odt"))).isFalse();
    }

    @Test
    void clearsStoredUploads() {
        service.ingest("req-1", new SubmittedDocument("a.txt", new byte[] {1}), RECEIVED);
        service.ingest("req-2", new SubmittedDocument("b.pdf", new byte[] {2}), RECEIVED);

        assertThat(service.clearUploads()).isEqualTo(2);
        assertThat(uploads).isEmptyDirectory();
        assertThat(service.clearUploads()).isZero();
    }

    @Test
    void clearingMissingUploadsDirectoryRemovesNothing() {
        assertThat(service.clearUploads()).isZero();
    }
}
