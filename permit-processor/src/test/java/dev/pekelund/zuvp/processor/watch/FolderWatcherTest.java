package dev.pekelund.zuvp.processor.watch;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import dev.pekelund.zuvp.processor.PermitPipeline;
import dev.pekelund.zuvp.processor.PipelineOutcome;
import dev.pekelund.zuvp.processor.ingestion.DocumentIngestionService;
import dev.pekelund.zuvp.processor.ingestion.SubmittedDocument;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;

class FolderWatcherTest {

    @TempDir
    Path dataDir;

    private Path inbox;
    private PermitPipeline pipeline;
    private FolderWatcher watcher;

    @BeforeEach
    void setUp() throws IOException {
        inbox = Files.createDirectories(dataDir.resolve("Zadosti"));
        pipeline = mock(PermitPipeline.class);
        watcher = new FolderWatcher(inbox, pipeline, new DocumentIngestionService(dataDir.resolve("uploads")),
            Duration.ofMillis(50), true);
    }

    @AfterEach
    void tearDown() {
        watcher.stop();
    }

    @Test
    void archivesFilesThatProduceDraft() throws IOException {
        Path file = Files.writeString(inbox.resolve("zadost.txt"), "applicant_name: Jan Novák");
        when(pipeline.process(any())).thenReturn(outcome(PipelineOutcome.Status.DRAFT_CREATED));

        watcher.handle(file);

        assertThat(file).doesNotExist();
        assertThat(inbox.resolve(FolderWatcher.PROCESSED_FOLDER).resolve("zadost.txt"))
            .hasContent("applicant_name: Jan Novák");
    }

    @Test
    void leavesFilesThatFailValidationInPlace() throws IOException {
        Path file = Files.writeString(inbox.resolve("faktura.txt"), "invoice");
        when(pipeline.process(any())).thenReturn(outcome(PipelineOutcome.Status.VALIDATION_FAILED));

        watcher.handle(file);

        assertThat(file).exists();
        assertThat(inbox.resolve(FolderWatcher.PROCESSED_FOLDER)).doesNotExist();
    }

    @Test
    void survivesProcessingErrors() throws IOException {
        Path file = Files.writeString(inbox.resolve("zadost.txt"), "applicant_name: Jan Novák");
        when(pipeline.process(any())).thenThrow(new IllegalStateException("draft store unavailable"));

        watcher.handle(file);

        assertThat(file).exists();
    }

    @Test
    void picksUpNewFilesOnceStarted() throws IOException {
        when(pipeline.process(any())).thenReturn(outcome(PipelineOutcome.Status.DRAFT_CREATED));
        watcher.start();
        assertThat(watcher.isRunning()).isTrue();

        Files.writeString(inbox.resolve("nova_zadost.txt"), "applicant_name: Eva Dvořáková");

        ArgumentCaptor<SubmittedDocument> captor = ArgumentCaptor.forClass(SubmittedDocument.class);
        verify(pipeline, timeout(10_000)).process(captor.capture());
        assertThat(captor.getValue().fileName()).isEqualTo("nova_zadost.txt");

        watcher.stop();
        assertThat(watcher.isRunning()).isFalse();
    }

    @Test
    void reportsConfiguredAutoStartup() {
        FolderWatcher disabled = new FolderWatcher(inbox, pipeline, new DocumentIngestionService(dataDir),
            Duration.ZERO, false);

        assertThat(watcher.isAutoStartup()).isTrue();
        assertThat(disabled.isAutoStartup()).isFalse();
    }

    private static PipelineOutcome outcome(PipelineOutcome.Status status) {
        return new PipelineOutcome("req-1", status, null, null, null, null);
    }
}
