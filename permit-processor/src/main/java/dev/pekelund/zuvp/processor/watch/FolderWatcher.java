package dev.pekelund.zuvp.processor.watch;

import dev.pekelund.zuvp.processor.PermitPipeline;
import dev.pekelund.zuvp.processor.PipelineOutcome;
import dev.pekelund.zuvp.processor.ingestion.DocumentIngestionService;
import dev.pekelund.zuvp.processor.ingestion.SubmittedDocument;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.ClosedWatchServiceException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardWatchEventKinds;
import java.nio.file.WatchEvent;
import java.nio.file.WatchKey;
import java.nio.file.WatchService;
import java.time.Duration;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;

/**
 * Watches the inbox folder and feeds newly created application files into the pipeline. Files that
 * produce a draft are moved to the {@code processed} subfolder; others stay where they are.
 */
public class FolderWatcher implements SmartLifecycle {

    private static final Logger LOGGER = LoggerFactory.getLogger(FolderWatcher.class);

    static final String PROCESSED_FOLDER = "processed";

    private final Path inboxDirectory;
    private final PermitPipeline pipeline;
    private final DocumentIngestionService ingestionService;
    private final Duration settleDelay;
    private final boolean autoStartup;

    private volatile boolean running;
    private WatchService watchService;
    private Thread worker;

    public FolderWatcher(Path inboxDirectory, PermitPipeline pipeline, DocumentIngestionService ingestionService,
        Duration settleDelay, boolean autoStartup) {
        this.inboxDirectory = Objects.requireNonNull(inboxDirectory, "inboxDirectory");
        this.pipeline = Objects.requireNonNull(pipeline, "pipeline");
        this.ingestionService = Objects.requireNonNull(ingestionService, "ingestionService");
        this.settleDelay = settleDelay != null ? settleDelay : Duration.ZERO;
        this.autoStartup = autoStartup;
    }

    @Override
    public synchronized void start() {
        if (running) {
            LOGGER.warn("Folder watcher already running for {}", inboxDirectory);
            return;
        }
        try {
            Files.createDirectories(inboxDirectory);
            watchService = inboxDirectory.getFileSystem().newWatchService();
            inboxDirectory.register(watchService, StandardWatchEventKinds.ENTRY_CREATE);
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to watch folder " + inboxDirectory, ex);
        }
        running = true;
        worker = new Thread(this::watchLoop, "permit-folder-watcher");
        worker.setDaemon(true);
        worker.start();
        LOGGER.info("Started monitoring folder {}", inboxDirectory);
    }

    @Override
    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        try {
            watchService.close();
        } catch (IOException ex) {
            LOGGER.warn("Failed to close watch service for {}", inboxDirectory, ex);
        }
        worker.interrupt();
        LOGGER.info("Stopped monitoring folder {}", inboxDirectory);
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public boolean isAutoStartup() {
        return autoStartup;
    }

    private void watchLoop() {
        while (running) {
            WatchKey key;
            try {
                key = watchService.take();
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                return;
            } catch (ClosedWatchServiceException ex) {
                return;
            }
            for (WatchEvent<?> event : key.pollEvents()) {
                if (event.kind() == StandardWatchEventKinds.OVERFLOW) {
                    LOGGER.warn("Watch events for {} overflowed; some files may need resubmitting", inboxDirectory);
                    continue;
                }
                Path file = inboxDirectory.resolve((Path) event.context());
                if (Files.isRegularFile(file) && ingestionService.isSupported(file)) {
                    LOGGER.info("New file detected: {}", file);
                    if (!awaitSettle()) {
                        return;
                    }
                    handle(file);
                }
            }
            if (!key.reset()) {
                LOGGER.warn("Watch key for {} is no longer valid; stopping", inboxDirectory);
                running = false;
                return;
            }
        }
    }

    private boolean awaitSettle() {
        try {
            Thread.sleep(settleDelay.toMillis());
            return true;
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    /**
     * Processes one file from the inbox. Failures are logged so the watcher keeps running.
     */
    void handle(Path file) {
        try {
            SubmittedDocument document = ingestionService.read(file);
            PipelineOutcome outcome = pipeline.process(document);
            if (outcome.status() == PipelineOutcome.Status.DRAFT_CREATED) {
                LOGGER.info("Processed {} into draft {}", file, outcome.requestId());
                archive(file);
            } else {
                LOGGER.warn("Processing of {} ended with {}: {}", file, outcome.status(), outcome.message());
            }
        } catch (RuntimeException ex) {
            LOGGER.error("Error processing file {}", file, ex);
        }
    }

    private void archive(Path file) {
        Path archiveDirectory = inboxDirectory.resolve(PROCESSED_FOLDER);
        try {
            Files.createDirectories(archiveDirectory);
            Path target = archiveDirectory.resolve(file.getFileName());
            Files.move(file, target, StandardCopyOption.REPLACE_EXISTING);
            LOGGER.info("Archived processed file to {}", target);
        } catch (IOException ex) {
            LOGGER.error("Failed to archive file {}", file, ex);
        }
    }
}
