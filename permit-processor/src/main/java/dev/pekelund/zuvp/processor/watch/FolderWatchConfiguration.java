package dev.pekelund.zuvp.processor.watch;

import dev.pekelund.zuvp.processor.PermitPipeline;
import dev.pekelund.zuvp.processor.PermitProcessingSettings;
import dev.pekelund.zuvp.processor.ingestion.DocumentIngestionService;
import java.time.Duration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;

/**
 * Registers the inbox folder watcher. It only starts when {@code PERMIT_FOLDER_WATCH_ENABLED} is set.
 */
@Configuration
public class FolderWatchConfiguration {

    @Bean
    public FolderWatcher folderWatcher(PermitProcessingSettings settings, PermitPipeline permitPipeline,
        DocumentIngestionService documentIngestionService, Environment environment) {
        Duration settleDelay = environment.getProperty("permit.watch.settle-delay", Duration.class,
            Duration.ofSeconds(2));
        return new FolderWatcher(settings.inboxDirectory(), permitPipeline, documentIngestionService, settleDelay,
            settings.folderWatchEnabled());
    }
}
