package dev.pekelund.zuvp.processor;

import dev.pekelund.zuvp.extraction.EntityExtractor;
import dev.pekelund.zuvp.notify.DraftNotifier;
import java.util.Arrays;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

/**
 * Emits diagnostic logging when the service boots so the active configuration can be verified.
 */
@Component
public class PermitProcessorDiagnostics implements ApplicationRunner {

    private static final Logger LOGGER = LoggerFactory.getLogger(PermitProcessorDiagnostics.class);

    private final Environment environment;
    private final PermitProcessingSettings settings;
    private final ObjectProvider<EntityExtractor> entityExtractorProvider;
    private final ObjectProvider<DraftNotifier> draftNotifierProvider;

    public PermitProcessorDiagnostics(Environment environment, PermitProcessingSettings settings,
        ObjectProvider<EntityExtractor> entityExtractorProvider, ObjectProvider<DraftNotifier> draftNotifierProvider) {
        this.environment = environment;
        this.settings = settings;
        this.entityExtractorProvider = entityExtractorProvider;
        this.draftNotifierProvider = draftNotifierProvider;
    }

    @Override
    public void run(ApplicationArguments args) {
        LOGGER.info("ZUVP permit processor diagnostics starting");
        LOGGER.info("Active Spring profiles: {}", Arrays.toString(environment.getActiveProfiles()));
        LOGGER.info("Data directory: {} (inbox {}, folder watch {})", settings.dataDirectory(),
            settings.inboxDirectory(), settings.folderWatchEnabled() ? "enabled" : "disabled");
        LOGGER.info("Fee rate {} CZK per m2 and day, fallback duration {} days, payment account {}",
            settings.ratePerSqmDay(), settings.fallbackDurationDays(), settings.paymentAccount());
        LOGGER.info("Resolved Google AI Gemini configuration - model: {}",
            environment.getProperty("google.ai.gemini.model", "(unset)"));

        EntityExtractor extractor = entityExtractorProvider.getIfAvailable();
        if (extractor != null) {
            LOGGER.info("Entity extractor implementation: {}", extractor.getClass().getName());
        } else {
            LOGGER.info("Entity extractor bean not available; uploads cannot be processed");
        }
        DraftNotifier notifier = draftNotifierProvider.getIfAvailable();
        if (notifier != null) {
            LOGGER.info("Draft notifier implementation: {}", notifier.getClass().getName());
        }
    }
}
