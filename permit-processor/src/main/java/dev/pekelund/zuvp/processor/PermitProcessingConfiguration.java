package dev.pekelund.zuvp.processor;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import dev.pekelund.zuvp.drafts.DraftRepository;
import dev.pekelund.zuvp.drafts.DraftStore;
import dev.pekelund.zuvp.drafts.FileSystemDraftRepository;
import dev.pekelund.zuvp.extraction.EntityExtractor;
import dev.pekelund.zuvp.extraction.ExtractionCache;
import dev.pekelund.zuvp.extraction.ExtractionCacheStore;
import dev.pekelund.zuvp.extraction.FileSystemExtractionCacheStore;
import dev.pekelund.zuvp.fees.FeeCalculator;
import dev.pekelund.zuvp.normalization.FieldNormalizer;
import dev.pekelund.zuvp.notify.DraftNotifier;
import dev.pekelund.zuvp.processor.googleai.GeminiClient;
import dev.pekelund.zuvp.processor.googleai.GeminiEntityExtractor;
import dev.pekelund.zuvp.processor.googleai.GoogleAiGeminiChatOptions;
import dev.pekelund.zuvp.processor.googleai.GoogleAiGeminiClient;
import dev.pekelund.zuvp.processor.ingestion.DocumentIngestionService;
import dev.pekelund.zuvp.processor.ingestion.DocumentTextReader;
import dev.pekelund.zuvp.processor.notify.LoggingDraftNotifier;
import dev.pekelund.zuvp.processor.notify.MailDraftNotifier;
import dev.pekelund.zuvp.processor.render.PdfDocumentRenderer;
import dev.pekelund.zuvp.render.DocumentRenderer;
import dev.pekelund.zuvp.validation.PermitValidator;
import io.micrometer.observation.ObservationRegistry;
import java.time.Clock;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;
import org.springframework.core.env.Environment;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClient;

/**
 * Service configuration for the permit processing workload.
 */
@Configuration
public class PermitProcessingConfiguration {

    private static final Logger LOGGER = LoggerFactory.getLogger(PermitProcessingConfiguration.class);

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.findAndRegisterModules();
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public PermitProcessingSettings permitProcessingSettings() {
        PermitProcessingSettings settings = PermitProcessingSettings.fromEnvironment();
        LOGGER.info("Permit processing settings - data directory: {}, rate: {} CZK/m2/day, fallback duration: {} days,"
                + " extraction timeout: {}", settings.dataDirectory(), settings.ratePerSqmDay(),
            settings.fallbackDurationDays(), settings.extractionTimeout());
        return settings;
    }

    @Bean
    public ExtractionCacheStore extractionCacheStore(PermitProcessingSettings settings, ObjectMapper objectMapper) {
        return new FileSystemExtractionCacheStore(settings.cacheDirectory(), objectMapper);
    }

    @Bean
    public ExtractionCache extractionCache(ExtractionCacheStore extractionCacheStore) {
        return new ExtractionCache(extractionCacheStore);
    }

    @Bean
    public DraftRepository draftRepository(PermitProcessingSettings settings, ObjectMapper objectMapper) {
        return new FileSystemDraftRepository(settings.draftsDirectory(), objectMapper);
    }

    @Bean
    public DraftStore draftStore(DraftRepository draftRepository, Clock clock) {
        return new DraftStore(draftRepository, clock);
    }

    @Bean
    public FieldNormalizer fieldNormalizer(PermitProcessingSettings settings) {
        return new FieldNormalizer(settings.fallbackDurationDays());
    }

    @Bean
    public PermitValidator permitValidator() {
        return new PermitValidator();
    }

    @Bean
    public FeeCalculator feeCalculator(PermitProcessingSettings settings) {
        return new FeeCalculator(settings.ratePerSqmDay());
    }

    @Bean
    public DocumentIngestionService documentIngestionService(PermitProcessingSettings settings) {
        return new DocumentIngestionService(settings.uploadsDirectory());
    }

    @Bean
    public DocumentTextReader documentTextReader() {
        return new DocumentTextReader();
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService extractionExecutor(Environment environment) {
        int threads = environment.getProperty("permit.extraction.threads", Integer.class, 4);
        int queueCapacity = environment.getProperty("permit.extraction.queue-capacity", Integer.class, 64);
        LOGGER.info("Extraction executor with {} threads and queue capacity {}", threads, queueCapacity);
        return new ThreadPoolExecutor(threads, threads, 0L, TimeUnit.MILLISECONDS,
            new ArrayBlockingQueue<>(queueCapacity), new CustomizableThreadFactory("permit-extraction-"));
    }

    @Bean
    public DocumentRenderer documentRenderer(PermitProcessingSettings settings, Clock clock) {
        return new PdfDocumentRenderer(settings.outputDirectory(), settings.paymentAccount(), clock);
    }

    @Bean
    @ConditionalOnProperty(name = "permit.notifier.mail.enabled", havingValue = "false", matchIfMissing = true)
    public DraftNotifier loggingDraftNotifier() {
        return new LoggingDraftNotifier();
    }

    @Bean
    @ConditionalOnProperty(name = "permit.notifier.mail.enabled", havingValue = "true")
    public DraftNotifier mailDraftNotifier(JavaMailSender mailSender, Environment environment) {
        String from = environment.getProperty("permit.notifier.mail.from");
        String clerkEmail = environment.getProperty("permit.notifier.mail.clerk", "clerk@municipality.cz");
        LOGGER.info("Draft notifications will be mailed to {}", clerkEmail);
        return new MailDraftNotifier(mailSender, from, clerkEmail);
    }

    @Bean
    @Profile("!local")
    public GoogleAiGeminiChatOptions permitGeminiChatOptions(Environment environment) {
        String modelName = environment.getProperty("google.ai.gemini.model", "gemini-2.0-flash");
        Double temperature = environment.getProperty("google.ai.gemini.temperature", Double.class);
        Double topP = environment.getProperty("google.ai.gemini.top-p", Double.class);
        Integer topK = environment.getProperty("google.ai.gemini.top-k", Integer.class);
        Integer maxOutputTokens = environment.getProperty("google.ai.gemini.max-output-tokens", Integer.class);
        LOGGER.info("Configured Google AI Gemini chat settings - model: {}, temperature: {}, topP: {}, topK: {}, maxOutputTokens: {}",
            modelName, temperature, topP, topK, maxOutputTokens);
        return GoogleAiGeminiChatOptions.builder()
            .model(modelName)
            .temperature(temperature)
            .topP(topP)
            .topK(topK)
            .maxOutputTokens(maxOutputTokens)
            .responseMimeType("application/json")
            .build();
    }

    @Bean
    @Profile("!local")
    public GeminiClient geminiClient(Environment environment, GoogleAiGeminiChatOptions permitGeminiChatOptions,
        ObjectProvider<ObservationRegistry> observationRegistry) {

        String apiKey = environment.getProperty("AI_STUDIO_API_KEY");
        if (!StringUtils.hasText(apiKey)) {
            throw new IllegalStateException("Google AI Studio API key must be configured (AI_STUDIO_API_KEY)");
        }

        ObservationRegistry resolvedObservationRegistry = observationRegistry
            .getIfAvailable(() -> ObservationRegistry.NOOP);

        String baseUrl = environment.getProperty("google.ai.gemini.base-url", GoogleAiGeminiClient.DEFAULT_BASE_URL);
        RestClient restClient = RestClient.builder().baseUrl(baseUrl).build();

        GoogleAiGeminiClient client = new GoogleAiGeminiClient(restClient, apiKey, permitGeminiChatOptions,
            resolvedObservationRegistry);
        LOGGER.info("Google AI Gemini client default options: {}", client.getDefaultOptions());
        return client;
    }

    @Bean
    @Profile("!local")
    public EntityExtractor entityExtractor(GeminiClient geminiClient, ObjectMapper objectMapper,
        DocumentTextReader documentTextReader, GoogleAiGeminiChatOptions permitGeminiChatOptions) {
        return new GeminiEntityExtractor(geminiClient, objectMapper, documentTextReader, permitGeminiChatOptions);
    }

    @Bean
    public PermitPipeline permitPipeline(DocumentIngestionService documentIngestionService,
        ExtractionCache extractionCache, EntityExtractor entityExtractor, ExecutorService extractionExecutor,
        PermitProcessingSettings settings, FieldNormalizer fieldNormalizer, PermitValidator permitValidator,
        FeeCalculator feeCalculator, DocumentRenderer documentRenderer, DraftStore draftStore,
        DraftNotifier draftNotifier, Clock clock) {
        return new PermitPipeline(documentIngestionService, extractionCache, entityExtractor, extractionExecutor,
            settings.extractionTimeout(), fieldNormalizer, permitValidator, feeCalculator, documentRenderer,
            draftStore, draftNotifier, clock);
    }
}
