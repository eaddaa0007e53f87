package dev.pekelund.zuvp.processor.local;

import dev.pekelund.zuvp.extraction.EntityExtractor;
import dev.pekelund.zuvp.processor.ingestion.DocumentTextReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;

/**
 * Local development wiring that replaces the Gemini extractor with {@link LocalTextEntityExtractor}.
 */
@Configuration
@Profile("local")
public class LocalPermitConfiguration {

    private static final Logger LOGGER = LoggerFactory.getLogger(LocalPermitConfiguration.class);

    @Bean
    public EntityExtractor entityExtractor(DocumentTextReader documentTextReader) {
        LOGGER.info("Local profile active; using the key/value text extractor instead of Gemini");
        return new LocalTextEntityExtractor(documentTextReader);
    }
}
