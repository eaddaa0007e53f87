package dev.pekelund.zuvp.processor.local;

import dev.pekelund.zuvp.extraction.EntityExtractor;
import dev.pekelund.zuvp.permits.ExtractionResult;
import dev.pekelund.zuvp.permits.MediaKind;
import dev.pekelund.zuvp.processor.ingestion.DocumentTextReader;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;

/**
 * Offline extractor for local runs. Reads {@code key: value} lines from the document text, so a plain text
 * application such as {@code applicant_name: Jan Novák} needs no model access.
 */
public class LocalTextEntityExtractor implements EntityExtractor {

    private static final Logger LOGGER = LoggerFactory.getLogger(LocalTextEntityExtractor.class);

    private final DocumentTextReader textReader;

    public LocalTextEntityExtractor(DocumentTextReader textReader) {
        this.textReader = Objects.requireNonNull(textReader, "textReader");
    }

    @Override
    public ExtractionResult extract(byte[] content, MediaKind mediaKind, String fileName) {
        if (mediaKind == MediaKind.IMAGE) {
            return ExtractionResult.failure("Local extractor cannot read images");
        }
        String text = textReader.readText(content, mediaKind);
        if (!StringUtils.hasText(text)) {
            return ExtractionResult.failure("No text content found in document");
        }

        Map<String, Object> fields = new LinkedHashMap<>();
        for (String line : text.split("\\R")) {
            int separator = line.indexOf(':');
            if (separator <= 0) {
                continue;
            }
            String key = line.substring(0, separator).trim();
            String value = line.substring(separator + 1).trim();
            if (StringUtils.hasText(key) && !fields.containsKey(key)) {
                fields.put(key, value);
            }
        }
        LOGGER.info("Local extractor read {} fields from {}", fields.size(), fileName);
        return ExtractionResult.success(fields, text);
    }
}
