package dev.pekelund.zuvp.processor.googleai;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.pekelund.zuvp.extraction.EntityExtractor;
import dev.pekelund.zuvp.permits.ExtractionResult;
import dev.pekelund.zuvp.permits.MediaKind;
import dev.pekelund.zuvp.processor.ingestion.DocumentTextReader;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;

/**
 * {@link EntityExtractor} that asks Gemini to pull permit fields out of a submission. Documents with a text
 * layer are sent as text; scans and images are attached inline.
 */
public class GeminiEntityExtractor implements EntityExtractor {

    private static final Logger LOGGER = LoggerFactory.getLogger(GeminiEntityExtractor.class);

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<Map<String, Object>>() { };

    private static final String FIELD_INSTRUCTIONS = """
        Extract the following information from this ZUVP (zvláštní užívání veřejného prostranství, special use of
        public space) application:
        - applicant_name: applicant name (žadatel)
        - company_id: company ID (IČO) if applicable
        - contact_details: object with phone, email and address where present
        - purpose_of_use: purpose of use (účel užívání)
        - location: specific location (address or plot number)
        - duration: object with start_date and end_date in YYYY-MM-DD format
        - area_sqm: used area in square meters as a number, if mentioned
        Leave out fields that are not present in the document.
        If the document is not a ZUVP application, respond with {"is_zuvp_document": false}.
        Respond with a single JSON object and nothing else.
        """;

    private static final int PREVIEW_LENGTH = 256;

    private final GeminiClient geminiClient;
    private final ObjectMapper objectMapper;
    private final DocumentTextReader textReader;
    private final GoogleAiGeminiChatOptions chatOptions;

    public GeminiEntityExtractor(GeminiClient geminiClient, ObjectMapper objectMapper, DocumentTextReader textReader,
        GoogleAiGeminiChatOptions chatOptions) {
        this.geminiClient = Objects.requireNonNull(geminiClient, "geminiClient");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
        this.textReader = Objects.requireNonNull(textReader, "textReader");
        this.chatOptions = chatOptions;
    }

    @Override
    public ExtractionResult extract(byte[] content, MediaKind mediaKind, String fileName) {
        String response;
        try {
            response = request(content, mediaKind, fileName);
        } catch (NoTextContentException ex) {
            LOGGER.warn("No text content found in {} ({})", fileName, mediaKind);
            return ExtractionResult.failure(ex.getMessage());
        } catch (RuntimeException ex) {
            LOGGER.error("Gemini extraction failed for {}", fileName, ex);
            return ExtractionResult.failure("Gemini request failed: " + ex.getMessage());
        }

        if (!StringUtils.hasText(response)) {
            return ExtractionResult.failure("Gemini returned an empty response");
        }
        LOGGER.info("Gemini response received for {} ({} characters)", fileName, response.length());
        String sanitised = sanitiseResponse(response);
        try {
            Map<String, Object> fields = objectMapper.readValue(sanitised, MAP_TYPE);
            return ExtractionResult.success(fields, response);
        } catch (JsonProcessingException ex) {
            LOGGER.warn("Gemini response for {} is not a JSON object. Payload begins with: {}", fileName,
                preview(sanitised));
            return ExtractionResult.success(Map.of(), response);
        }
    }

    private String request(byte[] content, MediaKind mediaKind, String fileName) {
        switch (mediaKind) {
            case TEXT, DOCX -> {
                String text = textReader.readText(content, mediaKind);
                if (!StringUtils.hasText(text)) {
                    throw new NoTextContentException();
                }
                return geminiClient.generateContent(textPrompt(text, fileName), chatOptions);
            }
            case PDF -> {
                String text = textReader.readText(content, mediaKind);
                if (StringUtils.hasText(text)) {
                    return geminiClient.generateContent(textPrompt(text, fileName), chatOptions);
                }
                LOGGER.info("PDF {} has no text layer; sending it inline", fileName);
                return geminiClient.generateContent(documentPrompt(fileName),
                    new InlineDocument(mediaKind.mimeType(fileName), content), chatOptions);
            }
            case IMAGE -> {
                return geminiClient.generateContent(documentPrompt(fileName),
                    new InlineDocument(mediaKind.mimeType(fileName), content), chatOptions);
            }
            default -> throw new IllegalArgumentException("Unsupported media kind " + mediaKind);
        }
    }

    private String textPrompt(String text, String fileName) {
        StringBuilder prompt = new StringBuilder();
        prompt.append(FIELD_INSTRUCTIONS).append('\n');
        prompt.append("File name: ").append(fileName != null ? fileName : "application.txt").append('\n');
        prompt.append("<document>\n").append(text).append("\n</document>");
        return prompt.toString();
    }

    private String documentPrompt(String fileName) {
        return FIELD_INSTRUCTIONS + "\nThe application is attached. File name: "
            + (fileName != null ? fileName : "application");
    }

    static String sanitiseResponse(String response) {
        String trimmed = response.trim();
        if (trimmed.startsWith("```") && trimmed.endsWith("```") && trimmed.length() >= 6) {
            int firstBreak = trimmed.indexOf('\n');
            if (firstBreak > 0) {
                trimmed = trimmed.substring(firstBreak + 1, trimmed.length() - 3).trim();
            } else {
                trimmed = trimmed.substring(3, trimmed.length() - 3).trim();
            }
        }
        if (trimmed.length() >= 2 && trimmed.startsWith("`") && trimmed.endsWith("`")) {
            trimmed = trimmed.substring(1, trimmed.length() - 1).trim();
        }
        return trimmed;
    }

    private static String preview(String response) {
        if (response == null) {
            return "<null>";
        }
        return response.substring(0, Math.min(response.length(), PREVIEW_LENGTH));
    }

    private static final class NoTextContentException extends RuntimeException {

        private NoTextContentException() {
            super("No text content found in document");
        }
    }
}
