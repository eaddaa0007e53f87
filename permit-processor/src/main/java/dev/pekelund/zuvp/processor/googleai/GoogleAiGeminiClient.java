package dev.pekelund.zuvp.processor.googleai;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.micrometer.observation.Observation;
import io.micrometer.observation.ObservationRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.CollectionUtils;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/**
 * Client that invokes Google AI Studio's Gemini API using an API key.
 */
public class GoogleAiGeminiClient implements GeminiClient {

    public static final String DEFAULT_BASE_URL = "https://generativelanguage.googleapis.com/v1beta";

    private static final Logger LOGGER = LoggerFactory.getLogger(GoogleAiGeminiClient.class);

    private final RestClient restClient;
    private final String apiKey;
    private final GoogleAiGeminiChatOptions defaultOptions;
    private final ObservationRegistry observationRegistry;

    public GoogleAiGeminiClient(RestClient restClient, String apiKey, GoogleAiGeminiChatOptions defaultOptions,
        ObservationRegistry observationRegistry) {
        this.restClient = restClient;
        this.apiKey = apiKey;
        this.defaultOptions = defaultOptions != null ? defaultOptions : GoogleAiGeminiChatOptions.builder().build();
        this.observationRegistry = observationRegistry != null ? observationRegistry : ObservationRegistry.NOOP;
    }

    @Override
    public GoogleAiGeminiChatOptions getDefaultOptions() {
        return defaultOptions;
    }

    @Override
    public String generateContent(String prompt, InlineDocument document, GoogleAiGeminiChatOptions overrides) {
        if (!StringUtils.hasText(prompt)) {
            throw new IllegalArgumentException("Prompt must not be empty");
        }
        GoogleAiGeminiChatOptions resolvedOptions = defaultOptions.merge(overrides);
        Observation observation = Observation.start("google.ai.gemini.call", observationRegistry)
            .highCardinalityKeyValue("model", Optional.ofNullable(resolvedOptions.getModel()).orElse("(unset)"))
            .lowCardinalityKeyValue("inline.document", document != null ? document.mimeType() : "none");
        try (Observation.Scope scope = observation.openScope()) {
            LOGGER.info("Calling Google AI Gemini model '{}' with prompt length {} and {}", resolvedOptions.getModel(),
                prompt.length(), document != null
                    ? "inline " + document.mimeType() + " (" + document.size() + " bytes)"
                    : "no attachment");
            GenerateContentRequest request = buildRequest(prompt, document, resolvedOptions);
            GenerateContentResponse response = executeRequest(resolvedOptions.getModel(), request);
            return extractContent(response);
        } catch (RuntimeException ex) {
            observation.error(ex);
            throw ex;
        } finally {
            observation.stop();
        }
    }

    private GenerateContentRequest buildRequest(String promptText, InlineDocument document,
        GoogleAiGeminiChatOptions options) {
        List<GenerateContentRequest.Part> parts = new ArrayList<>();
        parts.add(GenerateContentRequest.Part.text(promptText));
        if (document != null) {
            parts.add(GenerateContentRequest.Part.inline(document.mimeType(), document.base64Data()));
        }
        GenerateContentRequest.Content content = new GenerateContentRequest.Content("user", parts);
        GenerateContentRequest.GenerationConfig generationConfig = new GenerateContentRequest.GenerationConfig(
            options.getTemperature(), options.getTopP(), options.getTopK(), options.getMaxOutputTokens(),
            options.getResponseMimeType());
        return new GenerateContentRequest(List.of(content), generationConfig);
    }

    private GenerateContentResponse executeRequest(String model, GenerateContentRequest request) {
        String modelName = StringUtils.hasText(model) ? model : defaultOptions.getModel();
        if (!StringUtils.hasText(modelName)) {
            throw new IllegalStateException("Gemini model name must be configured");
        }
        try {
            return restClient.post()
                .uri(uriBuilder -> uriBuilder
                    .path("/models/{model}:generateContent")
                    .queryParam("key", apiKey)
                    .build(modelName))
                .body(request)
                .retrieve()
                .body(GenerateContentResponse.class);
        } catch (RestClientException ex) {
            throw new IllegalStateException("Google AI Gemini request failed", ex);
        }
    }

    private String extractContent(GenerateContentResponse response) {
        if (response == null || CollectionUtils.isEmpty(response.candidates())) {
            throw new IllegalStateException("Gemini response did not contain any candidates");
        }
        return response.candidates().stream()
            .filter(candidate -> candidate != null && candidate.content() != null)
            .flatMap(candidate -> {
                List<GenerateContentResponse.Part> parts = candidate.content().parts();
                return parts != null ? parts.stream() : List.<GenerateContentResponse.Part>of().stream();
            })
            .map(GenerateContentResponse.Part::text)
            .filter(StringUtils::hasText)
            .findFirst()
            .orElseThrow(() -> new IllegalStateException("Gemini response did not contain any text parts"));
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    private record GenerateContentRequest(List<Content> contents, GenerationConfig generationConfig) {

        private record Content(String role, List<Part> parts) {
        }

        @JsonInclude(JsonInclude.Include.NON_NULL)
        private record Part(String text, InlineData inlineData) {

            static Part text(String text) {
                return new Part(text, null);
            }

            static Part inline(String mimeType, String base64Data) {
                return new Part(null, new InlineData(mimeType, base64Data));
            }
        }

        private record InlineData(String mimeType, String data) {
        }

        @JsonInclude(JsonInclude.Include.NON_NULL)
        private record GenerationConfig(Double temperature, Double topP, Integer topK, Integer maxOutputTokens,
            String responseMimeType) {
        }
    }

    private record GenerateContentResponse(List<Candidate> candidates) {

        private record Candidate(Content content) {
        }

        private record Content(List<Part> parts) {
        }

        private record Part(String text) {
        }
    }
}
