package dev.pekelund.zuvp.processor.googleai;

/**
 * Minimal client interface for invoking Google AI Studio's Gemini API.
 */
public interface GeminiClient {

    /**
     * @return the default chat options configured for the client.
     */
    GoogleAiGeminiChatOptions getDefaultOptions();

    /**
     * Generates text using Gemini for the provided prompt and optional overrides.
     *
     * @param prompt the prompt to send to the model
     * @param overrides optional overrides for the default chat options; may be {@code null}
     * @return the generated text response from Gemini
     */
    default String generateContent(String prompt, GoogleAiGeminiChatOptions overrides) {
        return generateContent(prompt, null, overrides);
    }

    /**
     * Generates text for a prompt that refers to an attached document.
     *
     * @param prompt the prompt to send to the model
     * @param document document to attach inline; may be {@code null}
     * @param overrides optional overrides for the default chat options; may be {@code null}
     * @return the generated text response from Gemini
     */
    String generateContent(String prompt, InlineDocument document, GoogleAiGeminiChatOptions overrides);
}
