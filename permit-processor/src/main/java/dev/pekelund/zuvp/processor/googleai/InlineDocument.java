package dev.pekelund.zuvp.processor.googleai;

import java.util.Base64;
import java.util.Objects;

/**
 * Binary document sent to Gemini alongside the prompt (a scanned PDF or an image).
 */
public final class InlineDocument {

    private final String mimeType;
    private final byte[] data;

    public InlineDocument(String mimeType, byte[] data) {
        this.mimeType = Objects.requireNonNull(mimeType, "mimeType");
        this.data = Objects.requireNonNull(data, "data").clone();
    }

    public String mimeType() {
        return mimeType;
    }

    public int size() {
        return data.length;
    }

    String base64Data() {
        return Base64.getEncoder().encodeToString(data);
    }
}
