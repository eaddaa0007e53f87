package dev.pekelund.zuvp.processor.ingestion;

import java.util.Objects;

/**
 * A document as handed to the pipeline by an entry point (upload or watched folder).
 */
public final class SubmittedDocument {

    private final String fileName;
    private final byte[] content;

    public SubmittedDocument(String fileName, byte[] content) {
        this.fileName = fileName;
        this.content = Objects.requireNonNull(content, "content").clone();
    }

    public String fileName() {
        return fileName;
    }

    public byte[] content() {
        return content.clone();
    }

    public int size() {
        return content.length;
    }

    @Override
    public String toString() {
        return "SubmittedDocument{fileName='" + fileName + "', size=" + content.length + '}';
    }
}
