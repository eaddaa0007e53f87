package dev.pekelund.zuvp.permits;

import java.time.Instant;
import java.util.Objects;

/**
 * A single permit submission as seen by the pipeline.
 *
 * @param id          opaque identifier assigned when the submission is received
 * @param contentHash SHA-256 hex digest of the submitted bytes
 * @param receivedAt  time the submission entered the pipeline
 * @param fileName    sanitised original file name
 * @param mediaKind   kind of document resolved from the file name
 */
public record PermitRequest(String id, String contentHash, Instant receivedAt, String fileName, MediaKind mediaKind) {

    public PermitRequest {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(contentHash, "contentHash");
        Objects.requireNonNull(receivedAt, "receivedAt");
        Objects.requireNonNull(mediaKind, "mediaKind");
    }
}
