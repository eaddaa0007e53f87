package dev.pekelund.zuvp.drafts;

import com.fasterxml.jackson.annotation.JsonProperty;
import dev.pekelund.zuvp.permits.CanonicalRecord;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A rendered permit packet awaiting (or having received) clerk approval.
 *
 * @param id        request id the draft was created for
 * @param createdAt creation time
 * @param record    normalized record including fee and variable symbol
 * @param documents document type to the path of the rendered file
 * @param status    lifecycle status
 * @param approvedAt approval time, {@code null} while pending
 */
public record Draft(
    @JsonProperty("id") String id,
    @JsonProperty("created_at") Instant createdAt,
    @JsonProperty("canonical_record") CanonicalRecord record,
    @JsonProperty("document_paths") Map<String, String> documents,
    @JsonProperty("status") DraftStatus status,
    @JsonProperty("approved_at") Instant approvedAt
) {

    public Draft {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(createdAt, "createdAt");
        Objects.requireNonNull(status, "status");
        documents = documents != null
            ? Collections.unmodifiableMap(new LinkedHashMap<>(documents))
            : Map.of();
    }

    static Draft pending(String id, Instant createdAt, CanonicalRecord record, Map<String, String> documents) {
        return new Draft(id, createdAt, record, documents, DraftStatus.PENDING_APPROVAL, null);
    }

    Draft approvedAt(Instant timestamp) {
        return new Draft(id, createdAt, record, documents, DraftStatus.APPROVED, timestamp);
    }
}
