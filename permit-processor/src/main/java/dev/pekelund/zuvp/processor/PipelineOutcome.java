package dev.pekelund.zuvp.processor;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import dev.pekelund.zuvp.drafts.Draft;
import dev.pekelund.zuvp.permits.CanonicalRecord;
import dev.pekelund.zuvp.permits.ValidationResult;
import java.util.Objects;

/**
 * Result of running one submission through {@link PermitPipeline}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PipelineOutcome(
    @JsonProperty("request_id") String requestId,
    @JsonProperty("status") Status status,
    @JsonProperty("message") String message,
    @JsonProperty("validation") ValidationResult validation,
    @JsonProperty("extracted_data") CanonicalRecord record,
    @JsonProperty("draft") Draft draft
) {

    public enum Status {
        @JsonProperty("draft_created")
        DRAFT_CREATED,
        @JsonProperty("validation_failed")
        VALIDATION_FAILED,
        @JsonProperty("incomplete_data")
        INCOMPLETE_DATA
    }

    public PipelineOutcome {
        Objects.requireNonNull(requestId, "requestId");
        Objects.requireNonNull(status, "status");
    }

    static PipelineOutcome rejected(String requestId, ValidationResult validation) {
        return new PipelineOutcome(requestId, Status.VALIDATION_FAILED, validation.message(), validation, null, null);
    }

    static PipelineOutcome incomplete(String requestId, ValidationResult validation, CanonicalRecord record) {
        return new PipelineOutcome(requestId, Status.INCOMPLETE_DATA, validation.message(), validation, record, null);
    }

    static PipelineOutcome drafted(String requestId, ValidationResult validation, Draft draft) {
        return new PipelineOutcome(requestId, Status.DRAFT_CREATED, validation.message(), validation, draft.record(),
            draft);
    }
}
