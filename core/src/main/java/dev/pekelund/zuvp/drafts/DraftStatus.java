package dev.pekelund.zuvp.drafts;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum DraftStatus {

    @JsonProperty("pending_approval")
    PENDING_APPROVAL,

    @JsonProperty("approved")
    APPROVED
}
