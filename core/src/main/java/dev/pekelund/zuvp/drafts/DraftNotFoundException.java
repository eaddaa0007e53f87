package dev.pekelund.zuvp.drafts;

/**
 * Thrown when a draft, or a document of a draft, does not exist.
 */
public class DraftNotFoundException extends RuntimeException {

    private final String draftId;

    public DraftNotFoundException(String draftId) {
        this(draftId, "Draft " + draftId + " not found");
    }

    public DraftNotFoundException(String draftId, String message) {
        super(message);
        this.draftId = draftId;
    }

    public String getDraftId() {
        return draftId;
    }
}
