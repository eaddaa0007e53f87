package dev.pekelund.zuvp.drafts;

/**
 * Thrown when a draft is created for an id that already has one. Ids are generated per request, so this
 * indicates a programming error rather than a business condition.
 */
public class DuplicateDraftException extends DraftStorageException {

    private final String draftId;

    public DuplicateDraftException(String draftId) {
        super("Draft " + draftId + " already exists");
        this.draftId = draftId;
    }

    public String getDraftId() {
        return draftId;
    }
}
