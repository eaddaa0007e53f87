package dev.pekelund.zuvp.drafts;

import java.util.List;
import java.util.Optional;

/**
 * Key-value persistence for drafts, keyed by request id. Locking and lifecycle rules live in {@link DraftStore}.
 */
public interface DraftRepository {

    /**
     * Stores a new draft.
     *
     * @throws DuplicateDraftException when a draft with the same id already exists
     */
    void insert(Draft draft);

    Optional<Draft> find(String id);

    List<Draft> findAll();

    /**
     * Overwrites an existing draft.
     *
     * @throws DraftNotFoundException when no draft with the id exists
     */
    void replace(Draft draft);

    /**
     * Removes every draft.
     *
     * @return number of drafts removed
     */
    int deleteAll();
}
