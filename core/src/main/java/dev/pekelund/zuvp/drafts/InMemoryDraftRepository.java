package dev.pekelund.zuvp.drafts;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

public class InMemoryDraftRepository implements DraftRepository {

    private final ConcurrentMap<String, Draft> drafts = new ConcurrentHashMap<>();

    @Override
    public void insert(Draft draft) {
        if (drafts.putIfAbsent(draft.id(), draft) != null) {
            throw new DuplicateDraftException(draft.id());
        }
    }

    @Override
    public Optional<Draft> find(String id) {
        return id == null ? Optional.empty() : Optional.ofNullable(drafts.get(id));
    }

    @Override
    public List<Draft> findAll() {
        List<Draft> all = new ArrayList<>(drafts.values());
        all.sort(Comparator.comparing(Draft::createdAt));
        return all;
    }

    @Override
    public void replace(Draft draft) {
        if (drafts.replace(draft.id(), draft) == null) {
            throw new DraftNotFoundException(draft.id());
        }
    }

    @Override
    public int deleteAll() {
        int removed = drafts.size();
        drafts.clear();
        return removed;
    }
}
