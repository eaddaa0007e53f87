package dev.pekelund.zuvp.drafts;

import dev.pekelund.zuvp.permits.CanonicalRecord;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Creates drafts and moves them through their lifecycle ({@code pending_approval → approved}).
 *
 * <p>Writes for the same id are serialized through a fixed set of striped locks, so unrelated ids rarely
 * contend and no per-id state outlives a call. Approving an already approved draft
 * is a no-op that returns the draft with its original approval timestamp.
 */
public class DraftStore {

    private static final Logger LOGGER = LoggerFactory.getLogger(DraftStore.class);

    static final int LOCK_STRIPES = 64;

    private final DraftRepository repository;
    private final Clock clock;
    private final Object[] locks;

    public DraftStore(DraftRepository repository, Clock clock) {
        this.repository = Objects.requireNonNull(repository, "repository");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.locks = new Object[LOCK_STRIPES];
        for (int i = 0; i < LOCK_STRIPES; i++) {
            locks[i] = new Object();
        }
    }

    public Draft create(String id, CanonicalRecord record, Map<String, Path> documents) {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(record, "record");
        Map<String, String> paths = new LinkedHashMap<>();
        for (String documentType : DraftDocuments.REQUIRED) {
            Path path = documents != null ? documents.get(documentType) : null;
            if (path == null) {
                throw new IllegalArgumentException("Draft " + id + " is missing the '" + documentType + "' document");
            }
        }
        documents.forEach((type, path) -> {
            if (type == null || path == null) {
                throw new IllegalArgumentException("Draft " + id + " has an incomplete document entry: "
                    + type + " -> " + path);
            }
            paths.put(type, path.toString());
        });

        synchronized (lockFor(id)) {
            Draft draft = Draft.pending(id, Instant.now(clock), record, paths);
            repository.insert(draft);
            LOGGER.info("Draft {} created with documents {}", id, paths.keySet());
            return draft;
        }
    }

    public Draft approve(String id) {
        synchronized (lockFor(id)) {
            Draft draft = repository.find(id).orElseThrow(() -> new DraftNotFoundException(id));
            if (draft.status() == DraftStatus.APPROVED) {
                LOGGER.info("Draft {} was already approved at {}; leaving it unchanged", id, draft.approvedAt());
                return draft;
            }
            Draft approved = draft.approvedAt(Instant.now(clock));
            repository.replace(approved);
            LOGGER.info("Draft {} approved", id);
            return approved;
        }
    }

    public Optional<Draft> get(String id) {
        return repository.find(id);
    }

    public List<Draft> listAll() {
        return repository.findAll();
    }

    public int deleteAll() {
        int removed = repository.deleteAll();
        LOGGER.info("Purged {} drafts", removed);
        return removed;
    }

    public Path getDocumentPath(String id, String documentType) {
        Draft draft = repository.find(id).orElseThrow(() -> new DraftNotFoundException(id));
        String path = draft.documents().get(documentType);
        if (path == null) {
            throw new DraftNotFoundException(id, "Document type " + documentType + " not found for draft " + id);
        }
        return Path.of(path);
    }

    Object lockFor(String id) {
        return locks[Math.floorMod(id.hashCode(), LOCK_STRIPES)];
    }
}
