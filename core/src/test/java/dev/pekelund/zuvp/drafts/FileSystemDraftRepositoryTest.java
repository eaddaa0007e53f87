package dev.pekelund.zuvp.drafts;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import dev.pekelund.zuvp.permits.PermitFixtures;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FileSystemDraftRepositoryTest {

    @TempDir
    Path directory;

    private FileSystemDraftRepository repository;

    @BeforeEach
    void setUp() {
        ObjectMapper objectMapper = new ObjectMapper();
        objectMapper.findAndRegisterModules();
        objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        repository = new FileSystemDraftRepository(directory, objectMapper);
    }

    @Test
    void storesOneJsonFilePerDraft() throws Exception {
        Draft draft = pending("a1b2c3", Instant.parse("2025-07-01T08:00:00Z"));

        repository.insert(draft);

        Path file = directory.resolve("a1b2c3.json");
        assertThat(file).exists();
        assertThat(Files.readString(file))
            .contains("\"status\" : \"pending_approval\"")
            .contains("\"canonical_record\"")
            .contains("\"document_paths\"");
        assertThat(repository.find("a1b2c3")).contains(draft);
    }

    @Test
    void insertRefusesToOverwrite() {
        repository.insert(pending("dup", Instant.parse("2025-07-01T08:00:00Z")));

        assertThatThrownBy(() -> repository.insert(pending("dup", Instant.parse("2025-07-02T08:00:00Z"))))
            .isInstanceOf(DuplicateDraftException.class);
    }

    @Test
    void replaceUpdatesExistingDraft() {
        Draft draft = pending("r1", Instant.parse("2025-07-01T08:00:00Z"));
        repository.insert(draft);

        Draft approved = draft.approvedAt(Instant.parse("2025-07-01T09:00:00Z"));
        repository.replace(approved);

        assertThat(repository.find("r1")).contains(approved);
        assertThat(directory.resolve("r1.json.tmp")).doesNotExist();
    }

    @Test
    void replaceOfUnknownDraftFails() {
        assertThatThrownBy(() -> repository.replace(pending("ghost", Instant.now())))
            .isInstanceOf(DraftNotFoundException.class);
    }

    @Test
    void findAllIsOrderedByCreationTime() {
        repository.insert(pending("later", Instant.parse("2025-07-03T08:00:00Z")));
        repository.insert(pending("earlier", Instant.parse("2025-07-01T08:00:00Z")));

        assertThat(repository.findAll()).extracting(Draft::id).containsExactly("earlier", "later");
    }

    @Test
    void findIgnoresIdsThatAreNotFileNames() {
        assertThat(repository.find("../etc/passwd")).isEmpty();
        assertThat(repository.find("unknown")).isEmpty();
    }

    @Test
    void deleteAllRemovesDraftFiles() {
        repository.insert(pending("d1", Instant.parse("2025-07-01T08:00:00Z")));
        repository.insert(pending("d2", Instant.parse("2025-07-02T08:00:00Z")));

        assertThat(repository.deleteAll()).isEqualTo(2);
        assertThat(repository.findAll()).isEmpty();
    }

    private static Draft pending(String id, Instant createdAt) {
        return Draft.pending(id, createdAt, PermitFixtures.chargedRecord(), Map.of(
            DraftDocuments.CONSENT, "output/consent_" + id + ".pdf",
            DraftDocuments.PAYMENT, "output/payment_" + id + ".pdf"));
    }
}
