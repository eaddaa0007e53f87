package dev.pekelund.zuvp.drafts;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.DirectoryStream;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Stores each draft as {@code <id>.json} in a single directory.
 */
public class FileSystemDraftRepository implements DraftRepository {

    private static final Logger LOGGER = LoggerFactory.getLogger(FileSystemDraftRepository.class);
    private static final String SUFFIX = ".json";
    private static final Pattern SAFE_ID = Pattern.compile("[A-Za-z0-9][A-Za-z0-9_-]{0,127}");

    private final Path directory;
    private final ObjectMapper objectMapper;

    public FileSystemDraftRepository(Path directory, ObjectMapper objectMapper) {
        this.directory = Objects.requireNonNull(directory, "directory");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
        try {
            Files.createDirectories(directory);
        } catch (IOException ex) {
            throw new DraftStorageException("Unable to create drafts directory " + directory, ex);
        }
        LOGGER.info("FileSystemDraftRepository initialized in {}", directory.toAbsolutePath());
    }

    @Override
    public void insert(Draft draft) {
        Path target = pathFor(draft.id());
        try (OutputStream out = Files.newOutputStream(target, StandardOpenOption.CREATE_NEW,
            StandardOpenOption.WRITE)) {
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(out, draft);
        } catch (FileAlreadyExistsException ex) {
            throw new DuplicateDraftException(draft.id());
        } catch (IOException ex) {
            deleteQuietly(target);
            throw new DraftStorageException("Failed to write draft " + draft.id(), ex);
        }
    }

    @Override
    public Optional<Draft> find(String id) {
        if (id == null || !SAFE_ID.matcher(id).matches()) {
            return Optional.empty();
        }
        Path source = directory.resolve(id + SUFFIX);
        if (!Files.isRegularFile(source)) {
            return Optional.empty();
        }
        return Optional.of(read(source));
    }

    @Override
    public List<Draft> findAll() {
        List<Draft> drafts = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory, "*" + SUFFIX)) {
            for (Path file : stream) {
                drafts.add(read(file));
            }
        } catch (IOException ex) {
            throw new DraftStorageException("Failed to list drafts in " + directory, ex);
        }
        drafts.sort(Comparator.comparing(Draft::createdAt));
        return drafts;
    }

    @Override
    public void replace(Draft draft) {
        Path target = pathFor(draft.id());
        if (!Files.isRegularFile(target)) {
            throw new DraftNotFoundException(draft.id());
        }
        Path temp = directory.resolve(draft.id() + SUFFIX + ".tmp");
        try {
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), draft);
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException ex) {
            deleteQuietly(temp);
            throw new DraftStorageException("Failed to update draft " + draft.id(), ex);
        }
    }

    @Override
    public int deleteAll() {
        int removed = 0;
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory, "*" + SUFFIX)) {
            for (Path file : stream) {
                try {
                    Files.delete(file);
                    removed++;
                } catch (NoSuchFileException ex) {
                    LOGGER.debug("Draft file {} disappeared before deletion", file);
                }
            }
        } catch (IOException ex) {
            throw new DraftStorageException("Failed to delete drafts in " + directory, ex);
        }
        return removed;
    }

    private Draft read(Path file) {
        try {
            return objectMapper.readValue(file.toFile(), Draft.class);
        } catch (IOException ex) {
            throw new DraftStorageException("Failed to read draft file " + file.getFileName(), ex);
        }
    }

    private Path pathFor(String id) {
        if (id == null || !SAFE_ID.matcher(id).matches()) {
            throw new IllegalArgumentException("Draft id '" + id + "' is not a valid file name");
        }
        return directory.resolve(id + SUFFIX);
    }

    private void deleteQuietly(Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException ex) {
            LOGGER.warn("Could not remove partial draft file {}", path, ex);
        }
    }
}
