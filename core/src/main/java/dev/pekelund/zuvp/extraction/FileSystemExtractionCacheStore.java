package dev.pekelund.zuvp.extraction;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.pekelund.zuvp.permits.ExtractionResult;
import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Keeps one JSON file per content hash. Unreadable entries are discarded and reported as misses.
 */
public class FileSystemExtractionCacheStore implements ExtractionCacheStore {

    private static final Logger LOGGER = LoggerFactory.getLogger(FileSystemExtractionCacheStore.class);
    private static final Pattern HASH = Pattern.compile("[0-9a-f]{16,128}");

    private final Path directory;
    private final ObjectMapper objectMapper;

    public FileSystemExtractionCacheStore(Path directory, ObjectMapper objectMapper) {
        this.directory = Objects.requireNonNull(directory, "directory");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
        try {
            Files.createDirectories(directory);
        } catch (IOException ex) {
            throw new ExtractionCacheException("Unable to create extraction cache directory " + directory, ex);
        }
    }

    @Override
    public Optional<ExtractionResult> load(String contentHash) {
        Path entry = entryFor(contentHash);
        if (!Files.isRegularFile(entry)) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(entry.toFile(), ExtractionResult.class));
        } catch (IOException ex) {
            LOGGER.warn("Discarding unreadable extraction cache entry {}: {}", entry.getFileName(), ex.getMessage());
            try {
                Files.deleteIfExists(entry);
            } catch (IOException deleteEx) {
                LOGGER.warn("Could not delete unreadable cache entry {}", entry, deleteEx);
            }
            return Optional.empty();
        }
    }

    @Override
    public void save(String contentHash, ExtractionResult result) {
        Path entry = entryFor(contentHash);
        Path temp = directory.resolve(contentHash + ".json.tmp");
        try {
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), result);
            Files.move(temp, entry, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException ex) {
            throw new ExtractionCacheException("Failed to write extraction cache entry " + entry.getFileName(), ex);
        }
    }

    @Override
    public int clear() {
        int removed = 0;
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory)) {
            for (Path file : stream) {
                if (Files.isRegularFile(file) && Files.deleteIfExists(file)) {
                    removed++;
                }
            }
        } catch (IOException ex) {
            throw new ExtractionCacheException("Failed to clear extraction cache in " + directory, ex);
        }
        return removed;
    }

    private Path entryFor(String contentHash) {
        if (contentHash == null || !HASH.matcher(contentHash).matches()) {
            throw new IllegalArgumentException("Content hash '" + contentHash + "' is not a hex digest");
        }
        return directory.resolve(contentHash + ".json");
    }
}
