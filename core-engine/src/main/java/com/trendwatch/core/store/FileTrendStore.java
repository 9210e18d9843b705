package com.trendwatch.core.store;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link TrendStore} keeping one JSON document per subsystem under a base
 * directory ({@code <dir>/<subsystem>.json}, the subsystem name
 * percent-encoded so that {@code /} and other reserved characters never
 * alias another subsystem's record).
 *
 * <h3>Atomic commit</h3>
 * <ol>
 * <li>Serialize the snapshot to {@code <subsystem>.json.tmp}</li>
 * <li>Rename it over {@code <subsystem>.json} with
 * {@link StandardCopyOption#ATOMIC_MOVE}</li>
 * </ol>
 * <p>
 * An interrupted commit leaves at most a stale temp file; the previous
 * record stays intact. File systems without atomic rename are rejected
 * rather than silently degraded.
 * </p>
 *
 * @since 1.0.0
 */
public class FileTrendStore implements TrendStore {

    private static final Logger LOG = LoggerFactory.getLogger(FileTrendStore.class);

    private static final String SUFFIX = ".json";
    private static final String TEMP_SUFFIX = ".tmp";

    private final Path directory;
    private final ObjectMapper mapper;

    /**
     * @param directory base directory; created on first commit
     */
    public FileTrendStore(Path directory) {
        this.directory = Objects.requireNonNull(directory, "Store directory must not be null");
        this.mapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false)
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    @Override
    public void commit(String subsystemName, RegistrySnapshot snapshot) throws PersistenceException {
        Objects.requireNonNull(snapshot, "snapshot must not be null");
        Path target = recordPath(subsystemName);
        Path temp = target.resolveSibling(target.getFileName() + TEMP_SUFFIX);
        try {
            Files.createDirectories(directory);
            Files.write(temp, mapper.writeValueAsBytes(snapshot));
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            deleteQuietly(temp);
            throw new PersistenceException("Atomic rename not supported for store " + directory, e);
        } catch (IOException e) {
            deleteQuietly(temp);
            throw new PersistenceException("Failed to commit subsystem '" + subsystemName + "' to " + target, e);
        }
        LOG.debug("Committed {} trend(s) of subsystem [{}] to {}",
                snapshot.getTrends().size(), subsystemName, target);
    }

    @Override
    public Optional<RegistrySnapshot> load(String subsystemName) throws PersistenceException {
        Path path = recordPath(subsystemName);
        if (!Files.exists(path)) {
            return Optional.empty();
        }
        try {
            return Optional.of(mapper.readValue(path.toFile(), RegistrySnapshot.class));
        } catch (IOException e) {
            throw new PersistenceException("Failed to read subsystem '" + subsystemName + "' from " + path, e);
        }
    }

    public Path getDirectory() {
        return directory;
    }

    private Path recordPath(String subsystemName) {
        Objects.requireNonNull(subsystemName, "subsystemName must not be null");
        if (subsystemName.isBlank()) {
            throw new IllegalArgumentException("subsystemName must not be blank");
        }
        // percent-encoding keeps distinct subsystems ("a/b", "a_b") in distinct files
        return directory.resolve(URLEncoder.encode(subsystemName, StandardCharsets.UTF_8) + SUFFIX);
    }

    private static void deleteQuietly(Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            LOG.warn("Could not remove temporary store file {}: {}", path, e.getMessage());
        }
    }
}
