package net.spookly.ringprobe.cache;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import net.spookly.ringprobe.node.VantagePoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Persists registry snapshots as JSON. A save writes and fsyncs a temp file in the target
 * directory, then renames it over the previous snapshot, so the file on disk is always a complete
 * snapshot.
 */
public final class CacheStore {
    private static final Logger log = LoggerFactory.getLogger(CacheStore.class);

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .configure(SerializationFeature.INDENT_OUTPUT, true);

    private final Path path;
    private final Clock clock;
    private long lastVersion;

    public CacheStore(Path path) {
        this(path, Clock.systemUTC());
    }

    public CacheStore(Path path, Clock clock) {
        this.path = Objects.requireNonNull(path, "path").toAbsolutePath();
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public Path path() {
        return path;
    }

    /**
     * Build a snapshot whose version is later than any this store produced or loaded.
     */
    public synchronized RegistrySnapshot snapshotOf(List<VantagePoint> points) {
        long version = Math.max(clock.millis(), lastVersion + 1);
        lastVersion = version;
        return RegistrySnapshot.of(version, points);
    }

    /**
     * Write the snapshot atomically.
     *
     * @throws StorageWriteException when the snapshot could not be written or moved into place
     */
    public synchronized void save(RegistrySnapshot snapshot) {
        Objects.requireNonNull(snapshot, "snapshot");
        Path directory = path.getParent();
        Path temp = null;
        try {
            byte[] payload = MAPPER.writeValueAsBytes(snapshot);
            Files.createDirectories(directory);
            temp = Files.createTempFile(directory, path.getFileName().toString() + ".", ".tmp");
            try (FileChannel channel = FileChannel.open(temp, StandardOpenOption.WRITE,
                    StandardOpenOption.TRUNCATE_EXISTING)) {
                ByteBuffer buffer = ByteBuffer.wrap(payload);
                while (buffer.hasRemaining()) {
                    channel.write(buffer);
                }
                channel.force(true);
            }
            move(temp, path);
            temp = null;
            lastVersion = Math.max(lastVersion, snapshot.version);
            log.debug("Saved registry snapshot v{} with {} points to {}",
                    snapshot.version, snapshot.points == null ? 0 : snapshot.points.size(), path);
        } catch (IOException e) {
            throw new StorageWriteException("Failed to write registry snapshot to " + path, e);
        } finally {
            if (temp != null) {
                deleteQuietly(temp);
            }
        }
    }

    /**
     * Load the last complete snapshot. Missing, unreadable or corrupt files yield empty.
     */
    public synchronized Optional<RegistrySnapshot> load() {
        byte[] payload;
        try {
            payload = Files.readAllBytes(path);
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            log.warn("Failed to read registry snapshot {}: {}", path, e.getMessage());
            return Optional.empty();
        }
        RegistrySnapshot snapshot;
        try {
            snapshot = MAPPER.readValue(payload, RegistrySnapshot.class);
        } catch (JsonProcessingException e) {
            log.warn("Ignoring corrupt registry snapshot {}: {}", path, e.getOriginalMessage());
            return Optional.empty();
        } catch (IOException e) {
            log.warn("Failed to parse registry snapshot {}: {}", path, e.getMessage());
            return Optional.empty();
        }
        if (snapshot == null || snapshot.points == null || !wellFormed(snapshot)) {
            log.warn("Ignoring incomplete registry snapshot {}", path);
            return Optional.empty();
        }
        lastVersion = Math.max(lastVersion, snapshot.version);
        return Optional.of(snapshot);
    }

    private static boolean wellFormed(RegistrySnapshot snapshot) {
        for (RegistrySnapshot.PointRecord record : snapshot.points) {
            if (record == null || record.id == null || record.id.isBlank()) {
                return false;
            }
        }
        return true;
    }

    private static void move(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void deleteQuietly(Path temp) {
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            log.debug("Failed to remove temp snapshot {}: {}", temp, e.getMessage());
        }
    }
}
