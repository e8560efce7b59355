package com.newsrelay.service.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.newsrelay.core.model.Article;
import com.newsrelay.core.model.DedupRecord;
import com.newsrelay.core.util.JsonUtils;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link DedupStore} persisted as one pretty-printed JSON snapshot. Before each write the
 * previous snapshot is copied to {@code <file>.backup}; the new one is written to a temp
 * file and moved into place.
 *
 * <p>Memory is authoritative: a failed write is logged and retried with the next commit
 * or {@link #flush()}.
 */
public class JsonFileDedupStore implements DedupStore {
    private static final Logger LOGGER = Logger.getLogger(JsonFileDedupStore.class.getName());
    private static final ObjectMapper MAPPER = JsonUtils.objectMapper();

    private final Path file;
    private final Path backupFile;
    private final Path tempFile;
    private final int maxSize;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, DedupRecord> records = new LinkedHashMap<>();

    public JsonFileDedupStore(Path file, int maxSize, Clock clock) {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be positive");
        }
        this.file = file;
        this.backupFile = file.resolveSibling(file.getFileName() + ".backup");
        this.tempFile = file.resolveSibling(file.getFileName() + ".tmp");
        this.maxSize = maxSize;
        this.clock = clock;
        load();
    }

    @Override
    public boolean contains(String articleId) {
        lock.lock();
        try {
            return records.containsKey(articleId);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean commit(Article article) {
        lock.lock();
        try {
            if (records.containsKey(article.id())) {
                return false;
            }
            records.put(article.id(), DedupRecord.committed(article, clock.instant()));
            evictOverflow();
            try {
                persist();
            } catch (StoreException e) {
                LOGGER.log(Level.WARNING, "Dedup store write failed; keeping in-memory state", e);
            }
            return true;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int size() {
        lock.lock();
        try {
            return records.size();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int maxSize() {
        return maxSize;
    }

    @Override
    public List<DedupRecord> records() {
        lock.lock();
        try {
            return List.copyOf(records.values());
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void flush() {
        lock.lock();
        try {
            persist();
        } finally {
            lock.unlock();
        }
    }

    public Path file() {
        return file;
    }

    private void evictOverflow() {
        while (records.size() > maxSize) {
            DedupRecord oldest = records.values().stream()
                    .min(Comparator.comparing(DedupRecord::firstSeenAt, Comparator.nullsFirst(Comparator.naturalOrder())))
                    .orElseThrow();
            records.remove(oldest.id());
        }
    }

    private void load() {
        lock.lock();
        try {
            if (!Files.exists(file)) {
                return;
            }
            List<DedupRecord> loaded;
            try {
                loaded = readSnapshot(file);
            } catch (IOException | RuntimeException e) {
                LOGGER.log(Level.WARNING, "Dedup store " + file + " is unreadable; trying " + backupFile, e);
                loaded = readBackup();
            }
            loaded.stream()
                    .filter(record -> record.id() != null)
                    .sorted(Comparator.comparing(DedupRecord::firstSeenAt, Comparator.nullsFirst(Comparator.naturalOrder())))
                    .forEach(record -> records.put(record.id(), record));
            evictOverflow();
            LOGGER.info("Loaded " + records.size() + " dedup records from " + file);
        } finally {
            lock.unlock();
        }
    }

    private List<DedupRecord> readBackup() {
        if (!Files.exists(backupFile)) {
            LOGGER.warning("No dedup backup found; starting with an empty store");
            return List.of();
        }
        try {
            return readSnapshot(backupFile);
        } catch (IOException | RuntimeException e) {
            LOGGER.log(Level.WARNING, "Dedup backup " + backupFile + " is unreadable; starting with an empty store", e);
            return List.of();
        }
    }

    private static List<DedupRecord> readSnapshot(Path path) throws IOException {
        try (InputStream in = Files.newInputStream(path)) {
            StoreSnapshot snapshot = MAPPER.readValue(in, StoreSnapshot.class);
            if (snapshot == null || snapshot.records() == null) {
                throw new IOException("Snapshot without records: " + path);
            }
            return snapshot.records();
        }
    }

    private void persist() {
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            if (Files.exists(file)) {
                Files.copy(file, backupFile, StandardCopyOption.REPLACE_EXISTING);
            }
            try (OutputStream out = Files.newOutputStream(tempFile)) {
                MAPPER.writerWithDefaultPrettyPrinter().writeValue(out,
                        new StoreSnapshot(new ArrayList<>(records.values()), clock.instant()));
            }
            try {
                Files.move(tempFile, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tempFile, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new StoreException("Failed writing dedup store to " + file, e);
        }
    }

    public record StoreSnapshot(List<DedupRecord> records, Instant lastUpdated) {
    }
}
