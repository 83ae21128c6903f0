package com.usageprofile.counter.checkpoint;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.usageprofile.counter.aggregate.AggregateSerializer;
import com.usageprofile.counter.aggregate.PartialAggregate;
import com.usageprofile.counter.config.ConfigException;

import java.io.IOException;
import java.io.Reader;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;
import java.nio.charset.StandardCharsets;
import java.nio.file.*;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Stream;

/**
 * Directory of per-file checkpoint records, one JSON document per source file.
 *
 * Records are replaced by writing a temporary file, forcing it to disk, renaming it
 * over the previous record and forcing the directory, so a record is either the old or
 * the new version after a crash. Writes to the same source path are serialized; writes to different paths run
 * concurrently. The directory is locked for as long as the store is open.
 */
public class CheckpointStore implements AutoCloseable {

    static final String LOCK_FILE = ".store.lock";
    private static final String RECORD_SUFFIX = ".json";
    private static final String TEMP_SUFFIX = ".tmp";

    public static class CheckpointWriteException extends RuntimeException {
        public CheckpointWriteException(String msg, Throwable cause) { super(msg, cause); }
    }

    /** A valid stored record. */
    public record StoredFile(String path, String fingerprint, FileStatus status, PartialAggregate aggregate) {}

    private final Path directory;
    private final String analysisKey;
    private final int writeAttempts;
    private final FileChannel lockChannel;
    private final FileLock lock;
    private final Map<String, Object> pathLocks = new ConcurrentHashMap<>();
    private final AtomicBoolean directorySync = new AtomicBoolean(true);
    private final AggregateSerializer aggregates = new AggregateSerializer();
    private final Gson gson = new GsonBuilder().setPrettyPrinting().create();

    private CheckpointStore(Path directory, String analysisKey, int writeAttempts,
                            FileChannel lockChannel, FileLock lock) {
        this.directory = directory;
        this.analysisKey = analysisKey;
        this.writeAttempts = writeAttempts;
        this.lockChannel = lockChannel;
        this.lock = lock;
    }

    /**
     * Opens (creating if needed) and locks a checkpoint directory.
     *
     * @param analysisKey   key of the current analysis; records made under another key are
     *                      not reused. Null accepts records of any key (checkpoint merge).
     * @param writeAttempts attempts per record write before giving up
     * @throws ConfigException if the directory cannot be created or is locked by another run
     */
    public static CheckpointStore open(Path directory, String analysisKey, int writeAttempts) {
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new ConfigException("Could not create checkpoint directory: " + directory, e);
        }
        Path lockPath = directory.resolve(LOCK_FILE);
        FileChannel channel;
        try {
            channel = FileChannel.open(lockPath, StandardOpenOption.CREATE, StandardOpenOption.WRITE);
        } catch (IOException e) {
            throw new ConfigException("Could not open checkpoint lock " + lockPath + ": " + e.getMessage(), e);
        }
        FileLock lock;
        try {
            lock = channel.tryLock();
        } catch (OverlappingFileLockException | IOException e) {
            closeQuietly(channel);
            throw new ConfigException("Checkpoint directory is already in use: " + directory, e);
        }
        if (lock == null) {
            closeQuietly(channel);
            throw new ConfigException("Checkpoint directory is already in use: " + directory);
        }
        return new CheckpointStore(directory, analysisKey, Math.max(1, writeAttempts), channel, lock);
    }

    /**
     * Durably records the outcome of analyzing {@code path}, replacing any earlier record.
     *
     * @throws CheckpointWriteException when every write attempt failed
     */
    public void recordProcessed(String path, String fingerprint, FileStatus status, PartialAggregate aggregate) {
        CheckpointRecord record = new CheckpointRecord();
        record.formatVersion = CheckpointRecord.FORMAT_VERSION;
        record.path = path;
        record.fingerprint = fingerprint;
        record.analysisKey = analysisKey;
        record.processed = true;
        record.status = status;
        record.aggregate = aggregates.toDocument(aggregate);
        byte[] bytes = gson.toJson(record).getBytes(StandardCharsets.UTF_8);

        synchronized (pathLocks.computeIfAbsent(path, k -> new Object())) {
            IOException last = null;
            for (int attempt = 1; attempt <= writeAttempts; attempt++) {
                try {
                    writeAtomically(recordPath(path), bytes);
                    return;
                } catch (IOException e) {
                    last = e;
                    System.err.println("[usage-counter] WARNING: checkpoint write for " + path
                            + " failed (attempt " + attempt + "/" + writeAttempts + "): " + e.getMessage());
                }
            }
            throw new CheckpointWriteException("Could not write checkpoint for " + path + " after "
                    + writeAttempts + " attempts", last);
        }
    }

    /** True if a valid record for {@code path} exists with this fingerprint and analysis key. */
    public boolean isProcessed(String path, String fingerprint) {
        return lookup(path, fingerprint).isPresent();
    }

    /** Stored result for {@code path}, if it was recorded for this content and analysis key. */
    public Optional<StoredFile> lookup(String path, String fingerprint) {
        Path file = recordPath(path);
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        return readRecord(file)
                .filter(r -> r.path().equals(path) && r.fingerprint().equals(fingerprint));
    }

    /** Every valid record in the directory, sorted by source path. */
    public List<StoredFile> loadAll() {
        List<StoredFile> result = new ArrayList<>();
        try (Stream<Path> files = Files.list(directory)) {
            files.filter(f -> f.getFileName().toString().endsWith(RECORD_SUFFIX))
                 .sorted()
                 .forEach(f -> readRecord(f).ifPresent(result::add));
        } catch (IOException e) {
            throw new ConfigException("Could not list checkpoint directory " + directory + ": " + e.getMessage(), e);
        }
        result.sort(Comparator.comparing(StoredFile::path));
        return result;
    }

    Path recordPath(String path) {
        return directory.resolve(Fingerprints.sha256Hex(path) + RECORD_SUFFIX);
    }

    private Optional<StoredFile> readRecord(Path file) {
        CheckpointRecord record;
        try (Reader r = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            record = gson.fromJson(r, CheckpointRecord.class);
        } catch (IOException | JsonParseException e) {
            System.err.println("[usage-counter] WARNING: ignoring unreadable checkpoint " + file + ": " + e.getMessage());
            return Optional.empty();
        }
        if (record == null || record.formatVersion != CheckpointRecord.FORMAT_VERSION
                || record.path == null || record.fingerprint == null
                || record.status == null || record.aggregate == null) {
            System.err.println("[usage-counter] WARNING: ignoring malformed checkpoint " + file);
            return Optional.empty();
        }
        if (!record.processed) {
            return Optional.empty();
        }
        if (analysisKey != null && !analysisKey.equals(record.analysisKey)) {
            return Optional.empty();
        }
        PartialAggregate aggregate;
        try {
            aggregate = aggregates.fromDocument(record.aggregate);
        } catch (IllegalArgumentException e) {
            System.err.println("[usage-counter] WARNING: ignoring corrupt checkpoint " + file + ": " + e.getMessage());
            return Optional.empty();
        }
        return Optional.of(new StoredFile(record.path, record.fingerprint, record.status, aggregate));
    }

    private void writeAtomically(Path target, byte[] bytes) throws IOException {
        Path tmp = target.resolveSibling(target.getFileName() + TEMP_SUFFIX);
        try (FileChannel ch = FileChannel.open(tmp, StandardOpenOption.CREATE,
                StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE)) {
            ByteBuffer buf = ByteBuffer.wrap(bytes);
            while (buf.hasRemaining()) {
                ch.write(buf);
            }
            ch.force(true);
        }
        try {
            Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
        }
        forceDirectory();
    }

    /**
     * Flushes the directory entry of a renamed record. Platforms that cannot open a directory
     * as a channel are warned about once; the record itself is already on disk.
     */
    private void forceDirectory() {
        if (!directorySync.get()) {
            return;
        }
        try (FileChannel dir = FileChannel.open(directory, StandardOpenOption.READ)) {
            dir.force(true);
        } catch (IOException e) {
            if (directorySync.compareAndSet(true, false)) {
                System.err.println("[usage-counter] WARNING: cannot sync checkpoint directory " + directory
                        + ", renamed records may be lost on power failure: " + e.getMessage());
            }
        }
    }

    @Override
    public void close() {
        try {
            lock.release();
        } catch (IOException e) {
            System.err.println("[usage-counter] WARNING: could not release checkpoint lock: " + e.getMessage());
        }
        closeQuietly(lockChannel);
    }

    private static void closeQuietly(FileChannel channel) {
        try {
            channel.close();
        } catch (IOException e) {
            System.err.println("[usage-counter] WARNING: could not close " + channel + ": " + e.getMessage());
        }
    }
}
