package com.usageprofile.counter;

import com.usageprofile.counter.aggregate.Occurrence;
import com.usageprofile.counter.aggregate.PartialAggregate;
import com.usageprofile.counter.aggregate.UsageAggregator;
import com.usageprofile.counter.aggregate.ValueSignature;
import com.usageprofile.counter.checkpoint.CheckpointStore;
import com.usageprofile.counter.checkpoint.FileStatus;
import com.usageprofile.counter.checkpoint.Fingerprints;
import com.usageprofile.counter.config.ConfigException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class CheckpointStoreTest {

    private static final String KEY = "analysis-1";

    @TempDir
    Path tempDir;

    private static PartialAggregate aggregate(String element) {
        UsageAggregator agg = new UsageAggregator();
        agg.recordCall(element, Map.of("a", ValueSignature.literal("1")), new Occurrence("a.py", 2, 5));
        agg.recordUnresolved();
        return agg.toAggregate();
    }

    private static String fingerprint(String content) {
        return Fingerprints.ofContent(content.getBytes(StandardCharsets.UTF_8));
    }

    private Path recordFile(String path) {
        return tempDir.resolve(Fingerprints.sha256Hex(path) + ".json");
    }

    @Test
    void recordedFileIsFoundByPathAndFingerprint() {
        try (CheckpointStore store = CheckpointStore.open(tempDir, KEY, 3)) {
            store.recordProcessed("a/b.py", fingerprint("x"), FileStatus.ANALYZED, aggregate("pkg.fn"));

            Optional<CheckpointStore.StoredFile> stored = store.lookup("a/b.py", fingerprint("x"));
            assertTrue(stored.isPresent());
            assertEquals(FileStatus.ANALYZED, stored.get().status());
            assertEquals(aggregate("pkg.fn"), stored.get().aggregate());
            assertTrue(store.isProcessed("a/b.py", fingerprint("x")));
            assertFalse(store.isProcessed("a/c.py", fingerprint("x")));
        }
    }

    @Test
    void changedContentIsNotProcessed() {
        try (CheckpointStore store = CheckpointStore.open(tempDir, KEY, 3)) {
            store.recordProcessed("a.py", fingerprint("old"), FileStatus.ANALYZED, aggregate("pkg.fn"));
            assertFalse(store.isProcessed("a.py", fingerprint("new")));
        }
    }

    @Test
    void recordsSurviveReopen() {
        try (CheckpointStore store = CheckpointStore.open(tempDir, KEY, 3)) {
            store.recordProcessed("a.py", fingerprint("x"), FileStatus.PARSE_ERROR, PartialAggregate.empty());
        }
        try (CheckpointStore store = CheckpointStore.open(tempDir, KEY, 3)) {
            assertEquals(FileStatus.PARSE_ERROR, store.lookup("a.py", fingerprint("x")).orElseThrow().status());
        }
    }

    @Test
    void replacingRecordLeavesNoTemporaryFiles() throws Exception {
        try (CheckpointStore store = CheckpointStore.open(tempDir, KEY, 3)) {
            store.recordProcessed("a.py", fingerprint("1"), FileStatus.ANALYZED, aggregate("pkg.fn"));
            store.recordProcessed("a.py", fingerprint("2"), FileStatus.IRRELEVANT, PartialAggregate.empty());

            assertFalse(store.isProcessed("a.py", fingerprint("1")));
            assertEquals(FileStatus.IRRELEVANT, store.lookup("a.py", fingerprint("2")).orElseThrow().status());
        }
        try (Stream<Path> files = Files.list(tempDir)) {
            assertTrue(files.noneMatch(f -> f.getFileName().toString().endsWith(".tmp")));
        }
    }

    @Test
    void recordsOfAnotherAnalysisAreIgnored() {
        try (CheckpointStore store = CheckpointStore.open(tempDir, KEY, 3)) {
            store.recordProcessed("a.py", fingerprint("x"), FileStatus.ANALYZED, aggregate("pkg.fn"));
        }
        try (CheckpointStore store = CheckpointStore.open(tempDir, "analysis-2", 3)) {
            assertFalse(store.isProcessed("a.py", fingerprint("x")));
            assertTrue(store.loadAll().isEmpty());
        }
        try (CheckpointStore store = CheckpointStore.open(tempDir, null, 3)) {
            assertEquals(1, store.loadAll().size());
        }
    }

    @Test
    void loadAllIsSortedByPath() {
        try (CheckpointStore store = CheckpointStore.open(tempDir, KEY, 3)) {
            store.recordProcessed("z.py", fingerprint("z"), FileStatus.ANALYZED, aggregate("pkg.z"));
            store.recordProcessed("a.py", fingerprint("a"), FileStatus.ANALYZED, aggregate("pkg.a"));
            store.recordProcessed("m/n.py", fingerprint("m"), FileStatus.IRRELEVANT, PartialAggregate.empty());

            List<CheckpointStore.StoredFile> all = store.loadAll();
            assertEquals(List.of("a.py", "m/n.py", "z.py"), all.stream().map(CheckpointStore.StoredFile::path).toList());
        }
    }

    @Test
    void corruptRecordIsIgnored() throws Exception {
        try (CheckpointStore store = CheckpointStore.open(tempDir, KEY, 3)) {
            store.recordProcessed("a.py", fingerprint("x"), FileStatus.ANALYZED, aggregate("pkg.fn"));
            store.recordProcessed("b.py", fingerprint("y"), FileStatus.ANALYZED, aggregate("pkg.fn"));
            Files.writeString(recordFile("a.py"), "{ truncated");

            assertFalse(store.isProcessed("a.py", fingerprint("x")));
            assertEquals(List.of("b.py"), store.loadAll().stream().map(CheckpointStore.StoredFile::path).toList());
        }
    }

    @Test
    void recordWithUnknownSignatureIsIgnored() throws Exception {
        try (CheckpointStore store = CheckpointStore.open(tempDir, KEY, 3)) {
            store.recordProcessed("a.py", fingerprint("x"), FileStatus.ANALYZED, aggregate("pkg.fn"));
            Path file = recordFile("a.py");
            Files.writeString(file, Files.readString(file).replace("literal:1", "bogus:1"));

            assertFalse(store.isProcessed("a.py", fingerprint("x")));
        }
    }

    @Test
    void secondOpenOfLockedDirectoryFails() {
        try (CheckpointStore store = CheckpointStore.open(tempDir, KEY, 3)) {
            assertThrows(ConfigException.class, () -> CheckpointStore.open(tempDir, KEY, 3));
        }
        // Released on close
        CheckpointStore.open(tempDir, KEY, 3).close();
    }

    @Test
    void failingWriteIsReportedAfterAllAttempts() throws Exception {
        // A non-empty directory where the record should go cannot be replaced
        Path blocker = recordFile("a.py");
        Files.createDirectories(blocker.resolve("occupied"));

        try (CheckpointStore store = CheckpointStore.open(tempDir, KEY, 2)) {
            CheckpointStore.CheckpointWriteException e = assertThrows(CheckpointStore.CheckpointWriteException.class,
                    () -> store.recordProcessed("a.py", fingerprint("x"), FileStatus.ANALYZED, aggregate("pkg.fn")));
            assertTrue(e.getMessage().contains("2 attempts"), e.getMessage());
            assertNotNull(e.getCause());

            store.recordProcessed("b.py", fingerprint("y"), FileStatus.ANALYZED, aggregate("pkg.fn"));
            assertTrue(store.isProcessed("b.py", fingerprint("y")));
        }
    }

    @Test
    void storedRecordKeepsCallLocations() {
        try (CheckpointStore store = CheckpointStore.open(tempDir, KEY, 3)) {
            store.recordProcessed("a.py", fingerprint("x"), FileStatus.ANALYZED, aggregate("pkg.fn"));
            assertEquals(List.of(new Occurrence("a.py", 2, 5)),
                    store.lookup("a.py", fingerprint("x")).orElseThrow().aggregate().occurrences("pkg.fn"));
        }
    }

    @Test
    void recordWithNullCountIsIgnored() throws Exception {
        try (CheckpointStore store = CheckpointStore.open(tempDir, KEY, 3)) {
            store.recordProcessed("a.py", fingerprint("x"), FileStatus.ANALYZED, aggregate("pkg.fn"));
            store.recordProcessed("b.py", fingerprint("y"), FileStatus.ANALYZED, aggregate("pkg.fn"));
            Path file = recordFile("a.py");
            Files.writeString(file, Files.readString(file).replace("\"pkg.fn\": 1", "\"pkg.fn\": null"));

            assertFalse(store.isProcessed("a.py", fingerprint("x")));
            assertEquals(List.of("b.py"), store.loadAll().stream().map(CheckpointStore.StoredFile::path).toList());
        }
    }

    @Test
    void recordWithNullHistogramIsIgnored() throws Exception {
        try (CheckpointStore store = CheckpointStore.open(tempDir, KEY, 3)) {
            store.recordProcessed("a.py", fingerprint("x"), FileStatus.ANALYZED, aggregate("pkg.fn"));
            Path file = recordFile("a.py");
            String json = Files.readString(file);
            assertTrue(json.contains("\"a\": {"), json);
            Files.writeString(file, json.replaceFirst("\"a\": \\{[^}]*}", "\"a\": null"));

            assertFalse(store.isProcessed("a.py", fingerprint("x")));
        }
    }
}
