package com.usageprofile.counter.pipeline;

import com.usageprofile.counter.aggregate.MergeEngine;
import com.usageprofile.counter.aggregate.PartialAggregate;
import com.usageprofile.counter.checkpoint.CheckpointStore;
import com.usageprofile.counter.checkpoint.FileStatus;
import com.usageprofile.counter.checkpoint.Fingerprints;
import com.usageprofile.counter.corpus.CorpusWalker;
import com.usageprofile.counter.corpus.ExclusionList;
import com.usageprofile.counter.corpus.SourceFile;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.*;

/**
 * Counts API usages over a corpus.
 *
 * Each file is processed by a worker of a fixed pool as an independent task: read,
 * fingerprint, reuse a matching checkpoint or analyze and checkpoint. The per-file
 * aggregates are then reduced by the {@link MergeEngine}; completion order does not
 * affect the result.
 */
public class UsageCounter {

    public record Result(PartialAggregate aggregate, RunSummary summary) {}

    private final FileAnalyzer analyzer;
    private final CorpusWalker walker;
    private final int threads;
    private final MergeEngine mergeEngine = new MergeEngine();

    public UsageCounter(FileAnalyzer analyzer, CorpusWalker walker, int threads) {
        this.analyzer = analyzer;
        this.walker = walker;
        this.threads = Math.max(1, threads);
    }

    public Result run(Path corpusRoot, ExclusionList exclusions, CheckpointStore store) {
        long start = System.nanoTime();
        CorpusWalker.CorpusListing listing = walker.walk(corpusRoot, exclusions);
        System.err.println("[usage-counter] " + listing.files().size() + " source files under " + listing.root());

        RunSummary summary = new RunSummary();
        for (CorpusWalker.WalkFailure failure : listing.failures()) {
            summary.addFailure(new FileFailure(FileFailure.Kind.READ_ERROR, failure.path(), failure.message()));
        }

        ExecutorService pool = Executors.newFixedThreadPool(threads, r -> {
            Thread t = new Thread(r, "usage-counter-worker");
            t.setDaemon(true);
            return t;
        });
        List<PartialAggregate> aggregates = new ArrayList<>();
        try {
            List<Future<FileOutcome>> futures = new ArrayList<>();
            for (Path file : listing.files()) {
                futures.add(pool.submit(() -> process(listing.root(), file, store)));
            }
            int done = 0;
            for (Future<FileOutcome> future : futures) {
                FileOutcome outcome = await(future);
                summary.add(outcome);
                aggregates.add(outcome.aggregate());
                if (++done % 1000 == 0) {
                    System.err.println("[usage-counter] Processed " + done + "/" + futures.size() + " files");
                }
            }
        } finally {
            pool.shutdownNow();
        }

        PartialAggregate total = mergeEngine.merge(aggregates);
        summary.complete(total, TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start));
        return new Result(total, summary);
    }

    private static FileOutcome await(Future<FileOutcome> future) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while counting usages", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof Error error) throw error;
            throw new IllegalStateException("File task failed: " + cause.getMessage(), cause);
        }
    }

    FileOutcome process(Path root, Path file, CheckpointStore store) {
        SourceFile source;
        try {
            source = SourceFile.read(root, file);
        } catch (SourceFile.UnreadableFileException e) {
            System.err.println("[usage-counter] WARNING: " + e.getMessage());
            return FileOutcome.unreadable(SourceFile.relativize(root, file), e.getMessage());
        }
        try {
            return process(source, store);
        } catch (RuntimeException e) {
            String message = e.getClass().getSimpleName() + ": " + e.getMessage();
            System.err.println("[usage-counter] WARNING: analysis of " + source.relativePath() + " failed: " + message);
            return FileOutcome.failed(source.relativePath(), message);
        }
    }

    private FileOutcome process(SourceFile source, CheckpointStore store) {
        String path = source.relativePath();
        String fingerprint = Fingerprints.ofContent(source.content());

        Optional<CheckpointStore.StoredFile> stored = store.lookup(path, fingerprint);
        if (stored.isPresent()) {
            List<FileFailure> failures = stored.get().status() == FileStatus.PARSE_ERROR
                    ? List.of(new FileFailure(FileFailure.Kind.PARSE_ERROR, path, "Recorded in an earlier run"))
                    : List.of();
            return new FileOutcome(path, stored.get().status(), true, stored.get().aggregate(), failures);
        }

        FileAnalyzer.Analysis analysis = analyzer.analyze(source);
        List<FileFailure> failures = new ArrayList<>();
        if (analysis.status() == FileStatus.PARSE_ERROR) {
            failures.add(new FileFailure(FileFailure.Kind.PARSE_ERROR, path, analysis.failure()));
        }
        try {
            store.recordProcessed(path, fingerprint, analysis.status(), analysis.aggregate());
        } catch (CheckpointStore.CheckpointWriteException e) {
            System.err.println("[usage-counter] WARNING: " + e.getMessage());
            failures.add(new FileFailure(FileFailure.Kind.CHECKPOINT_WRITE_ERROR, path, e.getMessage()));
        }
        return new FileOutcome(path, analysis.status(), false, analysis.aggregate(), failures);
    }
}
