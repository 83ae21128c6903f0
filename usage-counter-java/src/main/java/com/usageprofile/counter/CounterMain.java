package com.usageprofile.counter;

import com.usageprofile.counter.aggregate.AggregateSerializer;
import com.usageprofile.counter.aggregate.MergeEngine;
import com.usageprofile.counter.aggregate.PartialAggregate;
import com.usageprofile.counter.api.ApiDescription;
import com.usageprofile.counter.api.ApiDescriptionReader;
import com.usageprofile.counter.checkpoint.CheckpointStore;
import com.usageprofile.counter.checkpoint.Fingerprints;
import com.usageprofile.counter.config.ConfigException;
import com.usageprofile.counter.config.CounterConfig;
import com.usageprofile.counter.config.CounterConfigReader;
import com.usageprofile.counter.corpus.CorpusWalker;
import com.usageprofile.counter.corpus.ExclusionList;
import com.usageprofile.counter.improve.ImprovementCandidates;
import com.usageprofile.counter.improve.ImprovementFilter;
import com.usageprofile.counter.pipeline.FileAnalyzer;
import com.usageprofile.counter.pipeline.RunSummary;
import com.usageprofile.counter.pipeline.UsageCounter;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * Entry point of the usage counter.
 *
 * Usage:
 *   java -jar usage-counter-java.jar count \
 *     --src <corpus-dir> --api <api.json> --output <dir> \
 *     [--exclude <file>] [--checkpoints <dir>] [--config <file>] [--threads <n>]
 *
 *   java -jar usage-counter-java.jar merge --checkpoints <dir> --output <dir>
 *
 *   java -jar usage-counter-java.jar improve \
 *     --usages <usages.json> --output <dir> [--api <api.json>] [--min-usages <n>] [--config <file>]
 */
public class CounterMain {

    private static final String USAGE =
            "Usage: java -jar usage-counter-java.jar count --src <dir> --api <file> --output <dir> "
            + "[--exclude <file>] [--checkpoints <dir>] [--config <file>] [--threads <n>]\n"
            + "       java -jar usage-counter-java.jar merge --checkpoints <dir> --output <dir>\n"
            + "       java -jar usage-counter-java.jar improve --usages <file> --output <dir> "
            + "[--api <file>] [--min-usages <n>] [--config <file>]";

    public static void main(String[] args) {
        try {
            run(args);
            System.exit(0);
        } catch (UsageException e) {
            System.err.println("[usage-counter] ERROR: " + e.getMessage());
            System.err.println(USAGE);
            System.exit(2);
        } catch (Exception e) {
            System.err.println("[usage-counter] FATAL: " + e.getMessage());
            System.exit(1);
        }
    }

    static void run(String[] args) {
        if (args.length == 0) {
            throw new UsageException("No subcommand specified");
        }
        Flags flags = Flags.parse(args);
        switch (args[0]) {
            case "count" -> count(flags);
            case "merge" -> merge(flags);
            case "improve" -> improve(flags);
            default -> throw new UsageException("Unknown subcommand: " + args[0]);
        }
    }

    // ---- count ----

    static void count(Flags flags) {
        if (flags.src == null)    throw new UsageException("--src is required");
        if (flags.api == null)    throw new UsageException("--api is required");
        if (flags.output == null) throw new UsageException("--output is required");
        flags.rejectUnless("count", flags.usages == null && flags.minUsages == null);

        Path src = Paths.get(flags.src);
        Path apiFile = Paths.get(flags.api);
        Path output = Paths.get(flags.output);
        Path checkpoints = flags.checkpoints != null ? Paths.get(flags.checkpoints) : output.resolve("checkpoints");

        CounterConfig config = readConfig(flags);
        if (flags.threads != null) config.setThreads(flags.threads);

        System.err.println("[usage-counter] Reading API description: " + apiFile);
        ApiDescription api = new ApiDescriptionReader().read(apiFile);
        byte[] apiBytes = readBytes(apiFile);
        System.err.println("[usage-counter] API description: " + api.callables().size() + " callables, "
                + api.classes().size() + " classes");

        ExclusionList exclusions = flags.exclude != null
                ? ExclusionList.read(Paths.get(flags.exclude))
                : ExclusionList.empty();
        createDirectory(output, "output");

        String analysisKey = Fingerprints.analysisKey(apiBytes, config.analysisOptionsFingerprint());
        UsageCounter.Result result;
        try (CheckpointStore store = CheckpointStore.open(checkpoints, analysisKey, config.getCheckpointWriteRetries())) {
            System.err.println("[usage-counter] Counting usages in " + src + " with " + config.getThreads() + " threads");
            UsageCounter counter = new UsageCounter(
                    new FileAnalyzer(api, config),
                    new CorpusWalker(config.getExtensions()),
                    config.getThreads());
            result = counter.run(src, exclusions, store);
        }

        AggregateSerializer serializer = new AggregateSerializer();
        serializer.write(result.aggregate(), output);
        serializer.writeJson(result.summary(), output.resolve(RunSummary.SUMMARY_FILE));
        result.summary().print();
        System.err.println("[usage-counter] Done.");
    }

    // ---- merge ----

    static void merge(Flags flags) {
        if (flags.checkpoints == null) throw new UsageException("--checkpoints is required");
        if (flags.output == null)      throw new UsageException("--output is required");
        flags.rejectUnless("merge", flags.src == null && flags.api == null && flags.usages == null);

        Path checkpoints = Paths.get(flags.checkpoints);
        if (!Files.isDirectory(checkpoints)) {
            throw new ConfigException("Checkpoint directory not found: " + checkpoints);
        }
        Path output = Paths.get(flags.output);
        createDirectory(output, "output");

        PartialAggregate total;
        int records;
        try (CheckpointStore store = CheckpointStore.open(checkpoints, null, 1)) {
            List<PartialAggregate> aggregates = new ArrayList<>();
            for (CheckpointStore.StoredFile stored : store.loadAll()) {
                aggregates.add(stored.aggregate());
            }
            records = aggregates.size();
            total = new MergeEngine().merge(aggregates);
        }
        System.err.println("[usage-counter] Merged " + records + " checkpoint records");
        new AggregateSerializer().write(total, output);
    }

    // ---- improve ----

    static void improve(Flags flags) {
        if (flags.usages == null) throw new UsageException("--usages is required");
        if (flags.output == null) throw new UsageException("--output is required");
        flags.rejectUnless("improve", flags.src == null && flags.checkpoints == null);

        CounterConfig config = readConfig(flags);
        int minUsages = flags.minUsages != null ? flags.minUsages : config.getMinUsages();
        if (minUsages < 0) throw new UsageException("--min-usages must not be negative");

        Path usagesFile = Paths.get(flags.usages);
        if (!Files.isRegularFile(usagesFile)) {
            throw new ConfigException("Usage file not found: " + usagesFile);
        }
        AggregateSerializer serializer = new AggregateSerializer();
        PartialAggregate usages = serializer.read(usagesFile);
        ApiDescription api = flags.api != null ? new ApiDescriptionReader().read(Paths.get(flags.api)) : null;

        ImprovementCandidates candidates = new ImprovementFilter(minUsages).evaluate(usages, api);
        Path output = Paths.get(flags.output);
        createDirectory(output, "output");
        Path target = output.resolve(ImprovementCandidates.CANDIDATES_FILE);
        serializer.writeJson(candidates, target);
        System.err.println("[usage-counter] " + candidates.rarelyCalled.size() + " rarely called elements, "
                + candidates.rareValues.size() + " rare parameter values, "
                + candidates.unusedClasses.size() + " unused classes (threshold " + minUsages + ")");
        System.err.println("[usage-counter] " + ImprovementCandidates.CANDIDATES_FILE + " written: " + target);
    }

    // ---- helpers ----

    private static CounterConfig readConfig(Flags flags) {
        if (flags.config == null) return new CounterConfig();
        System.err.println("[usage-counter] Reading config: " + flags.config);
        return new CounterConfigReader().read(Paths.get(flags.config));
    }

    private static byte[] readBytes(Path file) {
        try {
            return Files.readAllBytes(file);
        } catch (IOException e) {
            throw new ConfigException("Failed to read " + file + ": " + e.getMessage(), e);
        }
    }

    private static void createDirectory(Path dir, String what) {
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new ConfigException("Could not create " + what + " directory: " + dir, e);
        }
    }

    /** Flags shared by all subcommands; each subcommand checks the ones it needs. */
    static final class Flags {
        String src;
        String api;
        String output;
        String exclude;
        String checkpoints;
        String config;
        String usages;
        Integer threads;
        Integer minUsages;

        static Flags parse(String[] args) {
            Flags f = new Flags();
            for (int i = 1; i < args.length; i++) {
                switch (args[i]) {
                    case "--src"         -> f.src         = requireNext(args, i++, "--src");
                    case "--api"         -> f.api         = requireNext(args, i++, "--api");
                    case "--output"      -> f.output      = requireNext(args, i++, "--output");
                    case "--exclude"     -> f.exclude     = requireNext(args, i++, "--exclude");
                    case "--checkpoints" -> f.checkpoints = requireNext(args, i++, "--checkpoints");
                    case "--config"      -> f.config      = requireNext(args, i++, "--config");
                    case "--usages"      -> f.usages      = requireNext(args, i++, "--usages");
                    case "--threads"     -> f.threads     = requireInt(args, i++, "--threads");
                    case "--min-usages"  -> f.minUsages   = requireInt(args, i++, "--min-usages");
                    default -> throw new UsageException("Unknown flag: " + args[i]);
                }
            }
            return f;
        }

        void rejectUnless(String command, boolean onlySupportedFlags) {
            if (!onlySupportedFlags) {
                throw new UsageException("Flag not supported by " + command);
            }
        }
    }

    private static String requireNext(String[] args, int i, String flag) {
        if (i + 1 >= args.length) {
            throw new UsageException(flag + " requires an argument");
        }
        return args[i + 1];
    }

    private static int requireInt(String[] args, int i, String flag) {
        String value = requireNext(args, i, flag);
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new UsageException(flag + " expects a number, got: " + value);
        }
    }

    static class UsageException extends RuntimeException {
        UsageException(String msg) { super(msg); }
    }
}
