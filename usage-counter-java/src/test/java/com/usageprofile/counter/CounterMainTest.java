package com.usageprofile.counter;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.usageprofile.counter.aggregate.AggregateSerializer;
import com.usageprofile.counter.aggregate.PartialAggregate;
import com.usageprofile.counter.config.ConfigException;
import com.usageprofile.counter.improve.ImprovementCandidates;
import com.usageprofile.counter.pipeline.RunSummary;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class CounterMainTest {

    @TempDir
    Path tempDir;

    private static final String CORPUS = SampleApi.FIXTURE_ROOT.resolve("corpus").toString();
    private static final String API = SampleApi.FIXTURE_ROOT.resolve("api.json").toString();
    private static final String EXCLUDE = SampleApi.FIXTURE_ROOT.resolve("exclude.txt").toString();

    private static JsonObject readJson(Path file) throws Exception {
        return JsonParser.parseString(Files.readString(file)).getAsJsonObject();
    }

    @Test
    void noSubcommand() {
        assertThrows(CounterMain.UsageException.class, () -> CounterMain.run(new String[0]));
    }

    @Test
    void unknownSubcommand() {
        assertThrows(CounterMain.UsageException.class, () -> CounterMain.run(new String[] {"explode"}));
    }

    @Test
    void unknownFlag() {
        assertThrows(CounterMain.UsageException.class,
                () -> CounterMain.run(new String[] {"count", "--colour", "red"}));
    }

    @Test
    void missingRequiredFlag() {
        CounterMain.UsageException e = assertThrows(CounterMain.UsageException.class,
                () -> CounterMain.run(new String[] {"count", "--src", CORPUS, "--output", tempDir.toString()}));
        assertTrue(e.getMessage().contains("--api"));
    }

    @Test
    void flagWithoutValue() {
        assertThrows(CounterMain.UsageException.class,
                () -> CounterMain.run(new String[] {"merge", "--checkpoints"}));
    }

    @Test
    void nonNumericThreads() {
        assertThrows(CounterMain.UsageException.class, () -> CounterMain.run(new String[] {
                "count", "--src", CORPUS, "--api", API, "--output", tempDir.toString(), "--threads", "many"}));
    }

    @Test
    void flagOfAnotherSubcommandIsRejected() {
        assertThrows(CounterMain.UsageException.class, () -> CounterMain.run(new String[] {
                "merge", "--checkpoints", tempDir.toString(), "--output", tempDir.toString(), "--api", API}));
    }

    @Test
    void missingCorpusIsFatal() {
        assertThrows(ConfigException.class, () -> CounterMain.run(new String[] {
                "count", "--src", tempDir.resolve("nope").toString(), "--api", API,
                "--output", tempDir.resolve("out").toString()}));
    }

    @Test
    void countMergeAndImprove() throws Exception {
        Path out = tempDir.resolve("out");
        Path checkpoints = tempDir.resolve("checkpoints");
        CounterMain.run(new String[] {
                "count", "--src", CORPUS, "--api", API, "--output", out.toString(),
                "--exclude", EXCLUDE, "--checkpoints", checkpoints.toString(), "--threads", "2"});

        Path usages = out.resolve(AggregateSerializer.USAGES_FILE);
        JsonObject usageJson = readJson(usages);
        assertEquals(3, usageJson.getAsJsonObject("call_counts").get("sklearn.metrics.f1_score").getAsLong());
        assertEquals(9, usageJson.get("unresolved_calls").getAsLong());

        JsonObject summary = readJson(out.resolve(RunSummary.SUMMARY_FILE));
        assertEquals(9, summary.get("files_total").getAsInt());
        assertEquals(1, summary.get("parse_failures").getAsInt());
        assertEquals("project_b/broken.py",
                summary.getAsJsonArray("failures").get(0).getAsJsonObject().get("path").getAsString());

        // Merging the checkpoints reproduces the counted totals
        Path merged = tempDir.resolve("merged");
        CounterMain.run(new String[] {"merge", "--checkpoints", checkpoints.toString(), "--output", merged.toString()});
        AggregateSerializer serializer = new AggregateSerializer();
        PartialAggregate counted = serializer.read(usages);
        assertEquals(counted, serializer.read(merged.resolve(AggregateSerializer.USAGES_FILE)));

        Path improved = tempDir.resolve("improved");
        CounterMain.run(new String[] {
                "improve", "--usages", usages.toString(), "--api", API,
                "--min-usages", "2", "--output", improved.toString()});
        JsonObject candidates = readJson(improved.resolve(ImprovementCandidates.CANDIDATES_FILE));
        assertEquals(2, candidates.get("min_usages").getAsInt());
        assertEquals(6, candidates.getAsJsonArray("rarely_called").size());
        assertEquals("sklearn.cluster.KMeans", candidates.getAsJsonArray("unused_classes").get(0).getAsString());
    }

    @Test
    void defaultCheckpointDirectoryIsUnderOutput() {
        Path out = tempDir.resolve("out");
        CounterMain.run(new String[] {
                "count", "--src", CORPUS, "--api", API, "--output", out.toString(), "--exclude", EXCLUDE});
        assertTrue(Files.isDirectory(out.resolve("checkpoints")));
    }

    @Test
    void improveUsesThresholdFromConfig() throws Exception {
        Path out = tempDir.resolve("out");
        CounterMain.run(new String[] {
                "count", "--src", CORPUS, "--api", API, "--output", out.toString(), "--exclude", EXCLUDE});
        Path config = tempDir.resolve("counter-config.json");
        Files.writeString(config, "{\"min_usages\": 4}");

        Path improved = tempDir.resolve("improved");
        CounterMain.run(new String[] {
                "improve", "--usages", out.resolve(AggregateSerializer.USAGES_FILE).toString(),
                "--config", config.toString(), "--output", improved.toString()});
        JsonObject candidates = readJson(improved.resolve(ImprovementCandidates.CANDIDATES_FILE));
        assertEquals(4, candidates.get("min_usages").getAsInt());
        // Without an API description only counted elements are considered: all six are below 4
        assertEquals(6, candidates.getAsJsonArray("rarely_called").size());
    }

    @Test
    void negativeThresholdIsUsageError() {
        assertThrows(CounterMain.UsageException.class, () -> CounterMain.run(new String[] {
                "improve", "--usages", "x.json", "--output", tempDir.toString(), "--min-usages", "-1"}));
    }

    @Test
    void missingUsageFileIsFatal() {
        assertThrows(ConfigException.class, () -> CounterMain.run(new String[] {
                "improve", "--usages", tempDir.resolve("none.json").toString(), "--output", tempDir.toString()}));
    }

    @Test
    void mergeOfMissingDirectoryIsFatal() {
        assertThrows(ConfigException.class, () -> CounterMain.run(new String[] {
                "merge", "--checkpoints", tempDir.resolve("none").toString(), "--output", tempDir.toString()}));
    }
}
