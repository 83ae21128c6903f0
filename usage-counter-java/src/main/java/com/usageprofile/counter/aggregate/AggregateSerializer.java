package com.usageprofile.counter.aggregate;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.nio.file.*;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Converts aggregates to and from their JSON document and writes usages.json.
 * Produces deterministic output by sorting every map by key before writing.
 */
public class AggregateSerializer {

    public static final String USAGES_FILE = "usages.json";

    public static class SerializerException extends RuntimeException {
        public SerializerException(String msg, Throwable cause) { super(msg, cause); }
    }

    private final Gson gson = new GsonBuilder().setPrettyPrinting().create();

    public AggregateModel.UsageDocument toDocument(PartialAggregate aggregate) {
        AggregateModel.UsageDocument doc = new AggregateModel.UsageDocument();
        doc.callCounts = new TreeMap<>(aggregate.callCounts());
        Map<String, Map<String, Map<String, Long>>> histograms = new TreeMap<>();
        aggregate.parameterHistograms().forEach((key, h) -> {
            Map<String, Long> bySignature = new TreeMap<>();
            h.counts().forEach((sig, n) -> bySignature.put(sig.key(), n));
            histograms.computeIfAbsent(key.element(), k -> new TreeMap<>()).put(key.parameter(), bySignature);
        });
        doc.parameterHistograms = histograms;
        Map<String, List<AggregateModel.Location>> occurrences = new TreeMap<>();
        aggregate.occurrences().forEach((element, list) -> {
            List<AggregateModel.Location> locations = new ArrayList<>(list.size());
            for (Occurrence o : list) {
                AggregateModel.Location l = new AggregateModel.Location();
                l.path = o.path();
                l.line = o.line();
                l.column = o.column();
                locations.add(l);
            }
            occurrences.put(element, locations);
        });
        doc.occurrences = occurrences;
        doc.unresolvedCalls = aggregate.unresolvedCalls();
        return doc;
    }

    /**
     * @throws IllegalArgumentException if the document holds an unknown signature key, a
     *                                  missing or negative count, or an invalid location
     */
    public PartialAggregate fromDocument(AggregateModel.UsageDocument doc) {
        Map<String, Long> calls = doc.callCounts != null ? doc.callCounts : Map.of();
        Map<ParameterKey, Histogram> histograms = new HashMap<>();
        if (doc.parameterHistograms != null) {
            doc.parameterHistograms.forEach((element, params) -> {
                if (params == null) throw new IllegalArgumentException("Missing parameters of " + element);
                params.forEach((param, counts) -> {
                    if (counts == null) {
                        throw new IllegalArgumentException("Missing histogram of " + element + "." + param);
                    }
                    Map<ValueSignature, Long> parsed = new HashMap<>();
                    counts.forEach((sig, n) -> {
                        if (n == null) {
                            throw new IllegalArgumentException("Missing count of " + sig + " for " + element + "." + param);
                        }
                        parsed.merge(ValueSignature.parse(sig), n, Long::sum);
                    });
                    histograms.put(new ParameterKey(element, param), Histogram.of(parsed));
                });
            });
        }
        Map<String, List<Occurrence>> occurrences = new HashMap<>();
        if (doc.occurrences != null) {
            doc.occurrences.forEach((element, locations) -> {
                if (locations == null) throw new IllegalArgumentException("Missing locations of " + element);
                List<Occurrence> parsed = new ArrayList<>(locations.size());
                for (AggregateModel.Location l : locations) {
                    if (l == null) throw new IllegalArgumentException("Missing location of " + element);
                    parsed.add(new Occurrence(l.path, l.line, l.column));
                }
                occurrences.put(element, parsed);
            });
        }
        return new PartialAggregate(calls, histograms, occurrences, doc.unresolvedCalls);
    }

    public String toJson(PartialAggregate aggregate) {
        return gson.toJson(toDocument(aggregate));
    }

    /**
     * Writes {@code aggregate} to {@code outputDir/usages.json}.
     *
     * @return path of the written file
     */
    public Path write(PartialAggregate aggregate, Path outputDir) {
        Path target = outputDir.resolve(USAGES_FILE);
        writeJson(toDocument(aggregate), target);
        System.err.println("[usage-counter] " + USAGES_FILE + " written: " + target);
        return target;
    }

    /** Writes any Gson-serializable document next to its final name, then moves it into place. */
    public void writeJson(Object document, Path target) {
        Path dir = target.toAbsolutePath().getParent();
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new SerializerException("Could not create output directory: " + dir, e);
        }
        Path tmp = dir.resolve(target.getFileName() + ".tmp");
        try (Writer w = Files.newBufferedWriter(tmp, StandardCharsets.UTF_8)) {
            gson.toJson(document, w);
        } catch (IOException e) {
            throw new SerializerException("Failed to write " + target.getFileName() + ": " + e.getMessage(), e);
        }
        try {
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            throw new SerializerException("Failed to move " + tmp + " to " + target + ": " + e.getMessage(), e);
        }
    }

    /** Reads a usages.json document. */
    public PartialAggregate read(Path path) {
        try (Reader r = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            AggregateModel.UsageDocument doc = gson.fromJson(r, AggregateModel.UsageDocument.class);
            if (doc == null) {
                throw new SerializerException("Empty usage document: " + path, null);
            }
            return fromDocument(doc);
        } catch (IOException | JsonParseException | IllegalArgumentException e) {
            throw new SerializerException("Failed to read usage document " + path + ": " + e.getMessage(), e);
        }
    }
}
