package com.usageprofile.counter.pipeline;

import com.usageprofile.counter.aggregate.Occurrence;
import com.usageprofile.counter.aggregate.PartialAggregate;
import com.usageprofile.counter.aggregate.UsageAggregator;
import com.usageprofile.counter.api.ApiDescription;
import com.usageprofile.counter.api.ApiElement;
import com.usageprofile.counter.binding.ArgumentBinder;
import com.usageprofile.counter.checkpoint.FileStatus;
import com.usageprofile.counter.config.CounterConfig;
import com.usageprofile.counter.corpus.SourceFile;
import com.usageprofile.counter.static_analysis.*;

import java.util.List;
import java.util.Optional;

/**
 * Turns one source file into its partial aggregate: relevance check, parse, call
 * resolution, argument binding and aggregation. Holds no per-file state and may be
 * used from any number of threads.
 */
public class FileAnalyzer {

    /**
     * @param failure parse failure description for {@link FileStatus#PARSE_ERROR}, otherwise null
     */
    public record Analysis(FileStatus status, PartialAggregate aggregate, String failure) {}

    private final ApiDescription api;
    private final List<String> relevantPackages;
    private final PythonSourceParser parser;
    private final CallResolver resolver;
    private final ArgumentBinder binder = new ArgumentBinder();

    public FileAnalyzer(ApiDescription api, CounterConfig config) {
        this.api = api;
        this.relevantPackages = relevantPackages(api, config);
        this.parser = new PythonSourceParser(config.getFileTimeoutMs(), config.isTolerateSyntaxErrors());
        this.resolver = new CallResolver(api, config.isInferInstances());
    }

    private static List<String> relevantPackages(ApiDescription api, CounterConfig config) {
        if (!config.getRelevantPackages().isEmpty()) {
            return config.getRelevantPackages();
        }
        if (api.packageName() != null && !api.packageName().isBlank()) {
            return List.of(api.packageName());
        }
        return List.of();
    }

    /** True if the file mentions one of the relevant packages, or no packages are configured. */
    public boolean isRelevant(SourceFile file) {
        if (relevantPackages.isEmpty()) return true;
        for (String pkg : relevantPackages) {
            if (file.text().contains(pkg)) return true;
        }
        return false;
    }

    public Analysis analyze(SourceFile file) {
        if (!isRelevant(file)) {
            return new Analysis(FileStatus.IRRELEVANT, PartialAggregate.empty(), null);
        }
        List<CallSite> sites;
        try {
            ParseResult result = parser.parse(file);
            if (result instanceof ParseResult.Failed failed) {
                return new Analysis(FileStatus.PARSE_ERROR, PartialAggregate.empty(), failed.toString());
            }
            sites = resolver.resolve(((ParseResult.Parsed) result).source());
        } catch (StackOverflowError e) {
            return new Analysis(FileStatus.PARSE_ERROR, PartialAggregate.empty(),
                    file.relativePath() + ":0:0: Nesting too deep to analyze");
        }
        return new Analysis(FileStatus.ANALYZED, aggregate(sites), null);
    }

    /** Folds resolved call sites into an aggregate, binding each call's arguments and keeping its location. */
    public PartialAggregate aggregate(List<CallSite> sites) {
        UsageAggregator aggregator = new UsageAggregator();
        for (CallSite site : sites) {
            if (site.target() instanceof CallTarget.Resolved resolved) {
                Optional<ApiElement> element = api.element(resolved.element());
                if (element.isPresent()) {
                    aggregator.recordCall(resolved.element(), binder.bind(element.get(), site.arguments()),
                            new Occurrence(site.file(), site.line(), site.column()));
                    continue;
                }
            }
            aggregator.recordUnresolved();
        }
        return aggregator.toAggregate();
    }
}
