package com.usageprofile.counter.config;

import com.google.gson.annotations.SerializedName;
import java.util.Collections;
import java.util.List;

/**
 * Deserialized form of counter-config.json. Every field is optional.
 */
public class CounterConfig {

    /** Worker threads for per-file analysis (default: available processors). */
    @SerializedName("threads")
    private Integer threads;

    /** Per-file parse limit in milliseconds; 0 disables the limit (default: 0). */
    @SerializedName("file_timeout_ms")
    private Long fileTimeoutMs;

    /** Attempts per checkpoint write before the file is deferred to the next run (default: 3). */
    @SerializedName("checkpoint_write_retries")
    private Integer checkpointWriteRetries;

    /**
     * Files whose text mentions none of these names are skipped without parsing.
     * Empty means: use the package named by the API description, if any.
     */
    @SerializedName("relevant_packages")
    private List<String> relevantPackages;

    /** Recognized source extensions (default: [".py"]). */
    @SerializedName("extensions")
    private List<String> extensions;

    /** Analyze files with syntax errors instead of reporting them as parse failures. */
    @SerializedName("tolerate_syntax_errors")
    private Boolean tolerateSyntaxErrors;

    /** Bind names assigned from constructor calls to instances of that class. */
    @SerializedName("infer_instances")
    private Boolean inferInstances;

    /** Threshold used by the improve command when --min-usages is not given (default: 1). */
    @SerializedName("min_usages")
    private Integer minUsages;

    public int getThreads() {
        return threads != null && threads > 0 ? threads : Runtime.getRuntime().availableProcessors();
    }
    public long getFileTimeoutMs()        { return fileTimeoutMs != null && fileTimeoutMs > 0 ? fileTimeoutMs : 0L; }
    public int getCheckpointWriteRetries() { return checkpointWriteRetries != null && checkpointWriteRetries > 0 ? checkpointWriteRetries : 3; }
    public List<String> getRelevantPackages() { return relevantPackages != null ? relevantPackages : Collections.emptyList(); }
    public List<String> getExtensions() {
        return extensions != null && !extensions.isEmpty() ? extensions : List.of(".py");
    }
    public boolean isTolerateSyntaxErrors() { return tolerateSyntaxErrors != null && tolerateSyntaxErrors; }
    public boolean isInferInstances()       { return inferInstances != null && inferInstances; }
    public int getMinUsages()               { return minUsages != null ? minUsages : 1; }

    public void setThreads(int threads) { this.threads = threads; }
    public void setFileTimeoutMs(long fileTimeoutMs) { this.fileTimeoutMs = fileTimeoutMs; }
    public void setTolerateSyntaxErrors(boolean tolerate) { this.tolerateSyntaxErrors = tolerate; }
    public void setInferInstances(boolean infer) { this.inferInstances = infer; }
    public void setRelevantPackages(List<String> packages) { this.relevantPackages = packages; }

    /**
     * Options that change what a file contributes. Checkpoints recorded under a
     * different fingerprint of these options are not reused.
     */
    public String analysisOptionsFingerprint() {
        return "extensions=" + getExtensions()
                + ";relevant=" + getRelevantPackages()
                + ";tolerate=" + isTolerateSyntaxErrors()
                + ";instances=" + isInferInstances();
    }
}
