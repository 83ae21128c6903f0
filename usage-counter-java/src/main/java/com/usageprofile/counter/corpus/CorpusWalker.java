package com.usageprofile.counter.corpus;

import com.usageprofile.counter.config.ConfigException;

import java.io.IOException;
import java.nio.file.*;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.*;

/**
 * Enumerates candidate source files under a corpus root.
 * The listing is sorted by relative path so that runs are reproducible.
 */
public class CorpusWalker {

    /** A directory entry the walk could not visit. */
    public record WalkFailure(String path, String message) {}

    /**
     * @param root     corpus root directory
     * @param files    absolute paths of accepted files, sorted by relative path
     * @param failures entries that could not be visited
     */
    public record CorpusListing(Path root, List<Path> files, List<WalkFailure> failures) {}

    private final List<String> extensions;

    public CorpusWalker(List<String> extensions) {
        this.extensions = List.copyOf(extensions);
    }

    /**
     * @throws ConfigException if {@code root} is missing, not a directory or unreadable
     */
    public CorpusListing walk(Path root, ExclusionList exclusions) {
        Path normalizedRoot = root.toAbsolutePath().normalize();
        if (!Files.isDirectory(normalizedRoot)) {
            throw new ConfigException("Corpus root is not a directory: " + root);
        }
        if (!Files.isReadable(normalizedRoot)) {
            throw new ConfigException("Corpus root is not readable: " + root);
        }

        Map<String, Path> accepted = new TreeMap<>();
        List<WalkFailure> failures = new ArrayList<>();
        try {
            Files.walkFileTree(normalizedRoot, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                    if (!dir.equals(normalizedRoot)
                            && exclusions.excludes(SourceFile.relativize(normalizedRoot, dir), dir)) {
                        return FileVisitResult.SKIP_SUBTREE;
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                    if (!attrs.isRegularFile() || !hasRecognizedExtension(file)) {
                        return FileVisitResult.CONTINUE;
                    }
                    String relative = SourceFile.relativize(normalizedRoot, file);
                    if (!exclusions.excludes(relative, file)) {
                        accepted.put(relative, file);
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFileFailed(Path file, IOException exc) {
                    String relative = SourceFile.relativize(normalizedRoot, file);
                    System.err.println("[usage-counter] WARNING: could not visit " + relative + ": " + exc.getMessage());
                    failures.add(new WalkFailure(relative, String.valueOf(exc.getMessage())));
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (IOException e) {
            throw new ConfigException("Could not walk corpus root " + root + ": " + e.getMessage(), e);
        }
        return new CorpusListing(normalizedRoot, new ArrayList<>(accepted.values()), failures);
    }

    private boolean hasRecognizedExtension(Path file) {
        String name = file.getFileName().toString();
        for (String ext : extensions) {
            if (name.endsWith(ext)) return true;
        }
        return false;
    }
}
