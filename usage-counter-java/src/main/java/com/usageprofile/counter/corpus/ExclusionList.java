package com.usageprofile.counter.corpus;

import com.usageprofile.counter.config.ConfigException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.*;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Newline-separated list of excluded paths and glob patterns.
 *
 * Blank lines and lines starting with {@code #} are ignored. Entries containing one of
 * {@code * ? [ {} are globs matched against the {@code /}-separated relative path.
 * Other entries match a file by relative or absolute path, and every file below a
 * directory entry.
 */
public class ExclusionList {

    private final List<String> literals;
    private final List<PathMatcher> globs;

    private ExclusionList(List<String> literals, List<PathMatcher> globs) {
        this.literals = literals;
        this.globs = globs;
    }

    public static ExclusionList empty() {
        return new ExclusionList(Collections.emptyList(), Collections.emptyList());
    }

    /** Reads an exclusion file. A missing file yields an empty list. */
    public static ExclusionList read(Path file) {
        if (file == null) return empty();
        if (!Files.exists(file)) {
            System.err.println("[usage-counter] WARNING: exclusion file not found, nothing excluded: " + file);
            return empty();
        }
        try {
            return parse(Files.readAllLines(file, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new ConfigException(
                    "Failed to read exclusion file: " + file + ": " + e.getMessage(), e);
        }
    }

    public static ExclusionList parse(List<String> lines) {
        List<String> literals = new ArrayList<>();
        List<PathMatcher> globs = new ArrayList<>();
        FileSystem fs = FileSystems.getDefault();
        for (String raw : lines) {
            String line = raw.strip();
            if (line.isEmpty() || line.startsWith("#")) continue;
            if (isGlob(line)) {
                globs.add(fs.getPathMatcher("glob:" + line));
            } else {
                literals.add(trimTrailingSlash(line.replace('\\', '/')));
            }
        }
        return new ExclusionList(literals, globs);
    }

    /**
     * @param relativePath {@code /}-separated path below the corpus root
     * @param absolutePath the same file's absolute path
     */
    public boolean excludes(String relativePath, Path absolutePath) {
        String absolute = absolutePath.toAbsolutePath().normalize().toString().replace('\\', '/');
        for (String literal : literals) {
            if (matchesLiteral(literal, relativePath) || matchesLiteral(literal, absolute)) {
                return true;
            }
        }
        Path rel = Paths.get(relativePath);
        for (PathMatcher glob : globs) {
            if (glob.matches(rel) || glob.matches(absolutePath)) {
                return true;
            }
        }
        return false;
    }

    public boolean isEmpty() {
        return literals.isEmpty() && globs.isEmpty();
    }

    private static boolean matchesLiteral(String entry, String path) {
        return path.equals(entry) || path.startsWith(entry + "/");
    }

    private static boolean isGlob(String line) {
        return line.indexOf('*') >= 0 || line.indexOf('?') >= 0
                || line.indexOf('[') >= 0 || line.indexOf('{') >= 0;
    }

    private static String trimTrailingSlash(String s) {
        return s.length() > 1 && s.endsWith("/") ? s.substring(0, s.length() - 1) : s;
    }
}
