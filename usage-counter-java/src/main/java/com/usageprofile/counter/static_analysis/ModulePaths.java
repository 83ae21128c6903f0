package com.usageprofile.counter.static_analysis;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Derives dotted module names from corpus-relative file paths and resolves relative imports.
 */
public final class ModulePaths {

    private ModulePaths() {}

    /**
     * Package that contains the module at {@code relativePath}:
     * {@code a/b/c.py -> a.b}, {@code a/b/__init__.py -> a.b}, {@code c.py -> ""}.
     */
    public static String packageOf(String relativePath) {
        List<String> parts = new ArrayList<>(Arrays.asList(relativePath.split("/")));
        parts.remove(parts.size() - 1);
        return String.join(".", parts);
    }

    /**
     * Resolves the module named by a relative import.
     *
     * @param relativePath file containing the import
     * @param level        number of leading dots (at least 1)
     * @param module       dotted name after the dots, or null for {@code from . import x}
     * @return the absolute module name, or empty if the dots climb above the corpus root
     */
    public static Optional<String> resolveRelative(String relativePath, int level, String module) {
        String pkg = packageOf(relativePath);
        List<String> parts = pkg.isEmpty() ? new ArrayList<>() : new ArrayList<>(Arrays.asList(pkg.split("\\.")));
        for (int i = 1; i < level; i++) {
            if (parts.isEmpty()) return Optional.empty();
            parts.remove(parts.size() - 1);
        }
        if (module != null && !module.isEmpty()) {
            parts.addAll(Arrays.asList(module.split("\\.")));
        }
        if (parts.isEmpty()) return Optional.empty();
        return Optional.of(String.join(".", parts));
    }
}
