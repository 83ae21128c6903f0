package com.usageprofile.counter.api;

import java.util.*;

/**
 * Immutable, indexed view of the analyzed library's public surface.
 *
 * Re-exports map an alias path (e.g. {@code sklearn.svm.SVC}) to the canonical
 * path the element is declared under (e.g. {@code sklearn.svm._classes.SVC}).
 */
public class ApiDescription {

    private static final int MAX_REEXPORT_HOPS = 16;

    private final String packageName;
    private final Map<String, ApiElement> elements;
    private final Map<String, List<ApiElement>> bySimpleName;
    private final Map<String, String> reexports;

    public ApiDescription(String packageName, Collection<ApiElement> elements, Map<String, String> reexports) {
        this.packageName = packageName;
        Map<String, ApiElement> byName = new LinkedHashMap<>();
        Map<String, List<ApiElement>> simple = new HashMap<>();
        for (ApiElement e : elements) {
            if (byName.putIfAbsent(e.qualifiedName(), e) == null) {
                simple.computeIfAbsent(e.simpleName(), k -> new ArrayList<>()).add(e);
            }
        }
        this.elements = Collections.unmodifiableMap(byName);
        this.bySimpleName = simple;
        this.reexports = reexports == null ? Map.of() : Map.copyOf(reexports);
    }

    /** Package name declared by the description, or null. */
    public String packageName() { return packageName; }

    public Collection<ApiElement> elements() { return elements.values(); }

    public Map<String, String> reexports() { return reexports; }

    public Optional<ApiElement> element(String qualifiedName) {
        return Optional.ofNullable(elements.get(qualifiedName));
    }

    public List<ApiElement> callables() {
        List<ApiElement> result = new ArrayList<>();
        for (ApiElement e : elements.values()) {
            if (e.isCallable()) result.add(e);
        }
        return result;
    }

    public List<ApiElement> classes() {
        List<ApiElement> result = new ArrayList<>();
        for (ApiElement e : elements.values()) {
            if (e.kind() == ApiElement.Kind.CLASS) result.add(e);
        }
        return result;
    }

    /** All elements whose last name segment equals {@code simpleName}. */
    public List<ApiElement> elementsNamed(String simpleName) {
        return bySimpleName.getOrDefault(simpleName, List.of());
    }

    /**
     * Rewrites {@code qualifiedName} through the re-export table until it names a known
     * element or no alias prefix applies. The longest matching alias prefix wins.
     */
    public String canonicalize(String qualifiedName) {
        String current = qualifiedName;
        Set<String> seen = new HashSet<>();
        for (int hop = 0; hop < MAX_REEXPORT_HOPS; hop++) {
            if (elements.containsKey(current) || !seen.add(current)) {
                return current;
            }
            String rewritten = rewriteLongestPrefix(current);
            if (rewritten == null) {
                return current;
            }
            current = rewritten;
        }
        return current;
    }

    private String rewriteLongestPrefix(String name) {
        int end = name.length();
        while (end > 0) {
            String prefix = name.substring(0, end);
            String target = reexports.get(prefix);
            if (target != null) {
                return target + name.substring(end);
            }
            end = prefix.lastIndexOf('.');
        }
        return null;
    }
}
