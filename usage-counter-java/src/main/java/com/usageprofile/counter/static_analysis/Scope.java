package com.usageprofile.counter.static_analysis;

import java.util.*;

/**
 * One lexical scope of a file: its bindings, its wildcard imports and its
 * {@code global}/{@code nonlocal} declarations.
 */
public class Scope {

    public enum Kind { MODULE, CLASS, FUNCTION, LAMBDA, COMPREHENSION }

    private final Kind kind;
    private final Scope parent;
    private Map<String, Binding> bindings = new HashMap<>();
    private List<String> wildcardModules = new ArrayList<>();
    private final Set<String> globals = new HashSet<>();
    private final Set<String> nonlocals = new HashSet<>();

    Scope(Kind kind, Scope parent) {
        this.kind = kind;
        this.parent = parent;
    }

    public Kind kind() { return kind; }

    public Scope parent() { return parent; }

    Binding get(String name) { return bindings.get(name); }

    void put(String name, Binding binding) { bindings.put(name, binding); }

    Set<String> names() { return bindings.keySet(); }

    List<String> wildcardModules() { return wildcardModules; }

    void addWildcard(String module) {
        if (!wildcardModules.contains(module)) wildcardModules.add(module);
    }

    void declareGlobal(String name) { globals.add(name); }

    void declareNonlocal(String name) { nonlocals.add(name); }

    boolean isGlobal(String name) { return globals.contains(name); }

    boolean isNonlocal(String name) { return nonlocals.contains(name); }

    /** Copy of the mutable binding state, for branch analysis. */
    State capture() {
        return new State(new HashMap<>(bindings), new ArrayList<>(wildcardModules));
    }

    void restore(State state) {
        bindings = new HashMap<>(state.bindings());
        wildcardModules = new ArrayList<>(state.wildcardModules());
    }

    record State(Map<String, Binding> bindings, List<String> wildcardModules) {}
}
