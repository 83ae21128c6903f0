package com.usageprofile.counter.static_analysis;

import com.usageprofile.counter.api.ApiDescription;

import java.util.*;

/**
 * Per-file table from local names to what they refer to, organized as a stack of
 * lexical scopes. Bindings follow program order: the last write wins.
 *
 * Branches are analyzed on snapshots: take a {@link #snapshot()} before each path,
 * {@link #restore} it, walk the path, snapshot the result, and finally restore the
 * {@link #merge} of all path results.
 */
public class AliasTable {

    /** Result of looking up a bare name. */
    public record Lookup(Binding binding, boolean ambiguousWildcard) {
        static final Lookup UNBOUND = new Lookup(null, false);
        static final Lookup AMBIGUOUS_WILDCARD = new Lookup(null, true);

        public boolean isBound() { return binding != null; }
    }

    /** Binding state of every scope from the innermost one up to the module scope. */
    public static final class Snapshot {
        private final List<Scope.State> states;

        private Snapshot(List<Scope.State> states) { this.states = states; }
    }

    private final ApiDescription api;
    private final Scope module;
    private Scope current;

    public AliasTable(ApiDescription api) {
        this.api = api;
        this.module = new Scope(Scope.Kind.MODULE, null);
        this.current = module;
    }

    public void enter(Scope.Kind kind) {
        current = new Scope(kind, current);
    }

    public void exit() {
        if (current.parent() == null) {
            throw new IllegalStateException("Cannot leave the module scope");
        }
        current = current.parent();
    }

    public void declareGlobal(String name) { current.declareGlobal(name); }

    public void declareNonlocal(String name) { current.declareNonlocal(name); }

    /** Binds {@code name} in the scope that owns it from the current point. */
    public void bind(String name, Binding binding) {
        owningScope(name).put(name, binding);
    }

    /**
     * Records {@code from module import *}. Names already bound in the scope are rebound
     * when the module exports an API element of that name.
     */
    public void addWildcard(String module) {
        current.addWildcard(module);
        for (String name : new ArrayList<>(current.names())) {
            String candidate = api.canonicalize(module + "." + name);
            if (api.element(candidate).isPresent()) {
                current.put(name, new Binding.Origin(candidate));
            }
        }
    }

    /**
     * Looks up a bare name. Enclosing class scopes are not visible from nested scopes.
     * A name bound nowhere is resolved through the wildcard imports in sight: first as a
     * member of one of the wildcard modules, then as the only API element of that name.
     */
    public Lookup lookup(String name) {
        Scope scope = current;
        if (scope.isGlobal(name)) {
            scope = module;
        }
        boolean first = true;
        List<String> wildcards = new ArrayList<>();
        for (Scope s = scope; s != null; s = s.parent()) {
            if (!first && s.kind() == Scope.Kind.CLASS) {
                continue;
            }
            first = false;
            Binding b = s.get(name);
            if (b != null) {
                return new Lookup(b, false);
            }
            wildcards.addAll(s.wildcardModules());
        }
        if (wildcards.isEmpty()) {
            return Lookup.UNBOUND;
        }
        return lookupWildcard(name, wildcards);
    }

    private Lookup lookupWildcard(String name, List<String> wildcards) {
        Set<String> members = new TreeSet<>();
        for (String module : wildcards) {
            String candidate = api.canonicalize(module + "." + name);
            if (api.element(candidate).isPresent()) members.add(candidate);
        }
        if (members.size() == 1) {
            return new Lookup(new Binding.Origin(members.iterator().next()), false);
        }
        if (members.isEmpty()) {
            var named = api.elementsNamed(name);
            if (named.size() == 1) {
                return new Lookup(new Binding.Origin(named.get(0).qualifiedName()), false);
            }
            if (named.isEmpty()) {
                return Lookup.UNBOUND;
            }
        }
        return Lookup.AMBIGUOUS_WILDCARD;
    }

    private Scope owningScope(String name) {
        if (current.isGlobal(name)) {
            return module;
        }
        if (current.isNonlocal(name)) {
            for (Scope s = current.parent(); s != null; s = s.parent()) {
                if (s.kind() == Scope.Kind.FUNCTION || s.kind() == Scope.Kind.LAMBDA) {
                    return s;
                }
            }
            return module;
        }
        return current;
    }

    public Snapshot snapshot() {
        List<Scope.State> states = new ArrayList<>();
        for (Scope s = current; s != null; s = s.parent()) {
            states.add(s.capture());
        }
        return new Snapshot(states);
    }

    public void restore(Snapshot snapshot) {
        int i = 0;
        for (Scope s = current; s != null; s = s.parent()) {
            if (i >= snapshot.states.size()) {
                throw new IllegalStateException("Snapshot taken at a different scope depth");
            }
            s.restore(snapshot.states.get(i++));
        }
    }

    /**
     * Joins the outcomes of alternative control-flow paths. Per name: two or more distinct
     * origins make the name ambiguous, and so does an origin on one path next to a shadowing
     * rebind on another; a single origin survives paths that leave the name unbound; a name
     * no path binds to an origin stays shadowed if some path shadowed it.
     */
    public static Snapshot merge(List<Snapshot> paths) {
        if (paths.isEmpty()) {
            throw new IllegalArgumentException("Nothing to merge");
        }
        int depth = paths.get(0).states.size();
        List<Scope.State> merged = new ArrayList<>(depth);
        for (int level = 0; level < depth; level++) {
            Set<String> names = new HashSet<>();
            List<String> wildcards = new ArrayList<>();
            for (Snapshot p : paths) {
                Scope.State st = p.states.get(level);
                names.addAll(st.bindings().keySet());
                for (String w : st.wildcardModules()) {
                    if (!wildcards.contains(w)) wildcards.add(w);
                }
            }
            Map<String, Binding> bindings = new HashMap<>();
            for (String name : names) {
                List<Binding> alternatives = new ArrayList<>();
                for (Snapshot p : paths) {
                    alternatives.add(p.states.get(level).bindings().get(name));
                }
                Binding joined = join(alternatives);
                if (joined != null) bindings.put(name, joined);
            }
            merged.add(new Scope.State(bindings, wildcards));
        }
        return new Snapshot(merged);
    }

    private static Binding join(List<Binding> alternatives) {
        Set<Binding> distinct = new LinkedHashSet<>();
        SortedSet<String> origins = new TreeSet<>();
        boolean shadowed = false;
        for (Binding b : alternatives) {
            if (b == null) continue;
            if (b instanceof Binding.Shadowed) {
                shadowed = true;
            } else if (b instanceof Binding.Ambiguous a) {
                origins.addAll(a.origins());
                distinct.add(b);
            } else {
                origins.add(describe(b));
                distinct.add(b);
            }
        }
        if (distinct.size() == 1 && !shadowed && !(distinct.iterator().next() instanceof Binding.Ambiguous)) {
            return distinct.iterator().next();
        }
        if (!distinct.isEmpty()) {
            return new Binding.Ambiguous(origins);
        }
        return shadowed ? Binding.SHADOWED : null;
    }

    private static String describe(Binding b) {
        if (b instanceof Binding.Origin o) return o.qualifiedName();
        if (b instanceof Binding.Instance i) return i.className();
        return b.toString();
    }
}
