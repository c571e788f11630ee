package com.sem.lcs.engine;

import com.sem.lcs.api.LabelConflictException;
import com.sem.lcs.api.LabelId;
import com.sem.lcs.api.ParameterLabel;
import com.sem.lcs.api.PathId;
import com.sem.lcs.api.PathKind;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Predicate;

/**
 * Equality-constraint labels of one specification and the paths that share
 * them.
 *
 * <p>
 * A label is interned with the kind and freeness of the first path that uses
 * it; every later use must agree. Labels are reported in intern order.
 * Not thread-safe: each build owns its own registry.
 */
public final class LabelRegistry {
    private final Map<String, Entry> entries = new LinkedHashMap<>();
    private final Predicate<String> reservedName;

    public LabelRegistry() {
        this(name -> false);
    }

    /**
     * @param reservedName Names a label may not take, typically the variable
     *                     names of the model.
     */
    public LabelRegistry(Predicate<String> reservedName) {
        this.reservedName = reservedName;
    }

    /**
     * Returns the id of {@code name}, creating it on first use.
     *
     * @throws LabelConflictException if the label exists with a different kind
     *                                or freeness, or clashes with a variable name.
     */
    public LabelId intern(String name, PathKind kind, boolean free) {
        if (name == null || name.isBlank())
            throw new IllegalArgumentException("Label name is required");
        Entry e = entries.get(name);
        if (e == null) {
            if (reservedName.test(name))
                throw new LabelConflictException(name, "clashes with a variable of the same name");
            e = new Entry(new LabelId(entries.size(), name), kind, free);
            entries.put(name, e);
            return e.id;
        }
        if (e.kind != kind)
            throw new LabelConflictException(name, "interned as " + e.kind + " but used as " + kind);
        if (e.free != free)
            throw new LabelConflictException(name, "interned as " + freeness(e.free) + " but used as "
                    + freeness(free));
        return e.id;
    }

    /** Records that {@code path} carries the already interned label. */
    public void attach(LabelId label, PathId path) {
        Entry e = entries.get(label.name());
        if (e == null || !e.id.equals(label))
            throw new IllegalArgumentException("Label not interned here: " + label.name());
        e.members.add(path);
    }

    /** Paths sharing {@code name}, in emission order; empty if unknown. */
    public Set<PathId> members(String name) {
        Entry e = entries.get(name);
        return e == null ? Collections.emptySortedSet() : Collections.unmodifiableSortedSet(e.members);
    }

    public boolean contains(String name) {
        return entries.containsKey(name);
    }

    public int size() {
        return entries.size();
    }

    /** Snapshot of all labels in intern order. */
    public List<ParameterLabel> labels() {
        var out = new ArrayList<ParameterLabel>(entries.size());
        for (Entry e : entries.values())
            out.add(new ParameterLabel(e.id, e.kind, e.free, e.members));
        return out;
    }

    private static String freeness(boolean free) {
        return free ? "free" : "fixed";
    }

    private static final class Entry {
        final LabelId id;
        final PathKind kind;
        final boolean free;
        final TreeSet<PathId> members = new TreeSet<>();

        Entry(LabelId id, PathKind kind, boolean free) {
            this.id = id;
            this.kind = kind;
            this.free = free;
        }
    }
}
