package com.lambdalab.calculus.reduce;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** Ordered snapshots of a run, starting term first. */
public final class Trace {
    private final List<TraceEntry> entries = new ArrayList<>();

    void add(TraceEntry entry) {
        entries.add(entry);
    }

    public List<TraceEntry> entries() {
        return Collections.unmodifiableList(entries);
    }

    public int size() { return entries.size(); }

    public boolean isEmpty() { return entries.isEmpty(); }

    public TraceEntry last() {
        return entries.isEmpty() ? null : entries.get(entries.size() - 1);
    }

    /** Plain renderings, one per snapshot. */
    public List<String> steps() {
        List<String> out = new ArrayList<>(entries.size());
        for (TraceEntry e : entries) out.add(e.render());
        return out;
    }

    /** Renderings with the active redex marked. */
    public List<String> highlightedSteps() {
        List<String> out = new ArrayList<>(entries.size());
        for (TraceEntry e : entries) out.add(e.renderHighlighted());
        return out;
    }
}
