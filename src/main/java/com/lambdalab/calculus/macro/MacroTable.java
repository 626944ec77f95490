package com.lambdalab.calculus.macro;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import com.lambdalab.calculus.ast.Expr;
import com.lambdalab.calculus.reduce.Strategy;

/**
 * Session-scoped macro table, keyed by upper-cased name.
 *
 * The contents are an immutable map behind a volatile reference. A
 * definition builds its candidate map aside and publishes it with one
 * reference swap, so readers see either the old table or the new one.
 */
public final class MacroTable {

    private volatile Map<String, MacroDefinition> current = Collections.emptyMap();

    public static String normalize(String name) {
        return name.toUpperCase(Locale.ROOT);
    }

    /** Valid macro names are identifiers whose first character is an uppercase letter. */
    public static boolean isValidName(String name) {
        if (name == null || name.isEmpty()) return false;
        if (!Character.isUpperCase(name.charAt(0))) return false;
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            boolean ok = (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9');
            if (!ok) return false;
        }
        return true;
    }

    public MacroDefinition get(String name) {
        return name == null ? null : current.get(normalize(name));
    }

    public boolean contains(String name) {
        return get(name) != null;
    }

    public int size() { return current.size(); }

    public boolean isEmpty() { return current.isEmpty(); }

    /**
     * A reference to {@code name} resolved for {@code strategy}, or null if
     * undefined. References nested in the resolved body follow the same strategy.
     */
    public Expr.MacroRef reference(String name, Strategy strategy) {
        if (name == null) return null;
        Map<String, MacroDefinition> snap = current;
        MacroDefinition def = snap.get(normalize(name));
        if (def == null) return null;
        Expr resolved = MacroCompiler.relink(def.resolve(strategy), snap, strategy);
        return new Expr.MacroRef(def.name(), resolved);
    }

    /** Current contents in definition order (unmodifiable). */
    public Map<String, MacroDefinition> snapshot() {
        return current;
    }

    /** Definitions ordered dependencies first. */
    public List<MacroDefinition> list() {
        Map<String, MacroDefinition> snap = current;
        DependencyGraph.Order order = DependencyGraph.sort(snap);
        if (order.hasCycle()) {
            // only acyclic maps are ever published
            throw new IllegalStateException("macro table has a cycle: " + order.cycle());
        }
        List<MacroDefinition> out = new ArrayList<>(snap.size());
        for (String n : order.order()) out.add(snap.get(n));
        return Collections.unmodifiableList(out);
    }

    public void clear() {
        current = Collections.emptyMap();
    }

    void publish(Map<String, MacroDefinition> next) {
        current = Collections.unmodifiableMap(new LinkedHashMap<>(next));
    }
}
