package com.lambdalab.calculus.reduce;

import java.util.Locale;

/** The reduction strategies a caller can pick. */
public enum Strategy {
    CBV("cbv", "call-by-value", CallByValue.INSTANCE),
    CBN("cbn", "call-by-name", CallByName.INSTANCE),
    APPLICATIVE("appl", "applicative order", ApplicativeOrder.INSTANCE),
    NORMAL("normal", "normal order", NormalOrder.INSTANCE);

    private final String key;
    private final String label;
    private final Reducer reducer;

    Strategy(String key, String label, Reducer reducer) {
        this.key = key;
        this.label = label;
        this.reducer = reducer;
    }

    public String key() { return key; }

    public String label() { return label; }

    public Reducer reducer() { return reducer; }

    /** True for the strategies that evaluate arguments before substituting them. */
    public boolean isStrict() {
        return this == CBV || this == APPLICATIVE;
    }

    /** Accepts the short keys ("cbv", "cbn", "appl", "normal") or the enum names, any case. */
    public static Strategy fromString(String s) {
        if (s == null) throw new IllegalArgumentException("strategy is null");
        String k = s.trim().toLowerCase(Locale.ROOT);
        for (Strategy st : values()) {
            if (st.key.equals(k) || st.name().toLowerCase(Locale.ROOT).equals(k)) return st;
        }
        throw new IllegalArgumentException("Unknown strategy: " + s);
    }
}
