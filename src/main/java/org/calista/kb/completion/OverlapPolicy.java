package org.calista.kb.completion;

import java.util.Locale;

/**
 * Closed set of overlap measures, selected by configuration.
 */
public enum OverlapPolicy {

    /** |A| + |BC| */
    ABC((ab, bc, it) -> (long) it + bc.length()),

    /** |AB| + |BC| */
    AB_BC((ab, bc, it) -> (long) ab.length() + bc.length()),

    /** max(|AB|, |BC|) */
    MAX_AB_BC((ab, bc, it) -> Math.max(ab.length(), bc.length()));

    private final OverlapMeasure measure;

    OverlapPolicy(OverlapMeasure measure) {
        this.measure = measure;
    }

    public OverlapMeasure measure() {
        return measure;
    }

    /** Lenient parse for config values ("abc", "ab-bc", "MAX_AB_BC"). */
    public static OverlapPolicy parse(String s) {
        if (s == null || s.isBlank()) return ABC;
        return valueOf(s.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
    }
}
