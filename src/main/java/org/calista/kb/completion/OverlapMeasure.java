package org.calista.kb.completion;

/**
 * Scores an overlap of two rule left-hand sides {@code AB} and {@code BC}, where {@code B}
 * starts at position {@code it} of {@code AB}. Only used to bound the search.
 */
@FunctionalInterface
public interface OverlapMeasure {
    long measure(String ab, String bc, int it);
}
