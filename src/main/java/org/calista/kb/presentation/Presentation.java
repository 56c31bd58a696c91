package org.calista.kb.presentation;

import java.util.List;

/**
 * Presentation — read-only view of a monoid presentation (alphabet + defining relations).
 *
 * <p>Produced outside the completion engine and only read by it.</p>
 */
public interface Presentation {

    /** Distinct letters; their order defines the internal symbol order. */
    String alphabet();

    /** Defining relations in insertion order. */
    List<Relation> relations();

    /** True if the empty word is a valid element (monoid rather than semigroup). */
    boolean containsEmptyWord();

    /**
     * @throws InvalidSymbolException if {@code word} contains a letter outside {@link #alphabet()}
     */
    default void validateWord(String word) {
        String a = alphabet();
        for (int i = 0; i < word.length(); i++) {
            char c = word.charAt(i);
            if (a.indexOf(c) < 0) throw new InvalidSymbolException(c, i, a);
        }
    }
}
