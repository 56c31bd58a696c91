package org.calista.kb.presentation;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class StringPresentationTest {

    @Test
    void buildKeepsRelationOrder() {
        StringPresentation p = StringPresentation.builder()
                .alphabet("xy")
                .rule("xx", "")
                .rule("yy", "x")
                .rule("xy", "yx")
                .build();

        assertEquals("xy", p.alphabet());
        assertEquals(List.of(Relation.of("xx", ""), Relation.of("yy", "x"), Relation.of("xy", "yx")), p.relations());
        assertThrows(UnsupportedOperationException.class, () -> p.relations().add(Relation.of("x", "y")));
    }

    @Test
    void lettersOutsideTheAlphabetAreRejected() {
        InvalidSymbolException e = assertThrows(InvalidSymbolException.class,
                () -> StringPresentation.builder().alphabet("ab").rule("abc", "a").build());
        assertEquals('c', e.symbol());
        assertEquals(2, e.position());
    }

    @Test
    void duplicateLettersAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> StringPresentation.builder().alphabet("abca").build());
    }

    @Test
    void emptyWordNeedsAMonoid() {
        assertThrows(IllegalArgumentException.class,
                () -> StringPresentation.builder().alphabet("a").containsEmptyWord(false).rule("aa", "").build());
        assertTrue(StringPresentation.builder().alphabet("a").rule("aa", "").build().containsEmptyWord());
    }

    @Test
    void relationValueSemantics() {
        assertEquals(Relation.of("ab", "a"), Relation.of("ab", "a"));
        assertNotEquals(Relation.of("ab", "a"), Relation.of("a", "ab"));
        assertTrue(Relation.of("a", "a").isTrivial());
        assertEquals("ab = a", Relation.of("ab", "a").toString());
    }
}
