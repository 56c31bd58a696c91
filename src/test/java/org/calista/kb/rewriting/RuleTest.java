package org.calista.kb.rewriting;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class RuleTest {

    @Test
    void setOrientedPutsTheLargerWordLeft() {
        Rule r = new Rule(1);
        r.setOriented("ab", "ba");
        assertEquals("ba", r.lhs());
        assertEquals("ab", r.rhs());

        r.setOriented("a", "aaa");
        assertEquals("aaa", r.lhs());
        assertEquals("a", r.rhs());
    }

    @Test
    void rewriteReducesAndReorients() {
        RuleIndex index = new RuleIndex();
        Rewriter rewriter = new Rewriter(index);
        Rule aa = new Rule(1);
        aa.set("aa", "");
        index.insert(aa);
        rewriter.noteLhsLength(2);

        Rule r = new Rule(2);
        r.set("b", "aab");
        r.rewrite(rewriter);
        assertTrue(r.isTrivial());

        Rule s = new Rule(3);
        s.set("aab", "c");
        s.rewrite(rewriter);
        assertEquals("c", s.lhs());
        assertEquals("b", s.rhs());
    }

    @Test
    void resetGivesAPooledRuleAFreshIdentity() {
        Rule r = new Rule(7);
        r.set("ab", "a");
        long gen = r.generation();
        r.reset(9);
        assertEquals(9, r.id());
        assertEquals("", r.lhs());
        assertNotEquals(gen, r.generation());
        assertThrows(IllegalArgumentException.class, () -> r.reset(0));
        assertThrows(IllegalArgumentException.class, () -> new Rule(0));
    }
}
