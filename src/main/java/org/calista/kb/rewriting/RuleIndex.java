package org.calista.kb.rewriting;

import java.util.TreeMap;

/**
 * RuleIndex — ordered lookup over active rules keyed by their {@code lhs}.
 *
 * <p>Keys compare reverse-lexicographically: scan from the last symbol backwards until a
 * mismatch or until either word runs out. Running out counts as equal, so a query window
 * finds the stored key that is one of its suffixes (or that it is a suffix of). Active
 * {@code lhs} words never contain one another, which keeps this a strict order on stored keys.</p>
 */
public final class RuleIndex {

    private final TreeMap<Key, Rule> keys = new TreeMap<>();

    public void insert(Rule rule) {
        Rule clash = keys.putIfAbsent(Key.of(rule.lhs()), rule);
        if (clash != null) {
            throw new IllegalStateException("index key collision: " + rule + " vs " + clash);
        }
    }

    public void remove(Rule rule) {
        Key key = Key.of(rule.lhs());
        Rule found = keys.get(key);
        if (found != rule) {
            throw new IllegalStateException("index out of sync removing " + rule + ", found " + found);
        }
        keys.remove(key);
    }

    /**
     * @return the active rule whose {@code lhs} is suffix-equivalent to {@code word[first..last)}, or null
     */
    public Rule findSuffixMatch(char[] word, int first, int last) {
        return keys.get(new Key(word, first, last));
    }

    public int size() {
        return keys.size();
    }

    // -------------------- Key --------------------

    private static final class Key implements Comparable<Key> {
        final char[] chars;
        final int first;
        final int last;

        Key(char[] chars, int first, int last) {
            this.chars = chars;
            this.first = first;
            this.last = last;
        }

        static Key of(String w) {
            char[] c = w.toCharArray();
            return new Key(c, 0, c.length);
        }

        @Override
        public int compareTo(Key that) {
            int i = last - 1;
            int j = that.last - 1;
            while (i > first && j > that.first && chars[i] == that.chars[j]) {
                i--;
                j--;
            }
            return Character.compare(chars[i], that.chars[j]);
        }
    }
}
