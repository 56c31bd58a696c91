package org.calista.kb.rewriting;

import java.util.Objects;

/**
 * Rewriter — reduces internal words against the active rules in one left-to-right pass.
 *
 * <p>One buffer, two regions: {@code [0, v)} is the reduced prefix, {@code [w, end)} the
 * pending suffix. Symbols move from pending to reduced one at a time; whenever a rule's
 * {@code lhs} ends the reduced prefix it is cut off and its {@code rhs} is written in front
 * of the pending suffix. Rules never lengthen a word, so the replacement always fits.</p>
 */
public final class Rewriter {

    private final RuleIndex index;
    private int minLhsLength = Integer.MAX_VALUE;

    public Rewriter(RuleIndex index) {
        this.index = Objects.requireNonNull(index, "index");
    }

    /** Lowers the shortest-lhs bound; it is never raised while rules stay defined. */
    public void noteLhsLength(int length) {
        if (length < minLhsLength) minLhsLength = length;
    }

    public void resetMinLhsLength() {
        minLhsLength = Integer.MAX_VALUE;
    }

    public int minLhsLength() {
        return minLhsLength;
    }

    public String rewrite(String word) {
        if (word.length() < minLhsLength) return word;

        char[] u = word.toCharArray();
        final int end = u.length;
        final int skip = minLhsLength - 1;
        int v = skip;
        int w = skip;

        while (w != end) {
            u[v++] = u[w++];

            Rule rule = index.findSuffixMatch(u, 0, v);
            if (rule != null) {
                String lhs = rule.lhs();
                if (lhs.length() <= v) {
                    String rhs = rule.rhs();
                    v -= lhs.length();
                    w -= rhs.length();
                    rhs.getChars(0, rhs.length(), u, w);
                }
            }
            while (w != end && skip > v) {
                u[v++] = u[w++];
            }
        }
        return new String(u, 0, v);
    }
}
