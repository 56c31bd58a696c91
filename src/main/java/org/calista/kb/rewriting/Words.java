package org.calista.kb.rewriting;

/**
 * Static helpers over internal words (plain {@link String}s of internal symbols).
 */
public final class Words {

    private Words() {}

    /** Shortlex order: shorter first, then lexicographic by symbol value. */
    public static int shortlexCompare(String u, String v) {
        if (u.length() != v.length()) return u.length() < v.length() ? -1 : 1;
        return u.compareTo(v);
    }

    public static boolean shortlexLess(String u, String v) {
        return shortlexCompare(u, v) < 0;
    }

    /**
     * Length of the longest common prefix of {@code u[from..]} and {@code v}.
     */
    public static int commonPrefixLength(String u, int from, String v) {
        int n = Math.min(u.length() - from, v.length());
        int k = 0;
        while (k < n && u.charAt(from + k) == v.charAt(k)) k++;
        return k;
    }

    /** True if {@code u[from..]} is a prefix of {@code v}. */
    public static boolean suffixIsPrefixOf(String u, int from, String v) {
        int len = u.length() - from;
        return len <= v.length() && v.regionMatches(0, u, from, len);
    }
}
