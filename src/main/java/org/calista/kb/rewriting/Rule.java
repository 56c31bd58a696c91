package org.calista.kb.rewriting;

/**
 * Rule — an owned pair of internal words {@code lhs -> rhs}.
 *
 * <p>A rule lives in exactly one of: the pending stack, the active list, the inactive pool.
 * While active, {@code lhs} is strictly greater than {@code rhs} in shortlex order.</p>
 *
 * <p>{@link #generation()} changes on every activation, deactivation and reuse, so a scan
 * that captured it can tell the rule was touched underneath it.</p>
 */
public final class Rule {

    private String lhs = "";
    private String rhs = "";

    private long id;
    private long generation;
    private boolean active;

    // intrusive links, owned by ActiveRules
    Rule prev;
    Rule next;

    public Rule(long id) {
        if (id <= 0) throw new IllegalArgumentException("rule id must be > 0: " + id);
        this.id = id;
    }

    public String lhs() { return lhs; }
    public String rhs() { return rhs; }

    /** Creation-order identity, unique among rules defined since the last reset. */
    public long id() { return id; }

    public long generation() { return generation; }

    public boolean active() { return active; }

    /** Stores both words as given; orientation is fixed later by {@link #rewrite(Rewriter)}. */
    public void set(String lhs, String rhs) {
        this.lhs = lhs;
        this.rhs = rhs;
    }

    /** Stores both words, the shortlex-larger one as {@code lhs}. */
    public void setOriented(String u, String v) {
        if (Words.shortlexLess(u, v)) {
            this.lhs = v;
            this.rhs = u;
        } else {
            this.lhs = u;
            this.rhs = v;
        }
    }

    /** Reduces both sides and reorders them if needed. */
    public void rewrite(Rewriter rewriter) {
        setOriented(rewriter.rewrite(lhs), rewriter.rewrite(rhs));
    }

    public void rewriteRhs(Rewriter rewriter) {
        rhs = rewriter.rewrite(rhs);
    }

    public boolean isTrivial() {
        return lhs.equals(rhs);
    }

    void activate() {
        if (!active) {
            active = true;
            generation++;
        }
    }

    void deactivate() {
        if (active) {
            active = false;
            generation++;
            prev = null;
            next = null;
        }
    }

    /** Prepares a pooled rule for reuse under a fresh id. */
    public void reset(long newId) {
        if (active) throw new IllegalStateException("cannot reuse active rule " + this);
        if (newId <= 0) throw new IllegalArgumentException("rule id must be > 0: " + newId);
        this.id = newId;
        this.lhs = "";
        this.rhs = "";
        generation++;
    }

    public Rule next() { return next; }
    public Rule prev() { return prev; }

    @Override
    public String toString() {
        return "Rule#" + id + (active ? "" : "(inactive)") + "{" + debug(lhs) + " -> " + debug(rhs) + "}";
    }

    private static String debug(String w) {
        StringBuilder sb = new StringBuilder(w.length() * 2);
        for (int i = 0; i < w.length(); i++) {
            if (i > 0) sb.append('.');
            sb.append((int) w.charAt(i));
        }
        return sb.toString();
    }
}
