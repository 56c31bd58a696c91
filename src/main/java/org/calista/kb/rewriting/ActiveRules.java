package org.calista.kb.rewriting;

import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * ActiveRules — insertion-ordered, intrusive doubly-linked list of active rules.
 *
 * <p>Two cursors ({@link #outer()}, {@link #inner()}) survive removal of the rule they point
 * at: they move on to its successor. A cursor at the end picks up the next appended rule.</p>
 */
public final class ActiveRules implements Iterable<Rule> {

    private Rule head;
    private Rule tail;
    private int size;

    private final Cursor outer = new Cursor();
    private final Cursor inner = new Cursor();

    /** Links {@code rule} at the end and marks it active. */
    public void append(Rule rule) {
        if (rule.active() || rule.prev != null || rule.next != null) {
            throw new IllegalStateException("rule already linked: " + rule);
        }
        rule.activate();
        rule.prev = tail;
        if (tail == null) head = rule;
        else tail.next = rule;
        tail = rule;
        size++;
        outer.onAppend(rule);
        inner.onAppend(rule);
    }

    /** Unlinks {@code rule} and marks it inactive. */
    public void remove(Rule rule) {
        if (!rule.active()) throw new IllegalStateException("rule not linked: " + rule);
        outer.onRemove(rule);
        inner.onRemove(rule);
        Rule p = rule.prev;
        Rule n = rule.next;
        if (p == null) head = n;
        else p.next = n;
        if (n == null) tail = p;
        else n.prev = p;
        size--;
        rule.deactivate();
    }

    public Rule first() { return head; }
    public Rule last() { return tail; }
    public int size() { return size; }

    public Cursor outer() { return outer; }
    public Cursor inner() { return inner; }

    @Override
    public Iterator<Rule> iterator() {
        return new Iterator<>() {
            private Rule at = head;

            @Override
            public boolean hasNext() {
                return at != null;
            }

            @Override
            public Rule next() {
                if (at == null) throw new NoSuchElementException();
                Rule r = at;
                at = at.next;
                return r;
            }
        };
    }

    // -------------------- Cursor --------------------

    /** Position in the list; {@code null} means "end". */
    public final class Cursor {
        private Rule at;

        public Rule get() { return at; }
        public boolean atEnd() { return at == null; }
        public boolean atFirst() { return at == head; }

        public void set(Rule rule) { this.at = rule; }

        public void advance() {
            if (at == null) throw new NoSuchElementException("cursor at end");
            at = at.next;
        }

        /** Steps back; from the end this lands on the last rule. */
        public void retreat() {
            at = (at == null) ? tail : at.prev;
        }

        void onAppend(Rule rule) {
            if (at == null) at = rule;
        }

        void onRemove(Rule rule) {
            if (at == rule) at = rule.next;
        }
    }
}
