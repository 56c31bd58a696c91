package org.calista.kb.completion;

import org.apache.logging.log4j.CloseableThreadContext;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.kb.presentation.Presentation;
import org.calista.kb.presentation.Relation;
import org.calista.kb.rewriting.ActiveRules;
import org.calista.kb.rewriting.AlphabetCodec;
import org.calista.kb.rewriting.Rewriter;
import org.calista.kb.rewriting.Rule;
import org.calista.kb.rewriting.RuleIndex;
import org.calista.kb.rewriting.Words;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

/**
 * KnuthBendix — bounded, resumable Knuth-Bendix completion for monoid presentations,
 * using shortlex order on words.
 *
 * <p>Pipeline: relations are staged on the pending stack → the stack is drained (reduce both
 * sides, orient, evict active rules made redundant, activate) → overlaps of active rules are
 * searched in insertion order, each derived pair drained immediately → the confluence check
 * runs every {@link CompletionSettings#checkConfluenceInterval} overlaps.</p>
 *
 * <p>Single-threaded. Only {@link #requestStop()} may be called from another thread; every
 * inner loop polls it, and stopping leaves active list, index and stack consistent.</p>
 */
public final class KnuthBendix extends Runner {

    private static final Logger log = LogManager.getLogger(KnuthBendix.class);

    private static final AtomicLong RUN_IDS = new AtomicLong();

    private final Presentation presentation;
    private final AlphabetCodec codec;

    private CompletionSettings settings;
    private OverlapMeasure measure;

    private final ActiveRules active = new ActiveRules();
    private final ArrayDeque<Rule> inactive = new ArrayDeque<>();
    private final ArrayDeque<Rule> stack = new ArrayDeque<>();
    private final RuleIndex index = new RuleIndex();
    private final Rewriter rewriter = new Rewriter(index);

    private Confluence confluence = Confluence.UNKNOWN;
    private long totalRules = 0;

    public KnuthBendix(Presentation presentation) {
        this(presentation, CompletionSettings.defaults());
    }

    public KnuthBendix(Presentation presentation, CompletionSettings settings) {
        this.presentation = Objects.requireNonNull(presentation, "presentation");
        this.codec = new AlphabetCodec(presentation.alphabet());
        settings(settings);
        stagePresentation();
    }

    /**
     * Copies settings, active rules (in order), pending stack and the confluence cache.
     * The inactive pool is not copied.
     */
    public KnuthBendix(KnuthBendix that) {
        Objects.requireNonNull(that, "that");
        this.presentation = that.presentation;
        this.codec = that.codec;
        settings(that.settings);
        reportEvery(that.reportInterval());
        this.totalRules = that.totalRules;

        for (Rule r : that.active) {
            Rule copy = new Rule(r.id());
            copy.set(r.lhs(), r.rhs());
            activateRule(copy);
        }
        Iterator<Rule> bottomUp = that.stack.descendingIterator();
        while (bottomUp.hasNext()) {
            Rule r = bottomUp.next();
            Rule copy = new Rule(r.id());
            copy.set(r.lhs(), r.rhs());
            stack.push(copy);
        }
        this.confluence = that.confluence;
    }

    /**
     * Back to the state right after construction: every rule goes to the inactive pool,
     * default settings, presentation relations staged again.
     */
    public KnuthBendix init() {
        if (running()) throw new IllegalStateException("cannot init while running");
        for (Rule r = active.first(); r != null; ) {
            Rule next = r.next();
            removeRule(r);
            inactive.addLast(r);
            r = next;
        }
        while (!stack.isEmpty()) inactive.addLast(stack.pop());
        active.outer().set(null);
        active.inner().set(null);

        rewriter.resetMinLhsLength();
        confluence = Confluence.UNKNOWN;
        totalRules = 0;
        settings(CompletionSettings.defaults());
        resetRunner();
        stagePresentation();
        return this;
    }

    // pushed last-to-first so the first relation is drained first
    private void stagePresentation() {
        List<Relation> rels = presentation.relations();
        for (int i = rels.size() - 1; i >= 0; i--) {
            addRule(rels.get(i).lhs, rels.get(i).rhs);
        }
    }

    // -------------------- Settings --------------------

    public CompletionSettings settings() {
        return settings;
    }

    public KnuthBendix settings(CompletionSettings s) {
        Objects.requireNonNull(s, "settings");
        if (this.settings == null || this.settings.overlapPolicy != s.overlapPolicy || measure == null) {
            this.measure = s.overlapPolicy.measure();
        }
        this.settings = s;
        return this;
    }

    public KnuthBendix overlapPolicy(OverlapPolicy p) {
        return settings(settings.toBuilder().overlapPolicy(p).build());
    }

    public KnuthBendix maxRules(long n) {
        return settings(settings.toBuilder().maxRules(n).build());
    }

    public KnuthBendix maxOverlap(long n) {
        return settings(settings.toBuilder().maxOverlap(n).build());
    }

    public KnuthBendix checkConfluenceInterval(long n) {
        return settings(settings.toBuilder().checkConfluenceInterval(n).build());
    }

    // -------------------- Public API --------------------

    public Presentation presentation() {
        return presentation;
    }

    public String alphabet() {
        return codec.alphabet();
    }

    /**
     * Stages {@code u = v} as a pending candidate; no-op if the words are equal.
     *
     * @throws org.calista.kb.presentation.InvalidSymbolException for letters outside the alphabet
     */
    public void addRule(String u, String v) {
        String uu = codec.toInternal(u);
        String vv = codec.toInternal(v);
        if (uu.equals(vv)) return;
        Rule rule = newRule();
        rule.setOriented(uu, vv);
        stack.push(rule);
    }

    /**
     * Drains the pending stack without searching overlaps: afterwards every staged candidate
     * is either active or discarded as redundant.
     */
    public void processPending() {
        if (running()) throw new IllegalStateException("cannot process pending rules while running");
        clearStack();
    }

    /** Reduces {@code w} with the currently active rules; canonical only once confluent. */
    public String reduce(String w) {
        return codec.toExternal(rewriter.rewrite(codec.toInternal(w)));
    }

    /** Runs with the given bounds; the bounds stay in {@link #settings()} afterwards. */
    public void runBounded(long maxRules, long maxOverlap) {
        settings(settings.toBuilder().maxRules(maxRules).maxOverlap(maxOverlap).build());
        run();
    }

    public boolean equalTo(String u, String v) {
        codec.validate(u);
        codec.validate(v);
        if (u.equals(v)) return true;
        if (reduce(u).equals(reduce(v))) return true;
        run();
        return reduce(u).equals(reduce(v));
    }

    public String normalForm(String w) {
        codec.validate(w);
        run();
        return reduce(w);
    }

    /** Active rules as external {@code lhs = rhs} pairs, in insertion order. */
    public List<Relation> activeRules() {
        ArrayList<Relation> out = new ArrayList<>(active.size());
        for (Rule r : active) {
            out.add(Relation.of(codec.toExternal(r.lhs()), codec.toExternal(r.rhs())));
        }
        return out;
    }

    /** Pending candidates as external pairs, next to be drained first; not necessarily oriented. */
    public List<Relation> pendingRules() {
        ArrayList<Relation> out = new ArrayList<>(stack.size());
        for (Rule r : stack) {
            out.add(Relation.of(codec.toExternal(r.lhs()), codec.toExternal(r.rhs())));
        }
        return out;
    }

    public int activeRuleCount() {
        return active.size();
    }

    public int numberOfInactiveRules() {
        return inactive.size();
    }

    public int numberOfPendingRules() {
        return stack.size();
    }

    /** Rules defined since construction or the last {@link #init()}. */
    public long totalRules() {
        return totalRules;
    }

    public boolean confluenceKnown() {
        return confluence != Confluence.UNKNOWN;
    }

    public Confluence cachedConfluence() {
        return confluence;
    }

    public CompletionStatus status() {
        if (stack.isEmpty() && confluence == Confluence.CONFLUENT) return CompletionStatus.CONFLUENT;
        State s = state();
        if (s == State.NEVER_RUN) return CompletionStatus.NOT_STARTED;
        if (s == State.TIMED_OUT || s == State.STOPPED_BY_PREDICATE || s == State.INTERRUPTED) {
            return CompletionStatus.INTERRUPTED;
        }
        if (settings.bounded()) return CompletionStatus.BOUNDED;
        return CompletionStatus.INCOMPLETE;
    }

    // -------------------- Confluence --------------------

    /**
     * Checks every overlap of every ordered pair of active rules (self-pairs included) and
     * caches the answer until the next mutation. A scan cut short by a stop leaves it unknown.
     */
    public boolean confluent() {
        if (!stack.isEmpty()) return false;
        if (confluence == Confluence.UNKNOWN && !(running() && stopped())) {
            long seen = 0;
            long total = (long) active.size() * active.size();
            boolean aborted = false;

            scan:
            for (Rule rule1 = active.first(); rule1 != null; rule1 = rule1.next()) {
                String lhs1 = rule1.lhs();
                String rhs1 = rule1.rhs();
                // reverse order finds failures sooner
                for (Rule rule2 = active.last(); rule2 != null; rule2 = rule2.prev()) {
                    seen++;
                    String lhs2 = rule2.lhs();
                    for (int it = lhs1.length() - 1; it >= 0; --it) {
                        if (running() && stopped()) {
                            aborted = true;
                            break scan;
                        }
                        int k = Words.commonPrefixLength(lhs1, it, lhs2);
                        if (it + k == lhs1.length() || k == lhs2.length()) {
                            String word1 = lhs1.substring(0, it) + rule2.rhs() + lhs1.substring(it + k);
                            String word2 = rhs1 + lhs2.substring(k);
                            if (!word1.equals(word2)
                                    && !rewriter.rewrite(word1).equals(rewriter.rewrite(word2))) {
                                confluence = Confluence.NOT_CONFLUENT;
                                log.debug("kb.confluence.fail pairs={} rule1={} rule2={}", seen, rule1, rule2);
                                return false;
                            }
                        }
                    }
                }
                if (report()) {
                    log.info("kb.confluence checked {} pairs of overlaps out of {}", seen, total);
                }
            }
            confluence = aborted ? Confluence.UNKNOWN : Confluence.CONFLUENT;
        }
        return confluence == Confluence.CONFLUENT;
    }

    // -------------------- Completion --------------------

    @Override
    protected boolean finishedImpl() {
        return stack.isEmpty() && confluence == Confluence.CONFLUENT;
    }

    @Override
    protected void runImpl() {
        String runId = "kb-" + RUN_IDS.incrementAndGet();
        try (final CloseableThreadContext.Instance ctc = CloseableThreadContext.put("run", runId)) {
            long t0 = System.nanoTime();
            log.info("kb.run.start active={} pending={} {}", active.size(), stack.size(), settings);

            clearStack();
            if (stack.isEmpty() && confluent() && !halted()) {
                log.info("kb.run.skip the system is confluent already");
                return;
            }
            if (active.size() >= settings.maxRules) {
                log.info("kb.run.skip too many rules active={} maxRules={}", active.size(), settings.maxRules);
                return;
            }

            ActiveRules.Cursor outer = active.outer();
            ActiveRules.Cursor inner = active.inner();
            try {
                outer.set(active.first());
                long nr = 0;
                while (!outer.atEnd() && !halted()) {
                    Rule rule1 = outer.get();
                    inner.set(rule1);
                    outer.advance();

                    overlap(rule1, rule1);
                    while (!inner.atFirst() && rule1.active() && !halted()) {
                        inner.retreat();
                        Rule rule2 = inner.get();
                        overlap(rule1, rule2);
                        nr++;
                        if (rule1.active() && rule2.active()) {
                            nr++;
                            overlap(rule2, rule1);
                        }
                    }
                    if (nr > settings.checkConfluenceInterval) {
                        if (confluent()) break;
                        nr = 0;
                    }
                    if (outer.atEnd()) clearStack();
                }
            } finally {
                outer.set(null);
                inner.set(null);
            }

            if (!settings.bounded() && !stopped()) {
                confluence = Confluence.CONFLUENT;
                inactive.clear();
            }

            log.info("kb.run.stop status={} active={} inactive={} pending={} defined={} elapsedMs={}",
                    stopped() ? "stopped" : "done",
                    active.size(), inactive.size(), stack.size(), totalRules,
                    (System.nanoTime() - t0) / 1_000_000L);
        }
    }

    /**
     * Completion by increasing overlap length: runs with {@code maxOverlap = 1, 2, ...}
     * (confluence checks between runs only) until confluent. Settings are restored afterwards.
     */
    public void knuthBendixByOverlapLength() {
        CompletionSettings saved = settings;
        long t0 = System.nanoTime();
        settings(saved.toBuilder()
                .maxOverlap(1)
                .checkConfluenceInterval(CompletionSettings.UNBOUNDED)
                .build());
        try {
            while (!confluent()) {
                run();
                if (stopped() || active.size() >= settings.maxRules) break;
                if (settings.maxOverlap == CompletionSettings.UNBOUNDED - 1) break;
                settings(settings.toBuilder().maxOverlap(settings.maxOverlap + 1).build());
            }
        } finally {
            settings(saved);
        }
        log.info("kb.by-overlap-length done confluent={} active={} elapsedMs={}",
                confluence, active.size(), (System.nanoTime() - t0) / 1_000_000L);
    }

    // -------------------- Internals --------------------

    /** Polled stop condition: external stop, time budget, predicate or rule-count bound. */
    private boolean halted() {
        return running() && (stopped() || active.size() >= settings.maxRules);
    }

    private Rule newRule() {
        ++totalRules;
        Rule rule = inactive.pollFirst();
        if (rule != null) {
            rule.reset(totalRules);
        } else {
            rule = new Rule(totalRules);
        }
        return rule;
    }

    private void pushStack(Rule rule) {
        if (rule.active()) throw new IllegalStateException("pushing active rule " + rule);
        if (!rule.isTrivial()) {
            stack.push(rule);
            clearStack();
        } else {
            inactive.addLast(rule);
        }
    }

    /**
     * For every proper overlap {@code u.lhs = AB}, {@code v.lhs = BC} (B non-empty) within the
     * measure bound, derives {@code A·v.rhs = u.rhs·C}. Each derived rule is drained at once,
     * which may deactivate {@code u} or {@code v}; the scan is then abandoned (the survivor is
     * re-appended and paired again later).
     */
    private void overlap(Rule u, Rule v) {
        if (!u.active() || !v.active()) throw new IllegalStateException("overlap of inactive rules " + u + ", " + v);
        final String ul = u.lhs();
        final String vl = v.lhs();
        final long uGen = u.generation();
        final long vGen = v.generation();
        final long maxOverlap = settings.maxOverlap;
        final int limit = ul.length() - Math.min(ul.length(), vl.length());

        for (int it = ul.length() - 1;
             it > limit && uGen == u.generation() && vGen == v.generation() && !halted()
                     && (maxOverlap == CompletionSettings.UNBOUNDED || measure.measure(ul, vl, it) <= maxOverlap);
             --it) {
            if (Words.suffixIsPrefixOf(ul, it, vl)) {
                Rule rule = newRule();
                // A·Q_v -> Q_u·C, oriented when drained
                rule.set(ul.substring(0, it) + v.rhs(), u.rhs() + vl.substring(ul.length() - it));
                pushStack(rule);
            }
        }
    }

    private void clearStack() {
        while (!stack.isEmpty() && !halted()) {
            Rule rule1 = stack.pop();
            rule1.rewrite(rewriter);

            if (!rule1.isTrivial()) {
                String lhs = rule1.lhs();
                List<Rule> rhsToReduce = null;
                for (Rule rule2 = active.first(); rule2 != null; ) {
                    Rule next = rule2.next();
                    if (rule2.lhs().contains(lhs)) {
                        removeRule(rule2);
                        stack.push(rule2);
                    } else if (rule2.rhs().contains(lhs)) {
                        if (rhsToReduce == null) rhsToReduce = new ArrayList<>();
                        rhsToReduce.add(rule2);
                    }
                    rule2 = next;
                }
                // after eviction, so rule1's key cannot collide in the index
                activateRule(rule1);
                if (rhsToReduce != null) {
                    for (Rule r : rhsToReduce) r.rewriteRhs(rewriter);
                }
            } else {
                inactive.addLast(rule1);
            }

            if (report()) {
                log.info("kb.progress active={} inactive={} pending={} defined={}",
                        active.size(), inactive.size(), stack.size(), totalRules);
            }
        }
    }

    private void activateRule(Rule rule) {
        if (!Words.shortlexLess(rule.rhs(), rule.lhs())) {
            throw new IllegalStateException("rule does not reduce in shortlex order: " + rule);
        }
        index.insert(rule);
        active.append(rule);
        rewriter.noteLhsLength(rule.lhs().length());
        confluence = Confluence.UNKNOWN;
        checkIndex();
    }

    private void removeRule(Rule rule) {
        active.remove(rule);
        index.remove(rule);
        confluence = Confluence.UNKNOWN;
        checkIndex();
    }

    private void checkIndex() {
        if (index.size() != active.size()) {
            throw new IllegalStateException("index size " + index.size() + " != active rules " + active.size());
        }
    }
}
