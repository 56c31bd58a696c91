package org.calista.kb.completion;

import java.time.Duration;
import java.util.Objects;
import java.util.function.BooleanSupplier;

/**
 * Runner — cooperative run/stop lifecycle shared by long-running algorithms.
 *
 * <p>Subclasses poll {@link #stopped()} from their inner loops. Stopping never rolls anything
 * back: the next {@code run*} call resumes from whatever state the previous one left.</p>
 */
public abstract class Runner {

    public enum State {
        NEVER_RUN,
        RUNNING_TO_FINISH,
        RUNNING_FOR,
        RUNNING_UNTIL,
        TIMED_OUT,
        STOPPED_BY_PREDICATE,
        INTERRUPTED,
        NOT_RUNNING
    }

    private volatile State state = State.NEVER_RUN;
    private volatile boolean stopRequested;

    private long startNanos;
    private long budgetNanos = Long.MAX_VALUE;
    private BooleanSupplier predicate;

    private long reportIntervalNanos = Duration.ofSeconds(1).toNanos();
    private long lastReportNanos = System.nanoTime();

    // -------------------- Run variants --------------------

    /** Runs until finished or stopped by {@link #requestStop()}. */
    public final void run() {
        if (finished()) return;
        begin(State.RUNNING_TO_FINISH, Long.MAX_VALUE, null);
    }

    /** Runs for at most {@code budget}; a timed-out run is resumable. */
    public final void runFor(Duration budget) {
        Objects.requireNonNull(budget, "budget");
        if (budget.isNegative()) throw new IllegalArgumentException("budget must be >= 0: " + budget);
        if (finished()) return;
        begin(State.RUNNING_FOR, budget.toNanos(), null);
    }

    /** Runs until {@code predicate} returns true (polled from the inner loops). */
    public final void runUntil(BooleanSupplier predicate) {
        Objects.requireNonNull(predicate, "predicate");
        if (finished()) return;
        begin(State.RUNNING_UNTIL, Long.MAX_VALUE, predicate);
    }

    private void begin(State mode, long budget, BooleanSupplier until) {
        this.stopRequested = false;
        this.budgetNanos = budget;
        this.predicate = until;
        this.startNanos = System.nanoTime();
        this.lastReportNanos = startNanos;
        this.state = mode;
        try {
            runImpl();
        } finally {
            this.state = terminalState();
            this.predicate = null;
        }
    }

    private State terminalState() {
        if (stopRequested) return State.INTERRUPTED;
        if (state == State.RUNNING_FOR && budgetExceeded()) return State.TIMED_OUT;
        if (state == State.RUNNING_UNTIL && predicate != null && predicate.getAsBoolean()) {
            return State.STOPPED_BY_PREDICATE;
        }
        return State.NOT_RUNNING;
    }

    // -------------------- Stop conditions --------------------

    /** Cooperative stop; safe to call from another thread. */
    public void requestStop() {
        stopRequested = true;
    }

    public State state() {
        return state;
    }

    public boolean running() {
        State s = state;
        return s == State.RUNNING_TO_FINISH || s == State.RUNNING_FOR || s == State.RUNNING_UNTIL;
    }

    public boolean timedOut() {
        State s = state;
        return s == State.TIMED_OUT || (s == State.RUNNING_FOR && budgetExceeded());
    }

    /**
     * While running: true once a stop was requested, the time budget ran out or the predicate fired.
     * While idle: true if the last run ended for one of those reasons.
     */
    public boolean stopped() {
        State s = state;
        switch (s) {
            case RUNNING_TO_FINISH:
                return stopRequested;
            case RUNNING_FOR:
                return stopRequested || budgetExceeded();
            case RUNNING_UNTIL:
                return stopRequested || (predicate != null && predicate.getAsBoolean());
            case TIMED_OUT:
            case STOPPED_BY_PREDICATE:
            case INTERRUPTED:
                return true;
            default:
                return false;
        }
    }

    public boolean finished() {
        return !running() && finishedImpl();
    }

    private boolean budgetExceeded() {
        return System.nanoTime() - startNanos >= budgetNanos;
    }

    // -------------------- Reporting --------------------

    public void reportEvery(Duration interval) {
        Objects.requireNonNull(interval, "interval");
        this.reportIntervalNanos = interval.toNanos();
    }

    public Duration reportInterval() {
        return Duration.ofNanos(reportIntervalNanos);
    }

    /** True at most once per report interval. */
    protected boolean report() {
        long now = System.nanoTime();
        if (now - lastReportNanos < reportIntervalNanos) return false;
        lastReportNanos = now;
        return true;
    }

    protected void resetRunner() {
        state = State.NEVER_RUN;
        stopRequested = false;
        predicate = null;
        budgetNanos = Long.MAX_VALUE;
    }

    protected abstract void runImpl();

    protected abstract boolean finishedImpl();
}
