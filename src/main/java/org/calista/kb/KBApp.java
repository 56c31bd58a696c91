package org.calista.kb;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.kb.completion.CompletionStatus;
import org.calista.kb.completion.KnuthBendix;
import org.calista.kb.core.KBKernel;
import org.calista.kb.events.KBEvent;
import org.calista.kb.presentation.InvalidSymbolException;
import org.calista.kb.presentation.Relation;

import java.io.IOException;
import java.io.PrintStream;
import java.io.InputStream;
import java.nio.file.Path;
import java.time.Duration;
import java.util.NoSuchElementException;
import java.util.Scanner;

/**
 * KBApp — console runner.
 *
 * Lifecycle:
 *  1) build kernel (config, IO, stores)
 *  2) open the engine (snapshot or presentation)
 *  3) complete under the configured budget, snapshot
 *  4) answer queries until 'exit'
 *
 * Queries: a word (reduce it), {@code eq u v}, {@code rules}, {@code status}, {@code run}.
 * {@code eq} completes under the same budget as {@code run} and answers "unknown" if that
 * is not enough.
 */
public final class KBApp {

    private static final Logger log = LogManager.getLogger(KBApp.class);

    private final Path configRoot;
    private final Path cfgPath;
    private KBKernel kernel;
    private KnuthBendix kb;
    private long runs;

    public static void main(String[] args) throws Exception {
        Path cfg = Path.of(args.length > 0 ? args[0] : "config/kb.json");
        new KBApp(cfg).run(System.in, System.out);
    }

    public KBApp(Path cfgPath) {
        this(Path.of("."), cfgPath);
    }

    public KBApp(Path configRoot, Path cfgPath) {
        this.configRoot = configRoot;
        this.cfgPath = cfgPath;
    }

    public void run(InputStream in, PrintStream out) throws IOException {
        kernel = KBKernel.builder()
                .configRoot(configRoot)
                .build(cfgPath);
        kb = kernel.openEngine();

        complete();
        if (kernel.config().snapshot.saveOnStop) snapshot();

        runConsoleLoop(in, out);
    }

    /** One completion pass under the configured budget. */
    CompletionStatus complete() throws IOException {
        String runId = "run-" + (++runs);
        kernel.eventStore().append(KBEvent.of(KBEvent.RUN_START, runId,
                "active=" + kb.activeRuleCount() + " pending=" + kb.numberOfPendingRules(),
                System.currentTimeMillis()));

        Duration budget = kernel.runBudget();
        if (kernel.config().completion.byOverlapLength) {
            kb.knuthBendixByOverlapLength();
        } else if (budget != null) {
            kb.runFor(budget);
        } else {
            kb.run();
        }

        CompletionStatus status = kb.status();
        log.info("Completion {}: active={} inactive={} defined={}",
                status, kb.activeRuleCount(), kb.numberOfInactiveRules(), kb.totalRules());
        kernel.eventStore().append(KBEvent.of(KBEvent.RUN_STOP, runId,
                "status=" + status + " active=" + kb.activeRuleCount() + " defined=" + kb.totalRules(),
                System.currentTimeMillis()));
        return status;
    }

    private void snapshot() throws IOException {
        int n = kernel.snapshotStore().save(kb);
        kernel.eventStore().append(KBEvent.of(KBEvent.SNAPSHOT, "run-" + runs,
                kernel.snapshotStore().file().getFileName() + " rules=" + n, System.currentTimeMillis()));
    }

    private void runConsoleLoop(InputStream in, PrintStream out) throws IOException {
        log.info("KB ready. alphabet=\"{}\" rules={} status={} baseDir={}",
                kb.alphabet(), kb.activeRuleCount(), kb.status(), kernel.io().baseDir());
        log.info("Type 'exit' to quit.");

        Scanner sc = new Scanner(in);
        while (true) {
            out.print("> ");
            String line;
            try {
                line = sc.nextLine();
            } catch (NoSuchElementException eof) {
                break;
            }

            line = line.trim();
            if (line.equalsIgnoreCase("exit")) break;

            try {
                if (line.equals("rules")) {
                    for (Relation r : kb.activeRules()) out.println("  " + show(r.lhs) + " -> " + show(r.rhs));
                } else if (line.equals("status")) {
                    out.println(kb.status() + " active=" + kb.activeRuleCount() + " pending=" + kb.numberOfPendingRules());
                } else if (line.equals("run")) {
                    out.println(complete());
                } else if (line.startsWith("eq ")) {
                    String[] w = line.substring(3).trim().split("\\s+", -1);
                    if (w.length != 2) {
                        out.println("usage: eq <u> <v>");
                    } else {
                        out.println(equal(word(w[0]), word(w[1])));
                    }
                } else {
                    out.println(show(kb.reduce(word(line))));
                }
            } catch (InvalidSymbolException e) {
                out.println("error: " + e.getMessage());
            }
        }

        if (kernel.config().snapshot.saveOnStop) {
            snapshot();
            out.println("Bye. Snapshot saved.");
        }
    }

    /** "true" or "false"; "unknown" when the configured budget runs out before completion. */
    private String equal(String u, String v) throws IOException {
        if (kb.reduce(u).equals(kb.reduce(v))) return "true";
        if (!kb.finished()) complete();
        if (!kb.finished()) return "unknown";
        return String.valueOf(kb.reduce(u).equals(kb.reduce(v)));
    }

    // "1" stands for the empty word
    private static String word(String s) {
        return s.equals("1") ? "" : s;
    }

    private static String show(String w) {
        return w.isEmpty() ? "1" : w;
    }

    KnuthBendix engine() { return kb; }

    KBKernel kernel() { return kernel; }
}
