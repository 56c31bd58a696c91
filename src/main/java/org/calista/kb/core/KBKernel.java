package org.calista.kb.core;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.calista.kb.completion.CompletionSettings;
import org.calista.kb.completion.KnuthBendix;
import org.calista.kb.completion.OverlapPolicy;
import org.calista.kb.events.EventStore;
import org.calista.kb.io.FileIO;
import org.calista.kb.presentation.StringPresentation;
import org.calista.kb.snapshot.RuleSetSnapshotStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * KBKernel — instance-owned runtime container.
 *
 * Lifecycle:
 *   1) build(config)  -> loadOrCreate config + init IO and stores
 *   2) openEngine()   -> restore from snapshot, or build from the configured presentation
 *   3) use            -> run / reduce / snapshot
 *
 * No static singletons.
 */
public final class KBKernel {

    private static final Logger log = LoggerFactory.getLogger(KBKernel.class);

    private final FileIO io;
    private final KBConfig cfg;

    private final EventStore events;
    private final RuleSetSnapshotStore snapshots;

    private KBKernel(FileIO io,
                     KBConfig cfg,
                     EventStore events,
                     RuleSetSnapshotStore snapshots) {
        this.io = Objects.requireNonNull(io, "io");
        this.cfg = Objects.requireNonNull(cfg, "cfg");
        this.events = Objects.requireNonNull(events, "events");
        this.snapshots = Objects.requireNonNull(snapshots, "snapshots");
    }

    // ---------------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------------

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {

        /**
         * Root directory where config lives.
         * Config is read before baseDir is known (baseDir is inside config).
         */
        private Path configRoot = Path.of(".");

        public Builder configRoot(Path configRoot) {
            this.configRoot = Objects.requireNonNull(configRoot, "configRoot");
            return this;
        }

        public KBKernel build(Path configFile) throws IOException {
            Objects.requireNonNull(configFile, "configFile");

            ObjectMapper om = defaultMapper();

            FileIO external = new FileIO(configRoot, StandardCharsets.UTF_8, true);
            Path cfgPath = configFile.isAbsolute() ? configFile : configRoot.resolve(configFile);

            KBConfig cfg = KBConfig.loadOrCreate(external, cfgPath, om);

            // relative baseDir lives next to the config root
            Path base = Path.of(cfg.baseDir);
            if (!base.isAbsolute()) base = configRoot.resolve(base);
            FileIO io = new FileIO(base, StandardCharsets.UTF_8, true);

            EventStore events = new EventStore(io, om, io.resolve(cfg.events.logFile));
            RuleSetSnapshotStore snapshots = new RuleSetSnapshotStore(io, om, io.resolve(cfg.snapshot.file));

            KBKernel k = new KBKernel(io, cfg, events, snapshots);
            log.info("KBKernel created: config={}, baseDir={}, alphabet=\"{}\", relations={}",
                    cfgPath, io.baseDir(), cfg.presentation.alphabet, cfg.presentation.rules.size());
            return k;
        }

        private static ObjectMapper defaultMapper() {
            ObjectMapper om = new ObjectMapper();
            om.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
            return om;
        }
    }

    // ---------------------------------------------------------------------
    // Engine
    // ---------------------------------------------------------------------

    /** Completion settings from the {@code completion} section; 0 bounds mean unbounded. */
    public CompletionSettings completionSettings() {
        KBConfig.Completion c = cfg.completion;
        return CompletionSettings.builder()
                .checkConfluenceInterval(c.checkConfluenceInterval)
                .maxOverlap(c.maxOverlap == 0 ? CompletionSettings.UNBOUNDED : c.maxOverlap)
                .maxRules(c.maxRules == 0 ? CompletionSettings.UNBOUNDED : c.maxRules)
                .overlapPolicy(OverlapPolicy.parse(c.overlapPolicy))
                .build();
    }

    /** Time budget of one run, or null to run until finished. */
    public Duration runBudget() {
        return cfg.completion.runForMs == 0 ? null : Duration.ofMillis(cfg.completion.runForMs);
    }

    public StringPresentation presentation() {
        StringPresentation.Builder b = StringPresentation.builder()
                .alphabet(cfg.presentation.alphabet)
                .containsEmptyWord(cfg.presentation.containsEmptyWord);
        for (List<String> pair : cfg.presentation.rules) {
            b.rule(pair.get(0), pair.get(1));
        }
        return b.build();
    }

    /**
     * Restores the engine from the snapshot when enabled and present, otherwise stages the
     * configured presentation. Configured settings are applied either way.
     */
    public KnuthBendix openEngine() throws IOException {
        KnuthBendix kb;
        if (cfg.snapshot.restoreOnStart && snapshots.exists()) {
            RuleSetSnapshotStore.Snapshot snap = snapshots.load();
            if (!snap.alphabet.equals(cfg.presentation.alphabet)) {
                log.warn("Snapshot alphabet \"{}\" differs from configured \"{}\"; using the snapshot",
                        snap.alphabet, cfg.presentation.alphabet);
            }
            kb = snap.restore();
            log.info("Engine restored from {} ({} rules)", snapshots.file(), kb.activeRuleCount());
        } else {
            kb = new KnuthBendix(presentation());
            log.info("Engine built from presentation ({} relations)", cfg.presentation.rules.size());
        }
        kb.settings(completionSettings());
        kb.reportEvery(Duration.ofMillis(cfg.completion.reportEveryMs));
        return kb;
    }

    // ---------------------------------------------------------------------
    // Accessors
    // ---------------------------------------------------------------------

    public FileIO io() { return io; }
    public KBConfig config() { return cfg; }
    public EventStore eventStore() { return events; }
    public RuleSetSnapshotStore snapshotStore() { return snapshots; }
}
