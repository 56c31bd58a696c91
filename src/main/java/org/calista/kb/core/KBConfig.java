package org.calista.kb.core;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.calista.kb.completion.OverlapPolicy;
import org.calista.kb.io.FileIO;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * KBConfig — plain POJO config:
 * - defaults in fields
 * - loadOrCreate() writes the default file when it is missing
 * - validate() normalizes values
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class KBConfig {

    private static final Logger log = LoggerFactory.getLogger(KBConfig.class);

    public String baseDir = "data";
    public Completion completion = new Completion();
    public Snapshot snapshot = new Snapshot();
    public Events events = new Events();
    public Presentation presentation = new Presentation();

    // -------------------- Sections --------------------

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Completion {
        public long checkConfluenceInterval = 4096;

        /** 0 => unbounded. */
        public long maxOverlap = 0;

        /** 0 => unbounded. */
        public long maxRules = 0;

        /** ABC, AB_BC or MAX_AB_BC. */
        public String overlapPolicy = "ABC";

        /** Time budget of one console run, 0 => until finished. */
        public long runForMs = 0;

        public boolean byOverlapLength = false;

        public long reportEveryMs = 1000;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Snapshot {
        public String file = "rules.snapshot.jsonl";

        /** Restore the engine from the snapshot file when it exists. */
        public boolean restoreOnStart = true;

        public boolean saveOnStop = true;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Events {
        public String logFile = "events.jsonl";
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Presentation {
        public String alphabet = "ab";

        /** Relations as [lhs, rhs] pairs. */
        public List<List<String>> rules = defaultRules();

        public boolean containsEmptyWord = true;

        private static List<List<String>> defaultRules() {
            List<List<String>> r = new ArrayList<>();
            r.add(List.of("aaa", ""));
            r.add(List.of("bbb", ""));
            r.add(List.of("abab", ""));
            return r;
        }
    }

    // -------------------- Load / Create --------------------

    /**
     * Loads the config. A missing or blank file is replaced with defaults written to disk.
     */
    public static KBConfig loadOrCreate(FileIO io, Path configFile, ObjectMapper mapper) throws IOException {
        Objects.requireNonNull(io, "io");
        Objects.requireNonNull(configFile, "configFile");
        Objects.requireNonNull(mapper, "mapper");

        String json;
        try {
            json = io.readString(configFile);
        } catch (NoSuchFileException e) {
            KBConfig created = new KBConfig();
            created.validate();
            writePretty(io, configFile, mapper, created);
            log.info("Config file not found. Created default config at {}", configFile);
            return created;
        }

        if (json == null || json.isBlank()) {
            KBConfig created = new KBConfig();
            created.validate();
            writePretty(io, configFile, mapper, created);
            log.warn("Config file {} is empty. Recreated defaults.", configFile);
            return created;
        }

        KBConfig cfg = mapper.readValue(json, KBConfig.class);
        if (cfg == null) cfg = new KBConfig();

        cfg.validate();
        return cfg;
    }

    public static void save(FileIO io, Path configFile, ObjectMapper mapper, KBConfig cfg) throws IOException {
        Objects.requireNonNull(io, "io");
        Objects.requireNonNull(configFile, "configFile");
        Objects.requireNonNull(mapper, "mapper");
        Objects.requireNonNull(cfg, "cfg");

        cfg.validate();
        writePretty(io, configFile, mapper, cfg);
    }

    private static void writePretty(FileIO io, Path configFile, ObjectMapper mapper, KBConfig cfg) throws IOException {
        String out = mapper.writerWithDefaultPrettyPrinter().writeValueAsString(cfg);
        io.writeString(configFile, out + System.lineSeparator());
    }

    // -------------------- Validation / Normalization --------------------

    public void validate() {
        if (baseDir == null || baseDir.isBlank()) baseDir = "data";

        if (completion == null) completion = new Completion();
        if (completion.checkConfluenceInterval < 1) completion.checkConfluenceInterval = 4096;
        if (completion.maxOverlap < 0) completion.maxOverlap = 0;
        if (completion.maxRules < 0) completion.maxRules = 0;
        if (completion.runForMs < 0) completion.runForMs = 0;
        if (completion.reportEveryMs < 1) completion.reportEveryMs = 1000;
        completion.overlapPolicy = OverlapPolicy.parse(completion.overlapPolicy).name();

        if (snapshot == null) snapshot = new Snapshot();
        if (snapshot.file == null || snapshot.file.isBlank()) snapshot.file = "rules.snapshot.jsonl";

        if (events == null) events = new Events();
        if (events.logFile == null || events.logFile.isBlank()) events.logFile = "events.jsonl";

        if (presentation == null) presentation = new Presentation();
        if (presentation.alphabet == null) presentation.alphabet = "";
        if (presentation.rules == null) presentation.rules = new ArrayList<>();
        for (int i = 0; i < presentation.rules.size(); i++) {
            List<String> pair = presentation.rules.get(i);
            if (pair == null || pair.size() != 2 || pair.get(0) == null || pair.get(1) == null) {
                throw new IllegalArgumentException("presentation.rules[" + i + "] must be a [lhs, rhs] pair: " + pair);
            }
        }
    }
}
