package org.calista.kb.snapshot;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.kb.completion.KnuthBendix;
import org.calista.kb.io.FileIO;
import org.calista.kb.presentation.Relation;
import org.calista.kb.presentation.StringPresentation;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.stream.Stream;

/**
 * RuleSetSnapshotStore — persist/load the active rules of a {@link KnuthBendix} engine.
 *
 * <p>Format: JSONL. The first line is the header
 * {@code {"_schema":"kb-rules-jsonl-v1","alphabet":"...","containsEmptyWord":bool,"confluent":bool}},
 * then one {@link RuleRecord} per active rule in insertion order, then one {@code "pending":true}
 * row per candidate still on the stack, next-to-drain first. Written atomically through
 * {@link FileIO}.</p>
 *
 * <p>Loading is strict: a missing header or a broken row fails the whole load, since a rule set
 * with a rule dropped presents a different monoid.</p>
 */
public final class RuleSetSnapshotStore {

    private static final Logger log = LogManager.getLogger(RuleSetSnapshotStore.class);

    public static final String SCHEMA = "kb-rules-jsonl-v1";

    private final ObjectMapper mapper;
    private final FileIO io;
    private final Path snapshotFile;

    public RuleSetSnapshotStore(FileIO io, ObjectMapper mapper, Path snapshotFile) {
        this.io = Objects.requireNonNull(io, "io");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.snapshotFile = Objects.requireNonNull(snapshotFile, "snapshotFile");
    }

    public Path file() {
        return snapshotFile;
    }

    public boolean exists() {
        return io.exists(snapshotFile);
    }

    /**
     * Writes the engine's active rules followed by its pending candidates, so that an
     * interrupted or bounded engine restores to the same congruence.
     *
     * @return number of rows written (active and pending)
     */
    public int save(KnuthBendix kb) throws IOException {
        Objects.requireNonNull(kb, "kb");
        if (kb.running()) throw new IllegalStateException("cannot snapshot a running engine");

        List<Relation> rules = kb.activeRules();
        List<Relation> pending = kb.pendingRules();
        boolean confluent = pending.isEmpty() && kb.confluenceKnown() && kb.confluent();

        ObjectNode header = mapper.createObjectNode();
        header.put("_schema", SCHEMA);
        header.put("alphabet", kb.alphabet());
        header.put("containsEmptyWord", kb.presentation().containsEmptyWord());
        header.put("confluent", confluent);

        FileIO.WriterHandle h = io.openWriter(snapshotFile);
        try {
            h.writer.write(mapper.writeValueAsString(header));
            h.writer.newLine();
            for (Relation r : rules) {
                h.writer.write(mapper.writeValueAsString(RuleRecord.of(r.lhs, r.rhs)));
                h.writer.newLine();
            }
            for (Relation r : pending) {
                h.writer.write(mapper.writeValueAsString(RuleRecord.pending(r.lhs, r.rhs)));
                h.writer.newLine();
            }
            io.commit(h);
        } catch (IOException | RuntimeException e) {
            io.rollback(h);
            if (e instanceof IOException) throw (IOException) e;
            throw new IOException("Failed to save snapshot: " + snapshotFile, e);
        }
        log.info("kb.snapshot.save file={} rules={} pending={} confluent={}",
                snapshotFile, rules.size(), pending.size(), confluent);
        return rules.size() + pending.size();
    }

    public Snapshot load() throws IOException {
        String alphabet = null;
        boolean containsEmptyWord = true;
        boolean confluent = false;
        List<RuleRecord> records = new ArrayList<>();

        try (Stream<String> lines = io.jsonlStream(snapshotFile)) {
            Iterator<String> it = lines.iterator();
            int lineNo = 0;
            while (it.hasNext()) {
                String line = it.next();
                lineNo++;
                if (lineNo == 1) {
                    JsonNode header = parse(line, lineNo);
                    if (!SCHEMA.equals(header.path("_schema").asText(null))) {
                        throw new IOException(snapshotFile + ":1: expected schema " + SCHEMA + ", got " + line);
                    }
                    JsonNode a = header.get("alphabet");
                    if (a == null || !a.isTextual()) {
                        throw new IOException(snapshotFile + ":1: header without alphabet");
                    }
                    alphabet = a.asText();
                    containsEmptyWord = header.path("containsEmptyWord").asBoolean(true);
                    confluent = header.path("confluent").asBoolean(false);
                    continue;
                }
                try {
                    RuleRecord r = mapper.readValue(line, RuleRecord.class);
                    if (r == null) throw new IllegalArgumentException("null row");
                    r.validate();
                    records.add(r);
                } catch (JsonProcessingException | IllegalArgumentException rowErr) {
                    throw new IOException(snapshotFile + ":" + lineNo + ": broken rule row: " + rowErr.getMessage(), rowErr);
                }
            }
        }
        if (alphabet == null) throw new IOException("empty snapshot: " + snapshotFile);

        log.debug("kb.snapshot.load file={} rules={} confluent={}", snapshotFile, records.size(), confluent);
        return new Snapshot(alphabet, containsEmptyWord, records, confluent);
    }

    /**
     * Loads the snapshot and rebuilds an engine over the same congruence. Without pending rows
     * its active rules (and their order) equal the saved ones. The saved rows become the
     * engine's presentation.
     *
     * @throws org.calista.kb.presentation.InvalidSymbolException if a rule uses a letter outside the saved alphabet
     */
    public KnuthBendix restore() throws IOException {
        return load().restore();
    }

    // -------------------- Snapshot --------------------

    public static final class Snapshot {
        public final String alphabet;
        public final boolean containsEmptyWord;
        public final List<RuleRecord> records;
        public final boolean confluent;

        public Snapshot(String alphabet, boolean containsEmptyWord, List<RuleRecord> records, boolean confluent) {
            this.alphabet = Objects.requireNonNull(alphabet, "alphabet");
            this.containsEmptyWord = containsEmptyWord;
            this.records = Collections.unmodifiableList(new ArrayList<>(records));
            this.confluent = confluent;
        }

        public long pendingCount() {
            return records.stream().filter(r -> r.pending).count();
        }

        /** Active rows first, then pending rows; staging drains them in this order. */
        public StringPresentation presentation() {
            StringPresentation.Builder b = StringPresentation.builder()
                    .alphabet(alphabet)
                    .containsEmptyWord(containsEmptyWord);
            for (RuleRecord r : records) b.rule(r.lhs, r.rhs);
            return b.build();
        }

        /** Drains every row, pending ones included, without searching overlaps. */
        public KnuthBendix restore() {
            KnuthBendix kb = new KnuthBendix(presentation());
            kb.processPending();
            long pending = pendingCount();
            if (pending == 0 && kb.activeRuleCount() != records.size()) {
                log.warn("kb.snapshot.restore rule set was not reduced: saved={} active={}",
                        records.size(), kb.activeRuleCount());
            }
            if (confluent && !kb.confluent()) {
                log.warn("kb.snapshot.restore saved as confluent but the restored rules are not");
            }
            return kb;
        }
    }

    private JsonNode parse(String line, int lineNo) throws IOException {
        try {
            return mapper.readTree(line);
        } catch (JsonProcessingException e) {
            throw new IOException(snapshotFile + ":" + lineNo + ": " + e.getOriginalMessage(), e);
        }
    }
}
