package org.calista.kb.snapshot;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.calista.kb.completion.KnuthBendix;
import org.calista.kb.io.FileIO;
import org.calista.kb.presentation.InvalidSymbolException;
import org.calista.kb.presentation.StringPresentation;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class RuleSetSnapshotStoreTest {

    @TempDir
    Path dir;

    private FileIO io;
    private ObjectMapper mapper;
    private RuleSetSnapshotStore store;

    @BeforeEach
    void setUp() {
        io = new FileIO(dir);
        mapper = new ObjectMapper();
        store = new RuleSetSnapshotStore(io, mapper, io.resolve("rules.snapshot.jsonl"));
    }

    private static KnuthBendix s3() {
        return new KnuthBendix(StringPresentation.builder().alphabet("xy")
                .rule("xx", "").rule("yyy", "").rule("xyxy", "")
                .build());
    }

    private static List<String> corpus() {
        List<String> out = new ArrayList<>();
        out.add("");
        for (int i = 0; out.size() < 500; i++) {
            out.add(out.get(i) + "x");
            out.add(out.get(i) + "y");
        }
        return out;
    }

    @Test
    @DisplayName("restored engine reduces every word exactly like the saved one")
    void roundTripPreservesReduce() throws IOException {
        KnuthBendix kb = s3();
        kb.run();
        assertEquals(kb.activeRuleCount(), store.save(kb));

        KnuthBendix restored = store.restore();

        assertEquals("xy", restored.alphabet());
        assertEquals(kb.activeRules(), restored.activeRules());
        assertTrue(restored.confluent());
        for (String w : corpus()) {
            assertEquals(kb.reduce(w), restored.reduce(w), w);
        }
    }

    @Test
    void headerCarriesSchemaAlphabetAndConfluence() throws IOException {
        KnuthBendix kb = s3();
        kb.run();
        store.save(kb);

        List<String> lines = io.readJsonl(store.file());
        assertEquals(kb.activeRuleCount() + 1, lines.size());
        assertEquals("kb-rules-jsonl-v1", mapper.readTree(lines.get(0)).get("_schema").asText());
        assertEquals("xy", mapper.readTree(lines.get(0)).get("alphabet").asText());
        assertTrue(mapper.readTree(lines.get(0)).get("confluent").asBoolean());

        RuleSetSnapshotStore.Snapshot snap = store.load();
        assertTrue(snap.confluent);
        assertEquals(kb.activeRuleCount(), snap.records.size());
    }

    @Test
    void unfinishedEngineIsSavedAsNotConfluent() throws IOException {
        KnuthBendix kb = s3();
        kb.runBounded(2, Long.MAX_VALUE);
        int rows = store.save(kb);

        RuleSetSnapshotStore.Snapshot snap = store.load();
        assertFalse(snap.confluent);
        assertEquals(kb.activeRuleCount() + kb.numberOfPendingRules(), rows);
        assertEquals(rows, snap.records.size());
        assertEquals(kb.numberOfPendingRules(), snap.pendingCount());

        KnuthBendix restored = snap.restore();
        kb.runBounded(Long.MAX_VALUE, Long.MAX_VALUE);
        restored.run();
        assertEquals(Set.copyOf(kb.activeRules()), Set.copyOf(restored.activeRules()));
    }

    @Test
    @DisplayName("candidates still pending are saved and restored with the active rules")
    void interruptedEngineKeepsItsPendingRules() throws IOException {
        KnuthBendix kb = new KnuthBendix(StringPresentation.builder().alphabet("ab")
                .rule("aaa", "").rule("bbb", "").rule("abab", "")
                .build());
        kb.runFor(Duration.ZERO);
        assertEquals(0, kb.activeRuleCount());
        assertEquals(3, kb.numberOfPendingRules());

        assertEquals(3, store.save(kb));
        List<String> lines = io.readJsonl(store.file());
        assertTrue(mapper.readTree(lines.get(1)).get("pending").asBoolean());
        assertFalse(mapper.readTree(lines.get(0)).get("confluent").asBoolean());

        KnuthBendix restored = store.restore();
        kb.run();
        restored.run();
        assertEquals("", restored.reduce("aaa"));
        for (String w : corpus()) {
            assertEquals(kb.reduce(w.replace('x', 'a').replace('y', 'b')),
                    restored.reduce(w.replace('x', 'a').replace('y', 'b')), w);
        }
    }

    @Test
    void activeRowsOmitThePendingFlag() throws IOException {
        KnuthBendix kb = s3();
        kb.run();
        store.save(kb);
        for (String line : io.readJsonl(store.file()).subList(1, kb.activeRuleCount() + 1)) {
            assertFalse(mapper.readTree(line).has("pending"), line);
        }
    }

    @Test
    void semigroupPresentationStaysASemigroup() throws IOException {
        KnuthBendix kb = new KnuthBendix(StringPresentation.builder().alphabet("ab")
                .containsEmptyWord(false)
                .rule("aa", "a").rule("bb", "b").rule("ab", "ba")
                .build());
        kb.run();
        store.save(kb);

        assertFalse(mapper.readTree(io.readJsonl(store.file()).get(0)).get("containsEmptyWord").asBoolean());
        RuleSetSnapshotStore.Snapshot snap = store.load();
        assertFalse(snap.containsEmptyWord);
        KnuthBendix restored = snap.restore();
        assertFalse(restored.presentation().containsEmptyWord());
        assertEquals(kb.activeRules(), restored.activeRules());
    }

    @Test
    void headerWithoutEmptyWordFlagMeansMonoid() throws IOException {
        io.writeString(store.file(), String.join("\n",
                "{\"_schema\":\"kb-rules-jsonl-v1\",\"alphabet\":\"ab\",\"confluent\":false}",
                "{\"lhs\":\"aa\",\"rhs\":\"\"}",
                ""));
        assertTrue(store.load().containsEmptyWord);
    }

    @Test
    void brokenRowFailsTheLoadWithItsLineNumber() throws IOException {
        io.writeString(store.file(), String.join("\n",
                "{\"_schema\":\"kb-rules-jsonl-v1\",\"alphabet\":\"ab\",\"confluent\":false}",
                "{\"lhs\":\"aa\",\"rhs\":\"\"}",
                "{\"lhs\":\"bb\"",
                ""));
        IOException e = assertThrows(IOException.class, () -> store.load());
        assertTrue(e.getMessage().contains(":3:"), e.getMessage());
    }

    @Test
    void missingSchemaIsRejected() throws IOException {
        io.writeString(store.file(), "{\"lhs\":\"aa\",\"rhs\":\"\"}\n");
        assertThrows(IOException.class, () -> store.load());
    }

    @Test
    void trivialRowIsRejected() throws IOException {
        io.writeString(store.file(), String.join("\n",
                "{\"_schema\":\"kb-rules-jsonl-v1\",\"alphabet\":\"ab\",\"confluent\":false}",
                "{\"lhs\":\"ab\",\"rhs\":\"ab\"}",
                ""));
        assertThrows(IOException.class, () -> store.load());
    }

    @Test
    void letterOutsideTheSavedAlphabetIsRejectedOnRestore() throws IOException {
        io.writeString(store.file(), String.join("\n",
                "{\"_schema\":\"kb-rules-jsonl-v1\",\"alphabet\":\"ab\",\"confluent\":false}",
                "{\"lhs\":\"ac\",\"rhs\":\"\"}",
                ""));
        assertThrows(InvalidSymbolException.class, () -> store.restore());
    }
}
