package org.calista.kb;

import org.calista.kb.completion.CompletionStatus;
import org.calista.kb.completion.KnuthBendix;
import org.calista.kb.events.KBEvent;
import org.calista.kb.presentation.StringPresentation;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class KBAppTest {

    @TempDir
    Path dir;

    private String session(KBApp app, String input) throws IOException {
        ByteArrayOutputStream buf = new ByteArrayOutputStream();
        try (PrintStream out = new PrintStream(buf, true, StandardCharsets.UTF_8)) {
            app.run(new ByteArrayInputStream(input.getBytes(StandardCharsets.UTF_8)), out);
        }
        return buf.toString(StandardCharsets.UTF_8);
    }

    @Test
    void completesAnswersQueriesAndSnapshots() throws IOException {
        KBApp app = new KBApp(dir, Path.of("kb.json"));
        String out = session(app, "abab\nbbbb\neq aaa 1\neq ab c\nabc\nstatus\nexit\n");

        assertEquals(CompletionStatus.CONFLUENT, app.engine().status());
        String[] answers = out.split("> ");
        assertEquals("1", answers[1].trim());
        assertEquals("b", answers[2].trim());
        assertEquals("true", answers[3].trim());
        assertTrue(answers[4].startsWith("error:"), answers[4]);
        assertTrue(answers[5].startsWith("error:"), answers[5]);
        assertTrue(answers[6].startsWith("CONFLUENT"), answers[6]);
        assertTrue(out.contains("Snapshot saved"));

        assertTrue(app.kernel().snapshotStore().exists());
        List<KBEvent> events = app.kernel().eventStore().readAll();
        assertEquals(KBEvent.RUN_START, events.get(0).type);
        assertEquals(KBEvent.RUN_STOP, events.get(1).type);
        assertTrue(events.get(1).text.startsWith("status=CONFLUENT"));
        assertEquals(KBEvent.SNAPSHOT, events.get(events.size() - 1).type);
    }

    @Test
    void secondSessionStartsFromTheSnapshot() throws IOException {
        KBApp first = new KBApp(dir, Path.of("kb.json"));
        session(first, "exit\n");

        KBApp second = new KBApp(dir, Path.of("kb.json"));
        session(second, "");
        assertEquals(first.engine().activeRules(), second.engine().activeRules());
    }

    private void writeConfig(String completion, String presentationRules) throws IOException {
        Files.writeString(dir.resolve("kb.json"), "{"
                + "\"completion\":{" + completion + "},"
                + "\"presentation\":{\"alphabet\":\"ab\",\"rules\":[" + presentationRules + "]}"
                + "}", StandardCharsets.UTF_8);
    }

    @Test
    @DisplayName("eq on an infinite system answers unknown once the run budget is spent")
    void eqHonoursTheRunBudget() throws IOException {
        writeConfig("\"runForMs\":200", "[\"aba\",\"bab\"]");
        KBApp app = new KBApp(dir, Path.of("kb.json"));
        String out = session(app, "eq a b\neq aba bab\nexit\n");

        String[] answers = out.split("> ");
        assertEquals("unknown", answers[1].trim());
        assertEquals("true", answers[2].trim());
        assertEquals(CompletionStatus.INTERRUPTED, app.engine().status());
    }

    @Test
    @DisplayName("a bounded session leaves pending relations that the next session still honours")
    void boundedSessionRestoresTheSameCongruence() throws IOException {
        String a4 = "[\"aaa\",\"\"],[\"bbb\",\"\"],[\"abab\",\"\"]";
        writeConfig("\"maxRules\":2", a4);
        KBApp first = new KBApp(dir, Path.of("kb.json"));
        session(first, "exit\n");
        assertEquals(CompletionStatus.BOUNDED, first.engine().status());
        assertTrue(first.engine().numberOfPendingRules() > 0);

        writeConfig("\"maxRules\":0", a4);
        KBApp second = new KBApp(dir, Path.of("kb.json"));
        String out = session(second, "abab\nbaba\nexit\n");

        String[] answers = out.split("> ");
        assertEquals("1", answers[1].trim());
        assertEquals("1", answers[2].trim());
        assertEquals(CompletionStatus.CONFLUENT, second.engine().status());

        KnuthBendix reference = new KnuthBendix(StringPresentation.builder().alphabet("ab")
                .rule("aaa", "").rule("bbb", "").rule("abab", "")
                .build());
        reference.run();
        assertEquals(Set.copyOf(reference.activeRules()), Set.copyOf(second.engine().activeRules()));
    }
}
