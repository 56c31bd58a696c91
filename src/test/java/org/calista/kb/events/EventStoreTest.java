package org.calista.kb.events;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.calista.kb.io.FileIO;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class EventStoreTest {

    @TempDir
    Path dir;

    @Test
    void appendsAndReadsBackInOrder() throws IOException {
        FileIO io = new FileIO(dir);
        EventStore store = new EventStore(io, new ObjectMapper(), io.resolve("events.jsonl"));

        assertTrue(store.readAll().isEmpty());

        store.append(KBEvent.of(KBEvent.RUN_START, "run-1", "active=0", 10L));
        store.append(KBEvent.of(KBEvent.RUN_STOP, "run-1", "status=CONFLUENT", 20L));

        List<KBEvent> events = store.readAll();
        assertEquals(2, events.size());
        assertEquals(KBEvent.RUN_START, events.get(0).type);
        assertEquals("run-1", events.get(1).runId);
        assertEquals("status=CONFLUENT", events.get(1).text);
        assertEquals(20L, events.get(1).tsEpochMs);
        assertTrue(store.readAllRawLines().get(0).contains("\"type\":\"RUN_START\""));
    }
}
