package org.calista.kb.events;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.calista.kb.io.FileIO;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

public final class EventStore {
    private final FileIO io;
    private final ObjectMapper mapper;
    private final Path file;

    public EventStore(FileIO io, ObjectMapper mapper, Path file) {
        this.io = io;
        this.mapper = mapper;
        this.file = file;
    }

    public void append(KBEvent e) throws IOException {
        String line = mapper.writeValueAsString(e);
        io.appendJsonl(file, line);
    }

    public List<String> readAllRawLines() throws IOException {
        if (!io.exists(file)) return List.of();
        return io.readJsonl(file);
    }

    public List<KBEvent> readAll() throws IOException {
        List<String> lines = readAllRawLines();
        List<KBEvent> out = new ArrayList<>(lines.size());
        for (String line : lines) out.add(mapper.readValue(line, KBEvent.class));
        return out;
    }
}
