package org.calista.kb.io;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FileIOTest {

    @TempDir
    Path dir;

    private FileIO io;

    @BeforeEach
    void setUp() {
        io = new FileIO(dir.resolve("base"));
    }

    @Test
    void createsBaseDir() {
        assertTrue(Files.isDirectory(dir.resolve("base")));
        assertEquals(dir.resolve("base").toAbsolutePath().normalize(), io.baseDir());
    }

    @Test
    void writeAndReadString() throws IOException {
        Path f = io.resolve("sub/a.txt");
        io.writeString(f, "hello");
        assertEquals("hello", io.readString(f));
        assertFalse(Files.exists(f.resolveSibling("a.txt.tmp")));

        io.writeString(f, "again");
        assertEquals("again", io.readString(f));
        assertTrue(io.exists(f));
        assertFalse(io.exists(io.resolve("missing.txt")));
    }

    @Test
    void directWritesWithoutTempFile() throws IOException {
        FileIO direct = new FileIO(dir.resolve("direct"), StandardCharsets.UTF_8, false);
        Path f = direct.resolve("a.txt");
        FileIO.WriterHandle h = direct.openWriter(f);
        assertNull(h.tmpFile);
        h.writer.write("x");
        direct.commit(h);
        assertEquals("x", direct.readString(f));
    }

    @Test
    @DisplayName("resolve stays inside the base directory")
    void resolveRejectsTraversal() {
        assertThrows(IllegalArgumentException.class, () -> io.resolve("../escape.txt"));
        assertThrows(IllegalArgumentException.class, () -> io.resolve(dir.toAbsolutePath().toString()));
        assertEquals(io.baseDir().resolve("x/y.json"), io.resolve("x\\y.json"));
    }

    @Test
    void jsonlSkipsBlankLines() throws IOException {
        Path f = io.resolve("events/log.jsonl");
        io.appendJsonl(f, "{\"a\":1}");
        io.appendJsonl(f, "   ");
        io.appendJsonl(f, "  {\"a\":2}  ");
        Files.writeString(f, "\n\n", StandardCharsets.UTF_8, StandardOpenOption.APPEND);

        assertEquals(List.of("{\"a\":1}", "{\"a\":2}"), io.readJsonl(f));
    }

    @Test
    void commitReplacesTarget() throws IOException {
        Path f = io.resolve("snap.jsonl");
        io.writeString(f, "old");

        FileIO.WriterHandle h = io.openWriter(f);
        h.writer.write("new");
        assertEquals("old", io.readString(f));
        io.commit(h);

        assertEquals("new", io.readString(f));
        assertFalse(Files.exists(h.tmpFile));
    }

    @Test
    void rollbackKeepsTarget() throws IOException {
        Path f = io.resolve("snap.jsonl");
        io.writeString(f, "old");

        FileIO.WriterHandle h = io.openWriter(f);
        h.writer.write("partial");
        io.rollback(h);

        assertEquals("old", io.readString(f));
        assertFalse(Files.exists(h.tmpFile));
    }
}
