package com.zzf.agentdock.tail;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class FileTailTrackerTest {

    @TempDir
    Path tempDir;

    private ObjectMapper mapper;
    private Path cursorFile;
    private Path transcript;

    @BeforeEach
    void setUp() {
        mapper = new ObjectMapper();
        cursorFile = tempDir.resolve("state/cursors.json");
        transcript = tempDir.resolve("session.jsonl");
    }

    @Test
    void readsOnlyCompleteLinesAndKeepsPartialTail() throws Exception {
        write("first\nsec");
        FileTailTracker tracker = newTracker();

        TailBatch batch = tracker.onChangeSignal(transcript).orElseThrow();
        assertEquals(List.of("first"), texts(batch.getLines()));
        assertEquals(0, batch.getStartOffset());
        assertTrue(batch.getCursor().hasPartialTail());
        assertEquals(6, batch.getCursor().committedOffset());
        tracker.commit(batch, "s1", "/p");

        append("ond\nthird\n");
        TailBatch next = tracker.onChangeSignal(transcript).orElseThrow();
        assertEquals(List.of("second", "third"), texts(next.getLines()));
        assertEquals(6, next.getStartOffset());
        assertEquals(6, next.getLines().get(0).getOffset());
        assertEquals(13, next.getLines().get(1).getOffset());
        assertFalse(next.getCursor().hasPartialTail());
    }

    @Test
    void unchangedFileYieldsNothing() throws Exception {
        write("a\n");
        FileTailTracker tracker = newTracker();
        tracker.commit(tracker.onChangeSignal(transcript).orElseThrow(), null, null);
        assertEquals(Optional.empty(), tracker.onChangeSignal(transcript));
    }

    @Test
    void uncommittedBatchIsReadAgain() throws Exception {
        write("a\n");
        FileTailTracker tracker = newTracker();
        tracker.onChangeSignal(transcript).orElseThrow();
        TailBatch again = tracker.onChangeSignal(transcript).orElseThrow();
        assertEquals(List.of("a"), texts(again.getLines()));
    }

    @Test
    void shrunkenFileRestartsFromZero() throws Exception {
        StringBuilder content = new StringBuilder();
        while (content.length() < 190) {
            content.append("{\"n\":").append(content.length()).append("}\n");
        }
        write(content.toString());
        long size = Files.size(transcript);
        assertTrue(size < 500);

        CursorStore store = new CursorStore(cursorFile, mapper);
        store.save(List.of(TranscriptCursor.restored(transcript, 500, "s1", null, false)));

        FileTailTracker tracker = new FileTailTracker(store);
        TailBatch batch = tracker.onChangeSignal(transcript).orElseThrow();
        assertTrue(batch.isTruncated());
        assertEquals(0, batch.getStartOffset());
        assertEquals(size, batch.getCursor().getOffset());
        assertEquals(content.toString().split("\n").length, batch.getLines().size());
    }

    @Test
    void seededFileIsSkippedThenBootstrapsIdentity() throws Exception {
        write("{\"header\":1}\n{\"old\":2}\n");
        FileTailTracker tracker = newTracker();

        assertEquals(1, tracker.seedExisting(List.of(transcript)));
        assertEquals(Optional.empty(), tracker.onChangeSignal(transcript));
        TranscriptCursor seeded = tracker.cursor(transcript).orElseThrow();
        assertTrue(seeded.isIgnoreExisting());
        assertEquals(Files.size(transcript), seeded.getOffset());

        append("{\"new\":3}\n");
        TailBatch batch = tracker.onChangeSignal(transcript).orElseThrow();
        assertEquals(List.of("{\"new\":3}"), texts(batch.getLines()));
        assertEquals(seeded.getOffset(), batch.getLines().get(0).getOffset());
        assertEquals("{\"header\":1}", batch.getBootstrapLine());
        assertFalse(batch.getCursor().isIgnoreExisting());
    }

    @Test
    void seedingOnlyReadsLinesAppendedAfterTheScan() throws Exception {
        StringBuilder history = new StringBuilder();
        for (int i = 0; i < 100; i++) {
            history.append("{\"n\":").append(i).append("}\n");
        }
        write(history.toString());
        FileTailTracker tracker = newTracker();
        tracker.seedExisting(List.of(transcript));

        append("{\"n\":100}\n");
        assertEquals(List.of("{\"n\":100}"), texts(tracker.onChangeSignal(transcript).orElseThrow().getLines()));
    }

    @Test
    void seedingKeepsExistingCursors() throws Exception {
        write("a\nb\n");
        FileTailTracker tracker = newTracker();
        TailBatch first = tracker.onChangeSignal(transcript).orElseThrow();
        tracker.commit(first, "s1", null);
        append("c\n");

        assertEquals(0, tracker.seedExisting(List.of(transcript, tempDir.resolve("absent.jsonl"))));
        assertFalse(tracker.cursor(transcript).orElseThrow().isIgnoreExisting());
        assertEquals(List.of("c"), texts(tracker.onChangeSignal(transcript).orElseThrow().getLines()));
    }

    @Test
    void fileWithoutCursorIsReadFromStart() throws Exception {
        write("{\"header\":1}\n");
        FileTailTracker tracker = newTracker();
        append("{\"next\":2}\n");

        TailBatch batch = tracker.onChangeSignal(transcript).orElseThrow();
        assertEquals(2, batch.getLines().size());
        assertNull(batch.getBootstrapLine());
    }

    @Test
    void multiByteCharacterSplitAcrossReadsIsPreserved() {
        byte[] line = "{\"t\":\"café 漢\"}\n".getBytes(StandardCharsets.UTF_8);
        int cut = line.length - 4;
        byte[] first = Arrays.copyOfRange(line, 0, cut);
        byte[] second = Arrays.copyOfRange(line, cut, line.length);

        List<TranscriptLine> out = new ArrayList<>();
        byte[] tail = TranscriptLine.split(new byte[0], 40, first, out);
        assertTrue(out.isEmpty());
        assertEquals(cut, tail.length);

        tail = TranscriptLine.split(tail, 40, second, out);
        assertEquals(List.of("{\"t\":\"café 漢\"}"), texts(out));
        assertEquals(40, out.get(0).getOffset());
        assertEquals(0, tail.length);
    }

    @Test
    void crlfAndBlankLinesAreDropped() {
        List<TranscriptLine> out = new ArrayList<>();
        TranscriptLine.split(new byte[0], 0, "a\r\n\r\n  \nb\n".getBytes(StandardCharsets.UTF_8), out);
        assertEquals(List.of("a", "b"), texts(out));
        assertEquals(8, out.get(1).getOffset());
    }

    @Test
    void committedCursorSurvivesRestartAndRereadsPartialLine() throws Exception {
        write("one\ntw");
        FileTailTracker tracker = newTracker();
        tracker.commit(tracker.onChangeSignal(transcript).orElseThrow(), "s1", "/work");

        FileTailTracker restarted = newTracker();
        TranscriptCursor restored = restarted.cursor(transcript).orElseThrow();
        assertEquals(4, restored.getOffset());
        assertEquals("s1", restored.getSessionId());
        assertEquals("/work", restored.getProjectPath());
        assertEquals(List.of("one"), texts(restarted.readCommittedLines(transcript)));

        append("o\n");
        assertEquals(List.of("two"), texts(restarted.onChangeSignal(transcript).orElseThrow().getLines()));
    }

    @Test
    void readAllIgnoresStoredCursor() throws Exception {
        write("a\nb\n");
        FileTailTracker tracker = newTracker();
        tracker.commit(tracker.onChangeSignal(transcript).orElseThrow(), null, null);

        TailBatch all = tracker.readAll(transcript);
        assertEquals(List.of("a", "b"), texts(all.getLines()));
        assertEquals(0, all.getStartOffset());
    }

    @Test
    void missingFileYieldsNothing() {
        FileTailTracker tracker = newTracker();
        assertEquals(Optional.empty(), tracker.onChangeSignal(tempDir.resolve("absent.jsonl")));
    }

    private FileTailTracker newTracker() {
        return new FileTailTracker(new CursorStore(cursorFile, mapper));
    }

    private static List<String> texts(List<TranscriptLine> lines) {
        return lines.stream().map(TranscriptLine::getText).collect(Collectors.toList());
    }

    private void write(String content) throws Exception {
        Files.write(transcript, content.getBytes(StandardCharsets.UTF_8));
    }

    private void append(String content) throws Exception {
        Files.write(transcript, content.getBytes(StandardCharsets.UTF_8), StandardOpenOption.APPEND);
    }
}
