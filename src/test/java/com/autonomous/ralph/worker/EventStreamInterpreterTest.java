package com.autonomous.ralph.worker;

import com.autonomous.ralph.protocol.*;
import com.autonomous.ralph.support.MutableClock;
import com.autonomous.ralph.support.RecordingSink;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class EventStreamInterpreterTest {

    private MutableClock clock;
    private RecordingSink sink;
    private EventStreamInterpreter interpreter;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2026-01-10T10:00:00Z");
        sink = new RecordingSink();
        interpreter = new EventStreamInterpreter(7, "web", sink, clock, new ObjectMapper());
    }

    @Test
    void shouldEmitInitFromSystemEvent() {
        interpreter.accept("{\"type\":\"system\",\"session_id\":\"s-1\",\"model\":\"opus\",\"tools\":[\"Read\",\"Edit\"]}");

        InitEvent init = sink.single(MessageTypes.WORKER_INIT, InitEvent.class);
        assertEquals(7L, init.getTaskId());
        assertEquals("web", init.getProject());
        assertEquals("s-1", init.getSessionId());
        assertEquals("opus", init.getModel());
        assertEquals(List.of("Read", "Edit"), init.getTools());
        assertEquals("s-1", interpreter.state().getSessionId());
    }

    @Test
    void shouldReportToolsAndTrackFiles() {
        clock.advance(Duration.ofSeconds(12));
        interpreter.accept("{\"type\":\"assistant\",\"message\":{\"content\":["
            + "{\"type\":\"tool_use\",\"name\":\"Read\",\"input\":{\"file_path\":\"/srv/web/src/app.ts\"}},"
            + "{\"type\":\"tool_use\",\"name\":\"Edit\",\"input\":{\"file_path\":\"/srv/web/src/app.ts\"}},"
            + "{\"type\":\"tool_use\",\"name\":\"Read\",\"input\":{\"file_path\":\"/srv/web/src/app.ts\"}},"
            + "{\"type\":\"tool_use\",\"name\":\"Glob\",\"input\":{\"pattern\":\"**/*.ts\"}},"
            + "{\"type\":\"tool_use\",\"name\":\"TodoWrite\",\"input\":{}}"
            + "]}}");

        List<ToolEvent> tools = sink.payloads(MessageTypes.WORKER_TOOL, ToolEvent.class);
        assertEquals(5, tools.size());
        assertEquals("Read", tools.get(0).getTool());
        assertEquals("/srv/web/src/app.ts", tools.get(0).getFile());
        assertEquals(12, tools.get(0).getElapsed());
        assertEquals("**/*.ts", tools.get(3).getFile());
        assertNull(tools.get(4).getFile());

        TaskRunState state = interpreter.state();
        assertEquals(List.of("/srv/web/src/app.ts"), state.getFilesRead());
        assertEquals(List.of("/srv/web/src/app.ts"), state.getFilesEdited());
        assertTrue(state.getFilesWritten().isEmpty());
    }

    @Test
    void shouldEmitOnlySubstantialThoughtsTruncated() {
        String longText = "x".repeat(800);
        interpreter.accept("{\"type\":\"assistant\",\"message\":{\"content\":["
            + "{\"type\":\"text\",\"text\":\"Okay.\"},"
            + "{\"type\":\"text\",\"text\":\"" + "y".repeat(30) + "\"},"
            + "{\"type\":\"text\",\"text\":\"" + longText + "\"}"
            + "]}}");

        ThoughtEvent thought = sink.single(MessageTypes.WORKER_THOUGHT, ThoughtEvent.class);
        assertEquals(500, thought.getContent().length());
    }

    @Test
    void shouldCountTurnsAndReportProgress() {
        interpreter.accept("{\"type\":\"assistant\",\"message\":{\"content\":["
            + "{\"type\":\"tool_use\",\"name\":\"Write\",\"input\":{\"path\":\"notes.md\"}}],"
            + "\"usage\":{\"input_tokens\":100,\"output_tokens\":20}}}");
        interpreter.accept("{\"type\":\"user\",\"message\":{}}");
        interpreter.accept("{\"type\":\"assistant\",\"message\":{\"content\":[],"
            + "\"usage\":{\"input_tokens\":50,\"output_tokens\":5}}}");
        interpreter.accept("{\"type\":\"user\",\"message\":{}}");

        List<ProgressEvent> progress = sink.payloads(MessageTypes.WORKER_PROGRESS, ProgressEvent.class);
        assertEquals(2, progress.size());
        ProgressEvent last = progress.get(1);
        assertEquals(2, last.getTurns());
        assertEquals(150, last.getTokensIn());
        assertEquals(25, last.getTokensOut());
        assertEquals(1, last.getFilesWritten());
        assertEquals(0, last.getFilesRead());
    }

    @Test
    void shouldReportFileReadResults() {
        interpreter.accept("{\"type\":\"user\",\"tool_use_result\":{\"file\":{\"filePath\":\"/srv/web/a.ts\",\"numLines\":42}}}");
        interpreter.accept("{\"type\":\"user\",\"tool_use_result\":{\"file\":{\"filePath\":\"/srv/web/b.ts\",\"totalLines\":7}}}");

        List<FileEvent> files = sink.payloads(MessageTypes.WORKER_FILE, FileEvent.class);
        assertEquals(2, files.size());
        assertEquals("read", files.get(0).getAction());
        assertEquals("/srv/web/a.ts", files.get(0).getPath());
        assertEquals(42, files.get(0).getLines());
        assertEquals(7, files.get(1).getLines());
        assertEquals(List.of(MessageTypes.WORKER_PROGRESS, MessageTypes.WORKER_FILE,
            MessageTypes.WORKER_PROGRESS, MessageTypes.WORKER_FILE), sink.types());
    }

    @Test
    void shouldTakeFinalFiguresFromResult() {
        interpreter.accept("{\"type\":\"assistant\",\"message\":{\"content\":[],"
            + "\"usage\":{\"input_tokens\":10,\"output_tokens\":1}}}");
        interpreter.accept("{\"type\":\"result\",\"total_cost_usd\":0.42,\"num_turns\":9,"
            + "\"usage\":{\"input_tokens\":1200,\"output_tokens\":300}}");

        TaskRunState state = interpreter.state();
        assertEquals(0.42, state.getCost(), 1e-9);
        assertEquals(9, state.getTurns());
        assertEquals(1200, state.getTokensIn());
        assertEquals(300, state.getTokensOut());
        assertTrue(sink.emitted().isEmpty());
    }

    @Test
    void shouldFallBackToLegacyCostField() {
        interpreter.accept("{\"type\":\"result\",\"cost_usd\":0.05}");

        assertEquals(0.05, interpreter.state().getCost(), 1e-9);
    }

    @Test
    void shouldForwardNonJsonAsRawLogAndKeepGoing() {
        interpreter.accept("Warning: something odd {");
        interpreter.accept("42");
        interpreter.accept("{\"type\":\"user\"}");

        List<LogEvent> logs = sink.payloads(MessageTypes.WORKER_LOG, LogEvent.class);
        assertEquals(2, logs.size());
        assertEquals("raw", logs.get(0).getType());
        assertEquals("Warning: something odd {", logs.get(0).getContent());
        assertEquals(1, interpreter.state().getTurns());
    }

    @Test
    void shouldIgnoreUnknownEventTypes() {
        interpreter.accept("{\"type\":\"stream_event\",\"delta\":\"x\"}");

        assertTrue(sink.emitted().isEmpty());
    }
}
