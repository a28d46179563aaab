package com.autonomous.ralph.worker;

import com.autonomous.ralph.protocol.*;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Turns Claude Code's {@code --output-format stream-json} lines into worker events.
 *
 * <p>Feed it one complete line at a time, in stream order. A line that is not JSON is
 * forwarded as a raw log entry and does not stop the run.
 */
@Slf4j
public class EventStreamInterpreter {

    static final int THOUGHT_MIN_LENGTH = 30;
    static final int THOUGHT_MAX_LENGTH = 500;

    private final long taskId;
    private final String project;
    private final WorkerEventSink sink;
    private final Clock clock;
    private final ObjectMapper mapper;
    private final TaskRunState state;

    public EventStreamInterpreter(long taskId, String project, WorkerEventSink sink, Clock clock, ObjectMapper mapper) {
        this.taskId = taskId;
        this.project = project;
        this.sink = sink;
        this.clock = clock;
        this.mapper = mapper;
        this.state = new TaskRunState(clock.instant());
    }

    public TaskRunState state() {
        return state;
    }

    public void accept(String line) {
        JsonNode event;
        try {
            event = mapper.readTree(line);
        } catch (JsonProcessingException e) {
            log.debug("[raw] {}", abbreviate(line, 150));
            sink.emit(MessageTypes.WORKER_LOG, new LogEvent(taskId, "raw", line));
            return;
        }
        if (event == null || !event.isObject()) {
            sink.emit(MessageTypes.WORKER_LOG, new LogEvent(taskId, "raw", line));
            return;
        }

        String type = event.path("type").asText("");
        switch (type) {
            case "system" -> onSystem(event);
            case "assistant" -> onAssistant(event);
            case "user" -> onUser(event);
            case "result" -> onResult(event);
            default -> log.debug("Ignoring stream event type '{}'", type);
        }
    }

    /**
     * Whole seconds since the run started.
     */
    public long elapsed() {
        return Duration.between(state.getStartedAt(), clock.instant()).getSeconds();
    }

    private void onSystem(JsonNode event) {
        state.setSessionId(textOrNull(event, "session_id"));
        state.setModel(textOrNull(event, "model"));
        log.info("Session: {}, Model: {}", state.getSessionId(), state.getModel());

        List<String> tools = new ArrayList<>();
        event.path("tools").forEach(tool -> tools.add(tool.asText()));
        sink.emit(MessageTypes.WORKER_INIT,
            new InitEvent(taskId, project, state.getSessionId(), state.getModel(), tools));
    }

    private void onAssistant(JsonNode event) {
        JsonNode message = event.path("message");
        for (JsonNode block : message.path("content")) {
            String blockType = block.path("type").asText("");
            if ("tool_use".equals(blockType)) {
                onToolUse(block);
            } else if ("text".equals(blockType)) {
                String text = block.path("text").asText("");
                if (text.length() > THOUGHT_MIN_LENGTH) {
                    sink.emit(MessageTypes.WORKER_THOUGHT,
                        new ThoughtEvent(taskId, project, abbreviateExact(text, THOUGHT_MAX_LENGTH), elapsed()));
                }
            }
        }

        JsonNode usage = message.path("usage");
        if (usage.isObject()) {
            state.addTokens(usage.path("input_tokens").asLong(0), usage.path("output_tokens").asLong(0));
        }
    }

    private void onToolUse(JsonNode block) {
        String tool = block.path("name").asText("");
        JsonNode input = block.path("input");
        String file = firstText(input, "file_path", "path", "pattern");
        if (file != null) {
            state.recordToolFile(tool, file);
        }
        log.info("{}{}", tool, file != null ? ": " + shortPath(file) : "");
        sink.emit(MessageTypes.WORKER_TOOL, new ToolEvent(taskId, project, tool, file, elapsed()));
    }

    private void onUser(JsonNode event) {
        state.incrementTurns();
        long elapsed = elapsed();
        sink.emit(MessageTypes.WORKER_PROGRESS, ProgressEvent.builder()
            .taskId(taskId)
            .project(project)
            .turns(state.getTurns())
            .tokensIn(state.getTokensIn())
            .tokensOut(state.getTokensOut())
            .filesRead(state.getFilesRead().size())
            .filesWritten(state.getFilesWritten().size())
            .filesEdited(state.getFilesEdited().size())
            .elapsed(elapsed)
            .build());

        JsonNode file = event.path("tool_use_result").path("file");
        if (file.isObject()) {
            Integer lines = null;
            if (file.hasNonNull("numLines")) {
                lines = file.get("numLines").asInt();
            } else if (file.hasNonNull("totalLines")) {
                lines = file.get("totalLines").asInt();
            }
            sink.emit(MessageTypes.WORKER_FILE,
                new FileEvent(taskId, project, "read", textOrNull(file, "filePath"), lines, elapsed));
        }
    }

    private void onResult(JsonNode event) {
        if (event.hasNonNull("total_cost_usd")) {
            state.setCost(event.get("total_cost_usd").asDouble());
        } else if (event.hasNonNull("cost_usd")) {
            state.setCost(event.get("cost_usd").asDouble());
        }
        if (event.hasNonNull("num_turns")) {
            state.setTurns(event.get("num_turns").asInt());
        }
        JsonNode usage = event.path("usage");
        if (usage.hasNonNull("input_tokens")) {
            state.setTokensIn(usage.get("input_tokens").asLong());
        }
        if (usage.hasNonNull("output_tokens")) {
            state.setTokensOut(usage.get("output_tokens").asLong());
        }
        log.info("Cost: ${}", String.format("%.4f", state.getCost()));
    }

    private static String firstText(JsonNode node, String... fields) {
        for (String field : fields) {
            String value = textOrNull(node, field);
            if (value != null && !value.isEmpty()) {
                return value;
            }
        }
        return null;
    }

    private static String textOrNull(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value != null && !value.isNull() ? value.asText() : null;
    }

    private static String shortPath(String file) {
        String[] parts = file.split("[/\\\\]");
        return parts.length <= 2 ? file : parts[parts.length - 2] + "/" + parts[parts.length - 1];
    }

    private static String abbreviateExact(String text, int max) {
        return text.length() <= max ? text : text.substring(0, max);
    }

    private static String abbreviate(String text, int max) {
        return text.length() <= max ? text : text.substring(0, max) + "...";
    }
}
