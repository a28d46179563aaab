package com.autonomous.ralph.worker;

import com.autonomous.ralph.protocol.*;
import com.autonomous.ralph.service.ProjectConfigService;
import com.autonomous.ralph.support.RecordingSink;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@EnabledOnOs({OS.LINUX, OS.MAC})
class ClaudeTaskRunnerTest {

    @TempDir
    Path tempDir;

    private Path projectDir;
    private ProjectConfigService projectConfigs;
    private ClaudeTaskRunner runner;
    private RecordingSink sink;
    private final ObjectMapper mapper = new ObjectMapper();

    @BeforeEach
    void setUp() throws IOException {
        projectDir = Files.createDirectory(tempDir.resolve("web"));
        Path configDir = Files.createDirectory(tempDir.resolve("projects"));
        Files.writeString(configDir.resolve("web.yaml"), "path: " + projectDir + "\n"
            + "structure:\n"
            + "  warnings:\n"
            + "    - Frontend lives in apps/site\n");

        projectConfigs = new ProjectConfigService();
        projectConfigs.setConfigPath(configDir.toString());
        projectConfigs.loadConfigs();

        runner = new ClaudeTaskRunner(projectConfigs, new GitService(), Clock.systemUTC(), mapper);
        sink = new RecordingSink();
    }

    @AfterEach
    void tearDown() {
        runner.shutdown();
    }

    private void fakeClaude(String body) throws IOException {
        Path script = tempDir.resolve("claude");
        Files.writeString(script, "#!/bin/sh\n" + body);
        assertTrue(script.toFile().setExecutable(true));
        runner.setClaudePath(script.toString());
    }

    private TaskAssignment assignment(long taskId, String project, String instruction) {
        return TaskAssignment.builder().taskId(taskId).project(project).instruction(instruction).build();
    }

    @Test
    void shouldStreamEventsAndCompleteSuccessfully() throws Exception {
        fakeClaude("printf '%s' \"$3\" > prompt.txt\n"
            + "echo '{\"type\":\"system\",\"session_id\":\"s-1\",\"model\":\"opus\",\"tools\":[\"Write\"]}'\n"
            + "echo '{\"type\":\"assistant\",\"message\":{\"content\":[{\"type\":\"tool_use\",\"name\":\"Write\",\"input\":{\"file_path\":\"out.txt\"}}]}}'\n"
            + "echo '{\"type\":\"user\",\"message\":{}}'\n"
            + "echo '{\"type\":\"result\",\"total_cost_usd\":0.12,\"num_turns\":1}'\n");

        assertTrue(runner.submit(assignment(1, "web", "add a footer"), sink));
        CompleteEvent complete = sink.await(MessageTypes.WORKER_COMPLETE, CompleteEvent.class, 20);

        assertTrue(complete.isSuccess());
        assertEquals(1, complete.getTurns());
        assertEquals(0.12, complete.getCost(), 1e-9);
        assertEquals(List.of("out.txt"), complete.getFilesWritten());
        assertNull(complete.getGit());
        assertEquals(List.of(MessageTypes.WORKER_START, MessageTypes.WORKER_INIT, MessageTypes.WORKER_TOOL,
            MessageTypes.WORKER_PROGRESS, MessageTypes.WORKER_COMPLETE), sink.types());

        String prompt = Files.readString(projectDir.resolve("prompt.txt"));
        assertTrue(prompt.startsWith("add a footer"));
        assertTrue(prompt.contains("- Frontend lives in apps/site"));

        JsonNode prd = mapper.readTree(projectDir.resolve("scripts/ralph/prd.json").toFile());
        assertTrue(prd.path("completed").asBoolean());
        assertEquals(1, prd.path("meta").path("taskId").asInt());
        assertEquals(0, prd.path("result").path("code").asInt());
    }

    @Test
    void shouldUseHubPromptWhenStructureWasSent() throws Exception {
        fakeClaude("printf '%s' \"$3\" > prompt.txt\n");
        TaskAssignment task = assignment(2, "web", "add a footer");
        task.setPrompt("add a footer\n\nKEY FILES:\n- page: index.html");
        task.setStructure(projectConfigs.getProject("web").orElseThrow().getStructure());

        runner.submit(task, sink);
        sink.await(MessageTypes.WORKER_COMPLETE, CompleteEvent.class, 20);

        assertEquals(task.getPrompt(), Files.readString(projectDir.resolve("prompt.txt")));
    }

    @Test
    void shouldReportFailureOnNonZeroExit() throws Exception {
        fakeClaude("echo 'not json at all'\necho 'boom' 1>&2\nexit 3\n");

        runner.submit(assignment(3, "web", "break things"), sink);
        CompleteEvent complete = sink.await(MessageTypes.WORKER_COMPLETE, CompleteEvent.class, 20);

        assertFalse(complete.isSuccess());
        List<LogEvent> logs = sink.payloads(MessageTypes.WORKER_LOG, LogEvent.class);
        assertTrue(logs.stream().anyMatch(l -> "raw".equals(l.getType()) && "not json at all".equals(l.getContent())));
        assertTrue(logs.stream().anyMatch(l -> "stderr".equals(l.getType()) && l.getContent().contains("boom")));
        JsonNode prd = mapper.readTree(projectDir.resolve("scripts/ralph/prd.json").toFile());
        assertFalse(prd.path("completed").asBoolean());
        assertEquals(3, prd.path("result").path("code").asInt());
    }

    @Test
    void shouldRejectSecondTaskWhileBusyAndCancelFirst() throws Exception {
        fakeClaude("exec sleep 30\n");

        assertTrue(runner.submit(assignment(4, "web", "long job"), sink));
        assertFalse(runner.submit(assignment(5, "web", "another job"), sink));
        assertEquals(5L, sink.single(MessageTypes.WORKER_BUSY, TaskRef.class).getTaskId());
        assertEquals(4L, runner.activeTaskId());

        sink.await(MessageTypes.WORKER_START, StartEvent.class, 10);
        assertFalse(runner.cancel(99));
        assertTrue(runner.cancel(4));
        CompleteEvent complete = sink.await(MessageTypes.WORKER_COMPLETE, CompleteEvent.class, 20);

        assertEquals(4L, complete.getTaskId());
        assertFalse(complete.isSuccess());
    }

    @Test
    void shouldKillRunThatExceedsTimeout() throws Exception {
        fakeClaude("exec sleep 30\n");
        runner.setTaskTimeout(Duration.ofMillis(300));

        runner.submit(assignment(6, "web", "slow job"), sink);
        CompleteEvent complete = sink.await(MessageTypes.WORKER_COMPLETE, CompleteEvent.class, 20);

        assertFalse(complete.isSuccess());
    }

    @Test
    void shouldReportUnknownProject() throws Exception {
        runner.submit(assignment(7, "mobile", "anything"), sink);

        ErrorEvent error = sink.await(MessageTypes.WORKER_ERROR, ErrorEvent.class, 10);
        assertEquals("Unknown project: mobile", error.getError());
        assertEquals(7L, error.getTaskId());
    }

    @Test
    void shouldReportSpawnFailure() throws Exception {
        runner.setClaudePath(tempDir.resolve("no-such-claude").toString());

        runner.submit(assignment(8, "web", "anything"), sink);

        ErrorEvent error = sink.await(MessageTypes.WORKER_ERROR, ErrorEvent.class, 10);
        assertTrue(error.getError().startsWith("Failed to spawn Claude Code: "));
        assertFalse(sink.types().contains(MessageTypes.WORKER_COMPLETE));
    }
}
