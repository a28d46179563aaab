package com.autonomous.ralph.worker;

import com.autonomous.ralph.protocol.*;
import com.autonomous.ralph.service.ProjectConfigService;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.test.util.ReflectionTestUtils;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class WorkerAgentTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private ClaudeTaskRunner taskRunner;
    private TerminalHost terminalHost;
    private TaskScheduler scheduler;
    private WorkerAgent agent;
    private WebSocketSession session;

    @BeforeEach
    void setUp() {
        ProjectConfigService projectConfigs = mock(ProjectConfigService.class);
        when(projectConfigs.getProjectNames()).thenReturn(List.of("web", "api"));
        taskRunner = mock(ClaudeTaskRunner.class);
        terminalHost = mock(TerminalHost.class);
        scheduler = mock(TaskScheduler.class);

        agent = new WorkerAgent(projectConfigs, taskRunner, terminalHost, scheduler, mapper, Clock.systemUTC());
        ReflectionTestUtils.setField(agent, "workerName", "ws-01");

        session = mock(WebSocketSession.class);
        when(session.getId()).thenReturn("s1");
        when(session.isOpen()).thenReturn(true);
    }

    private List<JsonNode> sentFrames() throws Exception {
        ArgumentCaptor<TextMessage> sent = ArgumentCaptor.forClass(TextMessage.class);
        verify(session, atLeastOnce()).sendMessage(sent.capture());
        List<JsonNode> frames = new ArrayList<>();
        for (TextMessage message : sent.getAllValues()) {
            frames.add(mapper.readTree(message.getPayload()));
        }
        return frames;
    }

    private void receive(String json) {
        agent.handleTextMessage(session, new TextMessage(json));
    }

    @Test
    void shouldBackOffExponentiallyUpToThirtySeconds() {
        assertEquals(Duration.ofSeconds(2), WorkerAgent.backoff(0));
        assertEquals(Duration.ofSeconds(2), WorkerAgent.backoff(1));
        assertEquals(Duration.ofSeconds(4), WorkerAgent.backoff(2));
        assertEquals(Duration.ofSeconds(8), WorkerAgent.backoff(3));
        assertEquals(Duration.ofSeconds(16), WorkerAgent.backoff(4));
        assertEquals(Duration.ofSeconds(30), WorkerAgent.backoff(5));
        assertEquals(Duration.ofSeconds(30), WorkerAgent.backoff(50));
    }

    @Test
    void shouldRegisterOnConnect() throws Exception {
        agent.afterConnectionEstablished(session);

        JsonNode register = sentFrames().get(0);
        assertEquals("ralph:worker:register", register.path("type").asText());
        assertEquals("ws-01", register.path("data").path("hostname").asText());
        assertEquals("web", register.path("data").path("projects").get(0).asText());
        assertEquals(3, register.path("data").path("capabilities").size());
        assertTrue(agent.isConnected());
    }

    @Test
    void shouldHandTasksAndCancelsToRunner() {
        agent.afterConnectionEstablished(session);

        receive("{\"type\":\"ralph:task\",\"data\":{\"taskId\":3,\"project\":\"web\",\"instruction\":\"fix\",\"prompt\":\"fix\"}}");
        receive("{\"type\":\"ralph:cancel\",\"data\":{\"taskId\":3}}");

        verify(taskRunner).submit(argThat(a -> a.getTaskId() == 3L && "web".equals(a.getProject())), same(agent));
        verify(taskRunner).cancel(3L);
    }

    @Test
    void shouldAnswerPingWithActiveTask() throws Exception {
        when(taskRunner.activeTaskId()).thenReturn(3L);
        agent.afterConnectionEstablished(session);

        receive("{\"type\":\"ping\",\"data\":{}}");

        JsonNode pong = sentFrames().get(1);
        assertEquals("pong", pong.path("type").asText());
        assertEquals(3, pong.path("data").path("activeTask").asInt());
    }

    @Test
    void shouldRouteTerminalFramesToHost() {
        agent.afterConnectionEstablished(session);

        receive("{\"type\":\"terminal:create\",\"data\":{\"sessionId\":\"term-1\",\"cwd\":\"/srv\"}}");
        receive("{\"type\":\"terminal:input\",\"data\":{\"sessionId\":\"term-1\",\"data\":\"ls\\r\"}}");
        receive("{\"type\":\"terminal:resize\",\"data\":{\"sessionId\":\"term-1\",\"cols\":90,\"rows\":20}}");
        receive("{\"type\":\"terminal:close\",\"data\":{\"sessionId\":\"term-1\"}}");

        verify(terminalHost).create(argThat(s -> "term-1".equals(s.getSessionId()) && "/srv".equals(s.getCwd())), same(agent));
        verify(terminalHost).input(argThat(d -> "ls\r".equals(d.getData())));
        verify(terminalHost).resize(argThat(r -> r.getCols() == 90));
        verify(terminalHost).close("term-1");
    }

    @Test
    void shouldIgnoreMalformedFrames() {
        receive("{{{");
        receive("{\"type\":\"ralph:unknown\"}");

        verifyNoInteractions(taskRunner, terminalHost);
    }

    @Test
    void shouldDropEventsWhileDisconnected() throws Exception {
        agent.emit(MessageTypes.WORKER_LOG, new LogEvent(1L, "raw", "x"));

        verify(session, never()).sendMessage(any());
        assertFalse(agent.isConnected());
    }

    @Test
    void shouldCloseTerminalsAndScheduleReconnectOnDisconnect() {
        agent.afterConnectionEstablished(session);

        agent.afterConnectionClosed(session, CloseStatus.SERVER_ERROR);

        verify(terminalHost).closeAll();
        verify(scheduler).schedule(any(Runnable.class), any(Instant.class));
        assertFalse(agent.isConnected());
    }

    @Test
    void shouldNotReconnectAfterStop() {
        agent.afterConnectionEstablished(session);

        agent.stop();
        agent.afterConnectionClosed(session, CloseStatus.GOING_AWAY);

        verify(scheduler, never()).schedule(any(Runnable.class), any(Instant.class));
    }
}
