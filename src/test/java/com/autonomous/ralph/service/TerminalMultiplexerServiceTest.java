package com.autonomous.ralph.service;

import com.autonomous.ralph.model.RelayEventType;
import com.autonomous.ralph.model.TerminalOptions;
import com.autonomous.ralph.model.TerminalSession;
import com.autonomous.ralph.protocol.*;
import com.autonomous.ralph.support.FakeWorkerChannel;
import com.autonomous.ralph.support.MutableClock;
import com.autonomous.ralph.support.RecordingObserver;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.scheduling.TaskScheduler;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class TerminalMultiplexerServiceTest {

    @Mock
    private TaskScheduler scheduler;

    private MutableClock clock;
    private WorkerRegistry registry;
    private RecordingObserver observer;
    private TerminalMultiplexerService terminals;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2026-01-10T10:00:00Z");
        registry = new WorkerRegistry(clock);
        RelayBroadcaster relay = new RelayBroadcaster();
        observer = new RecordingObserver("dashboard");
        relay.register(observer);
        terminals = new TerminalMultiplexerService(registry, relay, scheduler, clock);
        terminals.setAutoCommandDelayMs(2000);
    }

    private FakeWorkerChannel connect(String connectionId) {
        FakeWorkerChannel channel = new FakeWorkerChannel(connectionId);
        registry.register(channel, "host-" + connectionId, List.of("web"), List.of("terminal"));
        return channel;
    }

    @Test
    void shouldFailWithoutWorker() {
        assertThrows(NoWorkerConnectedException.class, () -> terminals.createSession(new TerminalOptions()));
        assertFalse(terminals.hasWorker());
        assertTrue(terminals.sessions().isEmpty());
    }

    @Test
    void shouldBindSessionToFirstRegisteredWorker() {
        FakeWorkerChannel first = connect("c1");
        FakeWorkerChannel second = connect("c2");

        String sessionId = terminals.createSession(TerminalOptions.builder().cwd("/src").title("Build").build());

        assertTrue(sessionId.matches("term-" + clock.millis() + "-[0-9a-z]{6}"));
        TerminalSpec spec = first.lastPayload(MessageTypes.TERMINAL_CREATE, TerminalSpec.class);
        assertEquals(sessionId, spec.getSessionId());
        assertEquals("/src", spec.getCwd());
        assertTrue(second.sent().isEmpty());
        assertEquals("c1", terminals.session(sessionId).orElseThrow().getWorkerConnectionId());
    }

    @Test
    void shouldGenerateUniqueIdsUnderConcurrency() throws Exception {
        connect("c1");
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Future<String>> futures = new ArrayList<>();
            for (int i = 0; i < 200; i++) {
                futures.add(pool.submit(() -> terminals.createSession(null)));
            }
            Set<String> ids = ConcurrentHashMap.newKeySet();
            for (Future<String> future : futures) {
                ids.add(future.get(5, TimeUnit.SECONDS));
            }
            assertEquals(200, ids.size());
            assertEquals(200, terminals.sessions().size());
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void shouldRouteInputResizeAndCloseToOwningWorker() {
        FakeWorkerChannel channel = connect("c1");
        String sessionId = terminals.createSession(null);

        terminals.input(new TerminalData(sessionId, "ls\r"));
        terminals.resize(new TerminalResize(sessionId, 100, 40));
        terminals.close(sessionId);

        assertEquals(List.of(MessageTypes.TERMINAL_CREATE, MessageTypes.TERMINAL_INPUT,
            MessageTypes.TERMINAL_RESIZE, MessageTypes.TERMINAL_CLOSE), channel.sentTypes());
        assertEquals("ls\r", channel.lastPayload(MessageTypes.TERMINAL_INPUT, TerminalData.class).getData());
        // Still listed until the worker confirms
        assertTrue(terminals.session(sessionId).isPresent());
    }

    @Test
    void shouldDropInputForUnknownSession() {
        FakeWorkerChannel channel = connect("c1");

        terminals.input(new TerminalData("term-0-nope00", "ls\r"));

        assertTrue(channel.sent().isEmpty());
    }

    @Test
    void shouldBroadcastWorkerNotifications() {
        connect("c1");
        String sessionId = terminals.createSession(TerminalOptions.builder().title("Shell").build());

        terminals.onCreated("c1", new TerminalSpec(sessionId, null, "Shell", null, null));
        terminals.onOutput("c1", new TerminalData(sessionId, "$ "));
        terminals.onClosed("c1", new TerminalClosed(sessionId, 0));

        assertEquals(List.of(RelayEventType.TERMINAL_CREATED, RelayEventType.TERMINAL_OUTPUT,
            RelayEventType.TERMINAL_CLOSED), observer.types());
        assertTrue(terminals.session(sessionId).isEmpty());
        verifyNoInteractions(scheduler);
    }

    @Test
    void shouldIgnoreFramesFromWorkerThatDoesNotOwnSession() {
        connect("c1");
        connect("c2");
        String sessionId = terminals.createSession(null);

        terminals.onOutput("c2", new TerminalData(sessionId, "spoofed"));
        terminals.onClosed("c2", new TerminalClosed(sessionId, 0));

        assertTrue(observer.events().isEmpty());
        assertTrue(terminals.session(sessionId).isPresent());
    }

    @Test
    void shouldDropSessionOnWorkerError() {
        connect("c1");
        String sessionId = terminals.createSession(null);

        terminals.onError("c1", new TerminalError(sessionId, "no shell"));

        assertEquals(List.of(RelayEventType.TERMINAL_ERROR), observer.types());
        assertTrue(terminals.session(sessionId).isEmpty());
    }

    @Test
    void shouldRunAutoCommandAfterDelay() {
        FakeWorkerChannel channel = connect("c1");
        String sessionId = terminals.createSession(TerminalOptions.builder().autoCommand("claude").build());

        terminals.onCreated("c1", new TerminalSpec(sessionId, null, null, null, "claude"));

        ArgumentCaptor<Runnable> task = ArgumentCaptor.forClass(Runnable.class);
        verify(scheduler).schedule(task.capture(), eq(Instant.parse("2026-01-10T10:00:02Z")));
        assertEquals(List.of(MessageTypes.TERMINAL_CREATE), channel.sentTypes());

        task.getValue().run();

        assertEquals("claude\r", channel.lastPayload(MessageTypes.TERMINAL_INPUT, TerminalData.class).getData());
    }

    @Test
    void shouldSkipAutoCommandWhenSessionClosedFirst() {
        FakeWorkerChannel channel = connect("c1");
        String sessionId = terminals.createSession(TerminalOptions.builder().autoCommand("npm run dev").build());
        terminals.onCreated("c1", new TerminalSpec(sessionId, null, null, null, "npm run dev"));
        ArgumentCaptor<Runnable> task = ArgumentCaptor.forClass(Runnable.class);
        verify(scheduler).schedule(task.capture(), any(Instant.class));

        terminals.onClosed("c1", new TerminalClosed(sessionId, 0));
        task.getValue().run();

        assertFalse(channel.sentTypes().contains(MessageTypes.TERMINAL_INPUT));
    }

    @Test
    void shouldCloseSessionsOfDisconnectedWorker() {
        connect("c1");
        String sessionId = terminals.createSession(null);

        terminals.onWorkerDisconnected("c1");

        assertTrue(terminals.sessions().isEmpty());
        assertEquals(List.of(RelayEventType.TERMINAL_CLOSED), observer.types());
        TerminalClosed closed = (TerminalClosed) observer.events().get(0).getData();
        assertEquals(sessionId, closed.getSessionId());
        assertNull(closed.getExitCode());
    }

    @Test
    void shouldListSessionsInCreationOrder() {
        connect("c1");
        String first = terminals.createSession(null);
        clock.advance(Duration.ofSeconds(1));
        String second = terminals.createSession(null);

        List<String> ids = terminals.sessions().stream().map(TerminalSession::getSessionId).toList();

        assertEquals(List.of(first, second), ids);
    }
}
