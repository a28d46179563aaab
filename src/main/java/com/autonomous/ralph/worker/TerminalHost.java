package com.autonomous.ralph.worker;

import com.autonomous.ralph.protocol.*;
import com.pty4j.PtyProcess;
import com.pty4j.PtyProcessBuilder;
import com.pty4j.WinSize;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Service;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Local shell sessions driven by the hub.
 *
 * <p>Each shell runs on its own pseudo-terminal, so input is handled by the terminal line
 * discipline exactly as typed ({@code \r} submits a line) and resizes reach the shell as
 * window size changes. Each session has one reader thread that forwards output and then
 * reports the exit, which keeps {@code closed} after the last output frame.
 */
@Slf4j
@Service
@Profile("worker")
public class TerminalHost {

    private static final int DEFAULT_COLS = 120;
    private static final int DEFAULT_ROWS = 30;

    @Value("${ralph.worker.shell:}")
    private String shell;

    private final Map<String, Session> sessions = new ConcurrentHashMap<>();
    private final ExecutorService readers = Executors.newCachedThreadPool(r -> {
        Thread thread = new Thread(r, "terminal-io");
        thread.setDaemon(true);
        return thread;
    });

    public void setShell(String shell) {
        this.shell = shell;
    }

    public void create(TerminalSpec spec, WorkerEventSink sink) {
        String sessionId = spec.getSessionId();
        log.info("[Terminal] Creating session: {}{}{}", sessionId,
            spec.getTitle() != null ? " (" + spec.getTitle() + ")" : "",
            spec.getAutoCommand() != null ? " [auto: " + spec.getAutoCommand() + "]" : "");
        if (sessionId == null || sessions.containsKey(sessionId)) {
            sink.emit(MessageTypes.TERMINAL_ERROR, new TerminalError(sessionId, "Invalid or duplicate session id"));
            return;
        }

        File workingDir = resolveCwd(spec.getCwd());
        Map<String, String> env = new HashMap<>(System.getenv());
        env.put("TERM", "xterm-256color");

        PtyProcess process;
        try {
            process = new PtyProcessBuilder(shellCommand().toArray(new String[0]))
                .setDirectory(workingDir.getPath())
                .setEnvironment(env)
                .setInitialColumns(DEFAULT_COLS)
                .setInitialRows(DEFAULT_ROWS)
                .setRedirectErrorStream(true)
                .start();
        } catch (IOException e) {
            log.error("[Terminal] Failed to create session: {}", e.getMessage());
            sink.emit(MessageTypes.TERMINAL_ERROR, new TerminalError(sessionId, e.getMessage()));
            return;
        }

        Session session = new Session(process);
        sessions.put(sessionId, session);
        sink.emit(MessageTypes.TERMINAL_CREATED, new TerminalSpec(sessionId, workingDir.getPath(),
            spec.getTitle(), spec.getPreset(), spec.getAutoCommand()));
        log.info("[Terminal] Session {} created in {}", sessionId, workingDir);

        readers.execute(() -> pump(sessionId, session, sink));
    }

    public void input(TerminalData input) {
        Session session = sessions.get(input.getSessionId());
        if (session == null || input.getData() == null) {
            return;
        }
        try {
            OutputStream stdin = session.process.getOutputStream();
            stdin.write(input.getData().getBytes(StandardCharsets.UTF_8));
            stdin.flush();
        } catch (IOException e) {
            log.warn("[Terminal] Write to {} failed: {}", input.getSessionId(), e.getMessage());
        }
    }

    public void resize(TerminalResize resize) {
        Session session = sessions.get(resize.getSessionId());
        if (session == null) return;
        if (resize.getCols() <= 0 || resize.getRows() <= 0) {
            log.debug("[Terminal] Ignoring resize of {} to {}x{}", resize.getSessionId(), resize.getCols(), resize.getRows());
            return;
        }
        try {
            session.process.setWinSize(new WinSize(resize.getCols(), resize.getRows()));
        } catch (IllegalStateException e) {
            log.warn("[Terminal] Resize of {} failed: {}", resize.getSessionId(), e.getMessage());
            return;
        }
        session.cols = resize.getCols();
        session.rows = resize.getRows();
        log.debug("[Terminal] Session {} resized to {}x{}", resize.getSessionId(), resize.getCols(), resize.getRows());
    }

    public void close(String sessionId) {
        Session session = sessions.get(sessionId);
        if (session != null) {
            log.info("[Terminal] Closing session {}", sessionId);
            session.process.destroyForcibly();
        }
    }

    /**
     * Kills every shell. Used when the hub connection drops, since the sessions are
     * unreachable afterwards.
     */
    public void closeAll() {
        if (!sessions.isEmpty()) {
            log.info("[Terminal] Closing {} sessions", sessions.size());
        }
        sessions.values().forEach(session -> session.process.destroyForcibly());
        sessions.clear();
    }

    public int sessionCount() {
        return sessions.size();
    }

    int[] size(String sessionId) {
        Session session = sessions.get(sessionId);
        return session != null ? new int[] {session.cols, session.rows} : null;
    }

    @PreDestroy
    public void shutdown() {
        closeAll();
        readers.shutdownNow();
    }

    private void pump(String sessionId, Session session, WorkerEventSink sink) {
        Process process = session.process;
        try (Reader reader = new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8)) {
            char[] buffer = new char[4096];
            int read;
            while ((read = reader.read(buffer)) != -1) {
                sink.emit(MessageTypes.TERMINAL_OUTPUT, new TerminalData(sessionId, new String(buffer, 0, read)));
            }
        } catch (IOException e) {
            log.debug("[Terminal] Output of {} ended: {}", sessionId, e.getMessage());
        }

        Integer exitCode = null;
        try {
            exitCode = process.waitFor();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        // closeAll() already dropped the session when the hub went away
        if (sessions.remove(sessionId, session)) {
            log.info("[Terminal] Session {} exited with code {}", sessionId, exitCode);
            sink.emit(MessageTypes.TERMINAL_CLOSED, new TerminalClosed(sessionId, exitCode));
        }
    }

    File resolveCwd(String cwd) {
        File home = new File(System.getProperty("user.home"));
        if (cwd == null || cwd.isBlank()) {
            return home;
        }
        File dir = new File(cwd);
        if (!dir.isDirectory()) {
            log.warn("[Terminal] Directory not found: {}, using default", cwd);
            return home;
        }
        return dir;
    }

    List<String> shellCommand() {
        if (shell != null && !shell.isBlank()) {
            return new ArrayList<>(Arrays.asList(shell.trim().split("\\s+")));
        }
        boolean windows = System.getProperty("os.name", "").toLowerCase().startsWith("windows");
        return windows ? List.of("powershell.exe") : List.of("bash");
    }

    private static final class Session {
        private final PtyProcess process;
        private volatile int cols = DEFAULT_COLS;
        private volatile int rows = DEFAULT_ROWS;

        private Session(PtyProcess process) {
            this.process = process;
        }
    }
}
