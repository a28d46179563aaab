package com.autonomous.ralph.protocol;

/**
 * Frame type names exchanged between hub, workers and observers.
 */
public final class MessageTypes {

    // worker -> hub
    public static final String WORKER_REGISTER = "ralph:worker:register";
    public static final String WORKER_START = "ralph:worker:start";
    public static final String WORKER_INIT = "ralph:worker:init";
    public static final String WORKER_TOOL = "ralph:worker:tool";
    public static final String WORKER_THOUGHT = "ralph:worker:thought";
    public static final String WORKER_PROGRESS = "ralph:worker:progress";
    public static final String WORKER_FILE = "ralph:worker:file";
    public static final String WORKER_LOG = "ralph:worker:log";
    public static final String WORKER_COMPLETE = "ralph:worker:complete";
    public static final String WORKER_ERROR = "ralph:worker:error";
    public static final String WORKER_BUSY = "ralph:worker:busy";
    public static final String PONG = "pong";

    // hub -> worker
    public static final String TASK = "ralph:task";
    public static final String CANCEL = "ralph:cancel";
    public static final String PING = "ping";

    // terminal, hub <-> worker
    public static final String TERMINAL_CREATE = "terminal:create";
    public static final String TERMINAL_INPUT = "terminal:input";
    public static final String TERMINAL_RESIZE = "terminal:resize";
    public static final String TERMINAL_CLOSE = "terminal:close";
    public static final String TERMINAL_OUTPUT = "terminal:output";
    public static final String TERMINAL_CREATED = "terminal:created";
    public static final String TERMINAL_CLOSED = "terminal:closed";
    public static final String TERMINAL_ERROR = "terminal:error";

    // observer -> hub
    public static final String TERMINAL_CHECK_WORKER = "terminal:check-worker";
    public static final String TERMINAL_WORKER_STATUS = "terminal:worker-status";
    public static final String TERMINAL_CREATE_SESSION = "terminal:create-session";
    public static final String TERMINAL_CLOSE_SESSION = "terminal:close-session";

    private MessageTypes() {
    }
}
