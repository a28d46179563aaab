package com.autonomous.ralph.model;

public enum DispatchError {
    INVALID_REQUEST,
    NO_WORKERS_CONNECTED,
    UNKNOWN_PROJECT,
    WORKER_BUSY,
    NO_CAPABLE_IDLE_WORKER,
    DISPATCH_FAILED
}
