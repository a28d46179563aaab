package com.autonomous.ralph.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Event names broadcast to observers.
 */
public enum RelayEventType {
    DISPATCHED("ralph:dispatched"),
    START("ralph:start"),
    INIT("ralph:init"),
    TOOL("ralph:tool"),
    THOUGHT("ralph:thought"),
    PROGRESS("ralph:progress"),
    FILE("ralph:file"),
    LOG("ralph:log"),
    COMPLETE("ralph:complete"),
    ERROR("ralph:error"),
    BUSY("ralph:busy"),
    CANCELLED("ralph:cancelled"),
    CLEARED("ralph:cleared"),
    WORKER_ONLINE("ralph:worker:online"),
    WORKER_OFFLINE("ralph:worker:offline"),
    TERMINAL_OUTPUT("terminal:output"),
    TERMINAL_CREATED("terminal:session-created"),
    TERMINAL_CLOSED("terminal:session-closed"),
    TERMINAL_ERROR("terminal:error");

    private final String wireName;

    RelayEventType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }
}
