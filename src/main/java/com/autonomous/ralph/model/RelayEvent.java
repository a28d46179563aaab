package com.autonomous.ralph.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Ephemeral event fanned out to every observer. Never persisted.
 *
 * <p>{@code data} is serialized as-is, so it should already carry the task or
 * session id that observers key on.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class RelayEvent {
    private RelayEventType type;
    @JsonIgnore
    private Long taskId;
    @JsonIgnore
    private String sessionId;
    private Object data;

    public static RelayEvent forTask(RelayEventType type, long taskId, Object data) {
        return new RelayEvent(type, taskId, null, data);
    }

    public static RelayEvent forSession(RelayEventType type, String sessionId, Object data) {
        return new RelayEvent(type, null, sessionId, data);
    }

    public static RelayEvent of(RelayEventType type, Object data) {
        return new RelayEvent(type, null, null, data);
    }
}
