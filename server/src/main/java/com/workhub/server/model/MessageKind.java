package com.workhub.server.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Kind of a routed message. The router dispatches on this with an exhaustive
 * switch, so a new kind does not compile until its fan-out rule is written.
 */
public enum MessageKind {
    @JsonProperty("chat")
    CHAT,

    @JsonProperty("incident_alert")
    INCIDENT_ALERT,

    @JsonProperty("task_notice")
    TASK_NOTICE,

    @JsonProperty("agent_response")
    AGENT_RESPONSE,

    @JsonProperty("system")
    SYSTEM;

    /**
     * Kinds a connected client may submit itself. The rest originate inside
     * the server (backend events, the agent).
     */
    public boolean isClientSubmittable() {
        return this == CHAT || this == INCIDENT_ALERT || this == TASK_NOTICE;
    }
}
