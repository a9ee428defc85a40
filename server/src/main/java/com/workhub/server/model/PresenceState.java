package com.workhub.server.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

@Value
public class PresenceState {

    @JsonProperty("userId")
    String userId;

    @JsonProperty("status")
    PresenceStatus status;

    // ISO-8601, null when no transition was observed since startup
    @JsonProperty("lastTransitionTime")
    String lastTransitionTime;
}
