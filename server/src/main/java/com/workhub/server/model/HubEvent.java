package com.workhub.server.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Event posted by the WorkHub backend after a CRUD change that users must be
 * told about live.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class HubEvent {

    public enum Type {
        @JsonProperty("incident_created") INCIDENT_CREATED,
        @JsonProperty("task_assigned") TASK_ASSIGNED,
        @JsonProperty("permission_decided") PERMISSION_DECIDED,
        @JsonProperty("system_notice") SYSTEM_NOTICE
    }

    @JsonProperty("type")
    private Type type;

    @JsonProperty("actorId")
    private String actorId;

    @JsonProperty("teamId")
    private String teamId;

    @JsonProperty("recipientIds")
    private List<String> recipientIds;

    @JsonProperty("content")
    private String content;
}
