package com.workhub.server.agent;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request body published to the agent request queue.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class AgentRequest {

    @JsonProperty("messageId")
    private String messageId;

    @JsonProperty("senderId")
    private String senderId;

    @JsonProperty("teamId")
    private String teamId;

    @JsonProperty("content")
    private String content;

    @JsonProperty("timestamp")
    private String timestamp; // ISO-8601 format
}
