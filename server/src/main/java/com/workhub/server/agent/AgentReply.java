package com.workhub.server.agent;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Reply read from the agent response queue. {@code senderId} and
 * {@code teamId} echo the request that produced it.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class AgentReply {

    @JsonProperty("requestMessageId")
    private String requestMessageId;

    @JsonProperty("senderId")
    private String senderId;

    @JsonProperty("teamId")
    private String teamId;

    @JsonProperty("content")
    private String content;
}
