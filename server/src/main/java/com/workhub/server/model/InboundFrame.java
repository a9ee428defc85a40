package com.workhub.server.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Frame sent by a connected client.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class InboundFrame {

    @JsonProperty("kind")
    private MessageKind kind;

    @JsonProperty("to")
    private String to;  // user id, or "agent"

    @JsonProperty("assignees")
    private List<String> assignees;  // task_notice only

    @JsonProperty("content")
    private String content;

    @JsonProperty("clientMessageId")
    private String clientMessageId;
}
