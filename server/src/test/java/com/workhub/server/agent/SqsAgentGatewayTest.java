package com.workhub.server.agent;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import software.amazon.awssdk.services.sqs.SqsClient;
import software.amazon.awssdk.services.sqs.model.SendMessageRequest;
import software.amazon.awssdk.services.sqs.model.SendMessageResponse;
import software.amazon.awssdk.services.sqs.model.SqsException;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SqsAgentGatewayTest {

    private static final String QUEUE = "workhub-agent-requests";
    private static final String QUEUE_URL = "https://sqs.local/000000000000/" + QUEUE;

    @Mock
    private SqsClient sqsClient;

    @Mock
    private SqsQueueResolver queueResolver;

    private final ObjectMapper objectMapper = new ObjectMapper();

    private SqsAgentGateway gateway(boolean fifo) {
        return new SqsAgentGateway(sqsClient, objectMapper, queueResolver, Runnable::run, QUEUE, fifo);
    }

    private static AgentRequest request() {
        return new AgentRequest("msg-1", "w1", "t1", "When is my shift?", "2024-03-01T08:00:00Z");
    }

    @Test
    void publishesRequestAsJson() throws Exception {
        when(queueResolver.resolve(QUEUE)).thenReturn(QUEUE_URL);
        when(sqsClient.sendMessage(any(SendMessageRequest.class)))
                .thenReturn(SendMessageResponse.builder().messageId("sqs-1").build());
        SqsAgentGateway gateway = gateway(false);

        gateway.submit(request()).get();

        ArgumentCaptor<SendMessageRequest> sent = ArgumentCaptor.forClass(SendMessageRequest.class);
        verify(sqsClient).sendMessage(sent.capture());
        assertThat(sent.getValue().queueUrl()).isEqualTo(QUEUE_URL);
        assertThat(sent.getValue().messageGroupId()).isNull();
        AgentRequest body = objectMapper.readValue(sent.getValue().messageBody(), AgentRequest.class);
        assertThat(body).isEqualTo(request());
        assertThat(gateway.getRequestsSent()).isEqualTo(1);
    }

    @Test
    void fifoQueueGroupsBySenderAndDeduplicatesByMessageId() throws Exception {
        when(queueResolver.resolve(QUEUE)).thenReturn(QUEUE_URL);
        when(sqsClient.sendMessage(any(SendMessageRequest.class)))
                .thenReturn(SendMessageResponse.builder().messageId("sqs-1").build());

        gateway(true).submit(request()).get();

        ArgumentCaptor<SendMessageRequest> sent = ArgumentCaptor.forClass(SendMessageRequest.class);
        verify(sqsClient).sendMessage(sent.capture());
        assertThat(sent.getValue().messageGroupId()).isEqualTo("w1");
        assertThat(sent.getValue().messageDeduplicationId()).isEqualTo("msg-1");
    }

    @Test
    void missingQueueFailsWithAgentUnavailable() {
        when(queueResolver.resolve(QUEUE)).thenReturn(null);
        SqsAgentGateway gateway = gateway(false);

        CompletableFuture<Void> future = gateway.submit(request());

        assertThatThrownBy(future::get)
                .isInstanceOf(ExecutionException.class)
                .hasCauseInstanceOf(AgentUnavailableException.class);
        assertThat(gateway.isAvailable()).isFalse();
        verify(sqsClient, never()).sendMessage(any(SendMessageRequest.class));
    }

    @Test
    void sqsErrorFailsWithAgentUnavailable() {
        when(queueResolver.resolve(QUEUE)).thenReturn(QUEUE_URL);
        when(sqsClient.sendMessage(any(SendMessageRequest.class)))
                .thenThrow(SqsException.builder().message("throttled").build());
        SqsAgentGateway gateway = gateway(false);

        assertThatThrownBy(() -> gateway.submit(request()).get())
                .hasCauseInstanceOf(AgentUnavailableException.class);
        assertThat(gateway.getRequestsFailed()).isEqualTo(1);
    }
}
