package com.workhub.server.controller;

import com.workhub.server.agent.AgentGateway;
import com.workhub.server.agent.AgentReplyConsumer;
import com.workhub.server.handler.HubWebSocketHandler;
import com.workhub.server.listener.DashboardPresencePublisher;
import com.workhub.server.persistence.JdbcMessageStore;
import com.workhub.server.service.ConnectionRegistry;
import com.workhub.server.service.HistoryReconciler;
import com.workhub.server.service.HubEventService;
import com.workhub.server.service.MessageRouter;
import com.workhub.server.service.WebSocketWriteManager;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.HashMap;
import java.util.Map;

@RestController
@Slf4j
public class HealthController {

    @Autowired
    private HubWebSocketHandler webSocketHandler;

    @Autowired
    private ConnectionRegistry registry;

    @Autowired
    private MessageRouter router;

    @Autowired
    private HistoryReconciler reconciler;

    @Autowired
    private HubEventService eventService;

    @Autowired
    private WebSocketWriteManager writeManager;

    @Autowired
    private DashboardPresencePublisher presencePublisher;

    @Autowired
    private AgentGateway agentGateway;

    @Autowired(required = false)
    private AgentReplyConsumer agentReplyConsumer;

    @Autowired(required = false)
    private JdbcMessageStore jdbcMessageStore;

    @Value("${server.id:hub-1}")
    private String serverId;

    /**
     * Health check for the load balancer. The hub is up when it can store
     * messages; the agent is reported but does not affect the status.
     *
     * @return health status with component-level details
     */
    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> health = new HashMap<>();
        health.put("serverId", serverId);
        health.put("timestamp", System.currentTimeMillis());

        try {
            boolean databaseHealthy = jdbcMessageStore == null || jdbcMessageStore.testConnection();
            health.put("databaseHealthy", databaseHealthy);

            boolean writeManagerHealthy = writeManager.getActiveWriterThreadCount() >= 0;
            health.put("writeManagerHealthy", writeManagerHealthy);

            health.put("agentAvailable", agentGateway.isAvailable());
            if (agentReplyConsumer != null) {
                health.put("agentConsumerRunning", agentReplyConsumer.isRunning());
            }

            boolean isHealthy = databaseHealthy && writeManagerHealthy;
            health.put("status", isHealthy ? "UP" : "DOWN");

            if (!isHealthy) {
                return ResponseEntity.status(503).body(health);
            }
            return ResponseEntity.ok(health);

        } catch (Exception e) {
            log.error("Health check failed with exception: {}", e.getMessage(), e);
            health.put("status", "DOWN");
            health.put("error", e.getMessage());
            return ResponseEntity.status(503).body(health);
        }
    }

    @GetMapping("/metrics")
    public ResponseEntity<Map<String, Object>> metrics() {
        Map<String, Object> metrics = new HashMap<>();
        metrics.put("serverId", serverId);
        metrics.put("timestamp", System.currentTimeMillis());

        Map<String, Object> handlerMetrics = new HashMap<>();
        handlerMetrics.put("connectionsOpened", webSocketHandler.getConnectionsOpened());
        handlerMetrics.put("framesReceived", webSocketHandler.getFramesReceived());
        handlerMetrics.put("framesRejected", webSocketHandler.getFramesRejected());
        handlerMetrics.put("acksSent", webSocketHandler.getAcksSent());
        handlerMetrics.put("storageErrorsReported", webSocketHandler.getStorageErrorsReported());
        metrics.put("handler", handlerMetrics);

        Map<String, Object> registryMetrics = new HashMap<>();
        registryMetrics.put("connectedUsers", registry.size());
        registryMetrics.put("registrations", registry.getRegistrations());
        registryMetrics.put("supersessions", registry.getSupersessions());
        registryMetrics.put("unregistrations", registry.getUnregistrations());
        registryMetrics.put("staleUnregisters", registry.getStaleUnregisters());
        metrics.put("registry", registryMetrics);

        Map<String, Object> routerMetrics = new HashMap<>();
        routerMetrics.put("messagesRouted", router.getMessagesRouted());
        routerMetrics.put("livePushes", router.getLivePushes());
        routerMetrics.put("offlineDeliveries", router.getOfflineDeliveries());
        routerMetrics.put("recordsPersisted", router.getRecordsPersisted());
        routerMetrics.put("persistFailures", router.getPersistFailures());
        routerMetrics.put("rejected", router.getRejected());
        routerMetrics.put("latePushes", router.getLatePushes());
        metrics.put("router", routerMetrics);

        Map<String, Object> historyMetrics = new HashMap<>();
        historyMetrics.put("delivered", reconciler.getHistoriesDelivered());
        historyMetrics.put("failures", reconciler.getHistoryFailures());
        historyMetrics.put("abandoned", reconciler.getHistoriesAbandoned());
        historyMetrics.put("duplicatesDropped", reconciler.getDuplicatesDropped());
        metrics.put("history", historyMetrics);

        metrics.put("eventsReceived", eventService.getEventsReceived());
        metrics.put("presenceFramesSent", presencePublisher.getPresenceFramesSent());
        metrics.put("writeManager", getWriteMetrics());

        if (agentReplyConsumer != null) {
            Map<String, Object> agentMetrics = new HashMap<>();
            agentMetrics.put("repliesRouted", agentReplyConsumer.getRepliesRouted());
            agentMetrics.put("repliesFailed", agentReplyConsumer.getRepliesFailed());
            metrics.put("agent", agentMetrics);
        }

        if (jdbcMessageStore != null) {
            Map<String, Object> persistenceMetrics = new HashMap<>();
            persistenceMetrics.put("recordsInserted", jdbcMessageStore.getRecordsInserted());
            persistenceMetrics.put("insertErrors", jdbcMessageStore.getInsertErrors());
            persistenceMetrics.put("historyQueries", jdbcMessageStore.getHistoryQueries());
            metrics.put("persistence", persistenceMetrics);
        }

        return ResponseEntity.ok(metrics);
    }

    private Map<String, Object> getWriteMetrics() {
        Map<String, Object> writeMetrics = new HashMap<>();
        writeMetrics.put("messagesSent", writeManager.getTotalMessagesSent());
        writeMetrics.put("messagesQueued", writeManager.getTotalMessagesQueued());
        writeMetrics.put("messagesDropped", writeManager.getTotalMessagesDropped());
        writeMetrics.put("writeErrors", writeManager.getTotalWriteErrors());
        writeMetrics.put("activeSessions", writeManager.getActiveSessionCount());
        writeMetrics.put("activeWriterThreads", writeManager.getActiveWriterThreadCount());
        return writeMetrics;
    }
}
