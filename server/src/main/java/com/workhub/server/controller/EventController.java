package com.workhub.server.controller;

import com.workhub.server.model.HubEvent;
import com.workhub.server.persistence.PersistenceException;
import com.workhub.server.service.HubEventService;
import com.workhub.server.service.RouteResult;
import com.workhub.server.service.RoutingException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Entry point for the WorkHub backend to notify users of CRUD changes.
 * Responds once the event is stored, so the backend can retry on failure.
 */
@RestController
@Slf4j
public class EventController {

    private final HubEventService eventService;

    @Value("${hub.events.store.timeout.ms:5000}")
    private long storeTimeoutMs;

    public EventController(HubEventService eventService) {
        this.eventService = eventService;
    }

    @PostMapping("/events")
    public ResponseEntity<Map<String, Object>> publish(@RequestBody HubEvent event) {
        Map<String, Object> body = new HashMap<>();

        RouteResult result;
        try {
            result = eventService.publish(event);
        } catch (IllegalArgumentException | RoutingException e) {
            body.put("status", "REJECTED");
            body.put("error", e.getMessage());
            return ResponseEntity.badRequest().body(body);
        }

        body.put("messageId", result.getMessageId());
        body.put("livePushes", result.getLivePushes());

        try {
            List<Long> recordIds = result.getPersisted().get(storeTimeoutMs, TimeUnit.MILLISECONDS);
            body.put("status", "STORED");
            body.put("recordIds", recordIds);
            return ResponseEntity.ok(body);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() instanceof PersistenceException ? e.getCause() : e;
            log.error("Event {} delivered live but not stored: {}", result.getMessageId(), cause.getMessage());
            body.put("status", "NOT_STORED");
            body.put("error", cause.getMessage());
            return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(body);
        } catch (TimeoutException e) {
            log.warn("Event {} not stored within {}ms", result.getMessageId(), storeTimeoutMs);
            body.put("status", "PENDING");
            return ResponseEntity.status(HttpStatus.ACCEPTED).body(body);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            body.put("status", "PENDING");
            return ResponseEntity.status(HttpStatus.ACCEPTED).body(body);
        }
    }
}
