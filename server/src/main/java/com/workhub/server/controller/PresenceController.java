package com.workhub.server.controller;

import com.workhub.server.model.ConnectionEntry;
import com.workhub.server.model.PresenceState;
import com.workhub.server.service.ConnectionRegistry;
import com.workhub.server.service.PresenceTracker;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RestController;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

@RestController
public class PresenceController {

    private final PresenceTracker presenceTracker;
    private final ConnectionRegistry registry;

    public PresenceController(PresenceTracker presenceTracker, ConnectionRegistry registry) {
        this.presenceTracker = presenceTracker;
        this.registry = registry;
    }

    @GetMapping("/presence/{userId}")
    public ResponseEntity<PresenceState> presence(@PathVariable String userId) {
        return ResponseEntity.ok(presenceTracker.presence(userId));
    }

    /**
     * Connected members of a team, for the manager dashboard's initial render.
     */
    @GetMapping("/presence/team/{teamId}")
    public ResponseEntity<Map<String, Object>> team(@PathVariable String teamId) {
        List<Map<String, Object>> online = new ArrayList<>();
        for (ConnectionEntry entry : registry.connectedInTeam(teamId)) {
            Map<String, Object> member = new HashMap<>();
            member.put("userId", entry.getUserId());
            member.put("role", entry.getRole());
            member.put("connectedAt", entry.getConnectedAt().toString());
            online.add(member);
        }

        Map<String, Object> body = new HashMap<>();
        body.put("teamId", teamId);
        body.put("online", online);
        return ResponseEntity.ok(body);
    }
}
