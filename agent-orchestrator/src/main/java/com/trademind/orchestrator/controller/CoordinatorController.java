package com.trademind.orchestrator.controller;

import com.trademind.common.model.CoordinationDecision;
import com.trademind.orchestrator.dto.CoordinatorSnapshot;
import com.trademind.orchestrator.service.AgentCoordinator;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/v1/coordinator")
public class CoordinatorController {

    static final int MAX_DECISIONS = 200;

    private final AgentCoordinator coordinator;

    public CoordinatorController(AgentCoordinator coordinator) {
        this.coordinator = coordinator;
    }

    @GetMapping("/snapshot")
    public ResponseEntity<CoordinatorSnapshot> snapshot() {
        return ResponseEntity.ok(coordinator.snapshot());
    }

    /** Newest first; {@code limit} is capped at {@value #MAX_DECISIONS}. */
    @GetMapping("/decisions")
    public ResponseEntity<List<CoordinationDecision>> decisions(
            @RequestParam(value = "limit", defaultValue = "20") int limit) {
        if (limit < 1) {
            return ResponseEntity.badRequest().build();
        }
        return ResponseEntity.ok(coordinator.recentDecisions(Math.min(limit, MAX_DECISIONS)));
    }

    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return coordinator.isRunning()
            ? ResponseEntity.ok("OK")
            : ResponseEntity.status(503).body(String.valueOf(coordinator.phase()));
    }
}
