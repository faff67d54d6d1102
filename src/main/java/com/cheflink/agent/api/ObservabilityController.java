package com.cheflink.agent.api;

import com.cheflink.agent.observability.AgentRunTrace;
import com.cheflink.agent.observability.TraceService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * GET /api/v1/traces/{userId}                 all run traces of a user
 * GET /api/v1/traces/session/{sessionId}      traces of one conversation
 * GET /api/v1/traces/{userId}/analytics       latency, spend and termination breakdown
 */
@RestController
@RequestMapping("/api/v1/traces")
@RequiredArgsConstructor
public class ObservabilityController {

    private final TraceService traceService;

    @GetMapping("/{userId}")
    public ResponseEntity<List<AgentRunTrace>> getTraces(@PathVariable String userId) {
        return ResponseEntity.ok(traceService.getTracesForUser(userId));
    }

    @GetMapping("/session/{sessionId}")
    public ResponseEntity<List<AgentRunTrace>> getSessionTraces(@PathVariable String sessionId) {
        return ResponseEntity.ok(traceService.getTracesForConversation(sessionId));
    }

    @GetMapping("/{userId}/analytics")
    public ResponseEntity<Map<String, Object>> getAnalytics(@PathVariable String userId) {
        return ResponseEntity.ok(traceService.getAnalytics(userId));
    }
}
