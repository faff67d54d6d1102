package com.cheflink.agent.api;

import com.cheflink.agent.core.ActiveRunRegistry;
import com.cheflink.agent.core.CancellationToken;
import com.cheflink.agent.core.OrchestrationLoop;
import com.cheflink.agent.exception.RunInProgressException;
import com.cheflink.agent.model.AgentRequest;
import com.cheflink.agent.model.AgentResponse;
import com.cheflink.agent.resilience.IdempotencyService;
import com.cheflink.agent.tool.ToolDefinition;
import com.cheflink.agent.tool.ToolRegistry;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Agent endpoints.
 *
 * POST /api/v1/agent/run
 *   Optional header: Idempotency-Key: <uuid>
 *   A repeated key within 24h returns the stored response without running again.
 *
 * POST /api/v1/agent/runs/{conversationId}/cancel
 * GET  /api/v1/agent/tools
 * GET  /api/v1/agent/health
 */
@RestController
@RequestMapping("/api/v1/agent")
@RequiredArgsConstructor
@Slf4j
public class AgentController {

    private final OrchestrationLoop orchestrationLoop;
    private final ToolRegistry toolRegistry;
    private final ActiveRunRegistry activeRunRegistry;
    private final IdempotencyService idempotencyService;
    private final ObjectMapper objectMapper;

    @PostMapping("/run")
    public ResponseEntity<AgentResponse> run(
            @Valid @RequestBody AgentRequest request,
            @RequestHeader(value = "Idempotency-Key", required = false) String idempotencyKey) {

        boolean idempotent = idempotencyKey != null && !idempotencyKey.isBlank();
        log.info("Agent run request [sessionId={}, userId={}, idempotencyKey={}]",
                request.getSessionId(), request.getUserId(), idempotencyKey);

        if (idempotent) {
            Optional<AgentResponse> cached = cachedResponse(idempotencyKey);
            if (cached.isPresent()) {
                log.info("Returning cached response for idempotency key={}", idempotencyKey);
                return ResponseEntity.ok(cached.get());
            }
            if (!idempotencyService.claimKey(idempotencyKey)) {
                throw new RunInProgressException("A request with Idempotency-Key " + idempotencyKey
                        + " is still being processed");
            }
        }

        if (request.getSessionId() == null || request.getSessionId().isBlank()) {
            request.setSessionId(UUID.randomUUID().toString());
        }
        String conversationId = request.getSessionId();

        AgentResponse response;
        try {
            CancellationToken token = activeRunRegistry.register(conversationId);
            try {
                response = orchestrationLoop.run(request, token);
            } finally {
                activeRunRegistry.unregister(conversationId);
            }
        } catch (RuntimeException e) {
            if (idempotent) {
                idempotencyService.releaseKey(idempotencyKey);
            }
            throw e;
        }

        if (idempotent) {
            storeResponse(idempotencyKey, response);
        }
        return ResponseEntity.ok(response);
    }

    @PostMapping("/runs/{conversationId}/cancel")
    public ResponseEntity<Map<String, Object>> cancel(@PathVariable String conversationId) {
        boolean cancelled = activeRunRegistry.cancel(conversationId);
        if (!cancelled) {
            return ResponseEntity.status(404).body(Map.of(
                    "conversationId", conversationId,
                    "cancelled", false));
        }
        return ResponseEntity.accepted().body(Map.of(
                "conversationId", conversationId,
                "cancelled", true));
    }

    @GetMapping("/tools")
    public ResponseEntity<List<ToolDefinition>> tools() {
        return ResponseEntity.ok(toolRegistry.exportSchema(orchestrationLoop.settings().getAllowedCategories()));
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, String>> health() {
        return ResponseEntity.ok(Map.of("status", "UP"));
    }

    private Optional<AgentResponse> cachedResponse(String idempotencyKey) {
        return idempotencyService.getCachedResponse(idempotencyKey).flatMap(json -> {
            try {
                return Optional.of(objectMapper.readValue(json, AgentResponse.class));
            } catch (JsonProcessingException e) {
                log.warn("Failed to deserialize cached response for key={}, running fresh", idempotencyKey, e);
                return Optional.empty();
            }
        });
    }

    private void storeResponse(String idempotencyKey, AgentResponse response) {
        try {
            idempotencyService.storeResponse(idempotencyKey, objectMapper.writeValueAsString(response));
        } catch (JsonProcessingException e) {
            log.warn("Failed to cache idempotency response for key={}", idempotencyKey, e);
            idempotencyService.releaseKey(idempotencyKey);
        }
    }
}
