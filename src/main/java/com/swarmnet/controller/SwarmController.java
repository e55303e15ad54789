package com.swarmnet.controller;

import com.swarmnet.core.agent.ConfidenceLevel;
import com.swarmnet.core.query.ComplexityLevel;
import com.swarmnet.core.query.Query;
import com.swarmnet.orchestrator.SwarmOrchestrator;
import com.swarmnet.orchestrator.SwarmResult;
import com.swarmnet.orchestrator.SwarmStatus;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/swarm")
public class SwarmController {

    private final SwarmOrchestrator orchestrator;

    public SwarmController(SwarmOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    /**
     * Body keys: question (required), context, complexity, requiredConfidence,
     * timeLimitSeconds, userId. Always 200 once the body is well formed; the
     * result's status tells COMPLETED, FAILED and CANCELLED apart.
     */
    @PostMapping("/query")
    public ResponseEntity<SwarmResult> submit(
            @RequestBody Map<String, String> request
    ) {

        String question = request.get("question");

        if (question == null || question.trim().isEmpty()) {
            return ResponseEntity.badRequest().build();
        }

        Query.Builder builder = Query.builder(question.trim())
                .context(request.get("context"))
                .userId(request.get("userId"));

        try {
            if (request.get("complexity") != null) {
                builder.complexity(ComplexityLevel.valueOf(request.get("complexity").trim().toUpperCase()));
            }
            if (request.get("requiredConfidence") != null) {
                builder.requiredConfidence(ConfidenceLevel.valueOf(request.get("requiredConfidence").trim().toUpperCase()));
            }
            if (request.get("timeLimitSeconds") != null) {
                builder.timeLimitSeconds(Integer.parseInt(request.get("timeLimitSeconds").trim()));
            }
        } catch (IllegalArgumentException e) {
            // covers NumberFormatException
            return ResponseEntity.badRequest().build();
        }

        return ResponseEntity.ok(orchestrator.submitQuery(builder.build()));
    }

    @GetMapping("/status")
    public ResponseEntity<SwarmStatus> status() {
        return ResponseEntity.ok(orchestrator.getStatus());
    }

    @GetMapping("/query/{id}")
    public ResponseEntity<Map<String, String>> state(@PathVariable("id") String queryId) {
        return orchestrator.getQueryState(queryId)
                .map(state -> ResponseEntity.ok(Map.of("queryId", queryId, "state", state.name())))
                .orElse(ResponseEntity.notFound().build());
    }

    @DeleteMapping("/query/{id}")
    public ResponseEntity<Map<String, Object>> cancel(@PathVariable("id") String queryId) {
        if (!orchestrator.cancel(queryId)) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(Map.of("queryId", queryId, "cancelled", true));
    }
}
