package dev.smartrouter.controller;

import dev.smartrouter.domain.valueobject.RoutingDecision;
import dev.smartrouter.dto.request.ChatCompletionRequest;
import dev.smartrouter.router.orchestrator.RouterOrchestrator;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Dry-run routing: returns the decision for a chat-completion body without forwarding it.
 * The same metadata is set as X-Router-* headers, as the proxy layer would attach it.
 */
@RestController
@RequestMapping("/v1")
public class RoutingController {
    private final RouterOrchestrator orchestrator;
    public RoutingController(RouterOrchestrator orchestrator) { this.orchestrator = orchestrator; }

    @PostMapping("/route")
    public ResponseEntity<RoutingDecision> route(@RequestBody ChatCompletionRequest request) {
        RoutingDecision decision = orchestrator.route(request);
        ResponseEntity.BodyBuilder response = ResponseEntity.ok();
        decision.toHeaders().forEach(response::header);
        return response.body(decision);
    }
}
