package com.ai.reservation.controller;

import com.ai.reservation.dto.TurnResponse;
import com.ai.reservation.service.ConversationOrchestrator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Tool-call endpoint for the voice platform. Each request is one dialogue turn.
 */
@RestController
@RequestMapping("/bobbystable/sessions/{sessionId}")
public class AgentController {

    private static final Logger log = LoggerFactory.getLogger(AgentController.class);

    private final ConversationOrchestrator orchestrator;

    public AgentController(ConversationOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @PostMapping("/intents/{intent}")
    public TurnResponse handleIntent(@PathVariable String sessionId,
                                     @PathVariable String intent,
                                     @RequestBody(required = false) Map<String, Object> args) {
        log.info("[{}] Intent {} args={}", sessionId, intent, args);
        return orchestrator.handleIntent(sessionId, intent, args);
    }

    @DeleteMapping
    public ResponseEntity<Void> endSession(@PathVariable String sessionId) {
        return orchestrator.endSession(sessionId)
                ? ResponseEntity.noContent().build()
                : ResponseEntity.notFound().build();
    }
}
