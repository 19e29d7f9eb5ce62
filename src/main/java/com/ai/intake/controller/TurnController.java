package com.ai.intake.controller;

import com.ai.intake.dto.TurnRequest;
import com.ai.intake.dto.TurnResponse;
import com.ai.intake.service.ConversationService;
import com.ai.intake.service.TurnResult;
import jakarta.validation.Valid;
import org.slf4j.MDC;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/voice")
public class TurnController {

    private final ConversationService conversationService;

    public TurnController(ConversationService conversationService) {
        this.conversationService = conversationService;
    }

    @PostMapping("/turn")
    public ResponseEntity<TurnResponse> turn(@Valid @RequestBody TurnRequest request) {
        MDC.put("callId", request.callId());
        try {
            TurnResult result = conversationService.handleTurn(
                    request.callId(), request.callerNumber(), request.speechText());
            return ResponseEntity.ok(new TurnResponse(result.nextPrompt(), result.terminal()));
        } finally {
            MDC.remove("callId");
        }
    }
}
