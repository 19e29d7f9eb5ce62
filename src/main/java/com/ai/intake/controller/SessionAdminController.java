package com.ai.intake.controller;

import com.ai.intake.conversation.ConversationSession;
import com.ai.intake.dto.ErrorResponse;
import com.ai.intake.dto.ResetRequest;
import com.ai.intake.dto.SessionView;
import com.ai.intake.session.SessionStore;
import jakarta.validation.Valid;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.OffsetDateTime;
import java.util.Optional;

/**
 * Operator endpoints. Reset here is the only external way to send a call back to the first question.
 */
@RestController
@RequestMapping("/api/sessions")
public class SessionAdminController {

    private final SessionStore sessionStore;

    public SessionAdminController(SessionStore sessionStore) {
        this.sessionStore = sessionStore;
    }

    @GetMapping("/{callId}")
    public ResponseEntity<?> get(@PathVariable String callId) {
        Optional<ConversationSession> session = sessionStore.find(callId);
        if (session.isEmpty()) {
            ErrorResponse error = ErrorResponse.builder()
                    .code("SESSION_NOT_FOUND")
                    .message("No active session for call " + callId)
                    .timestamp(OffsetDateTime.now())
                    .build();
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(error);
        }
        return ResponseEntity.ok(SessionView.of(session.get()));
    }

    @PostMapping("/{callId}/reset")
    public ResponseEntity<SessionView> reset(@PathVariable String callId, @Valid @RequestBody ResetRequest request) {
        MDC.put("callId", callId);
        try {
            return ResponseEntity.ok(SessionView.of(sessionStore.reset(callId, request.reason())));
        } finally {
            MDC.remove("callId");
        }
    }
}
