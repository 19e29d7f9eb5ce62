package com.ai.intake.controller;

import com.ai.intake.component.ResponsePhrases;
import com.ai.intake.conversation.ConversationSession;
import com.ai.intake.conversation.ConversationStep;
import com.ai.intake.session.SessionStore;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.Optional;

import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(SessionAdminController.class)
@Import(ResponsePhrases.class)
class SessionAdminControllerTest {

    private static final Instant NOW = Instant.parse("2026-10-19T15:00:00Z");

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private SessionStore sessionStore;

    @Test
    void viewMasksPhone() throws Exception {
        ConversationSession session = ConversationSession.start("CA1", NOW, 900);
        session.getFields().setFullName("Johnny Walker");
        session.advanceTo(ConversationStep.ASK_MOBILE);
        session.getFields().setPhone("+18153288957");
        session.advanceTo(ConversationStep.ASK_TIME);
        when(sessionStore.find("CA1")).thenReturn(Optional.of(session));

        mockMvc.perform(get("/api/sessions/CA1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.current_step").value("ask_time"))
                .andExpect(jsonPath("$.full_name").value("Johnny Walker"))
                .andExpect(jsonPath("$.phone").value("+1****957"));
    }

    @Test
    void unknownSessionIsNotFound() throws Exception {
        when(sessionStore.find(anyString())).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/sessions/CA404"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("SESSION_NOT_FOUND"));
    }

    @Test
    void resetRequiresReason() throws Exception {
        mockMvc.perform(post("/api/sessions/CA1/reset")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"reason\":\" \"}"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(sessionStore);
    }

    @Test
    void resetReturnsFreshSession() throws Exception {
        when(sessionStore.reset("CA1", "caller asked to start over"))
                .thenReturn(ConversationSession.start("CA1", NOW, 900));

        mockMvc.perform(post("/api/sessions/CA1/reset")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"reason\":\"caller asked to start over\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.current_step").value("ask_name"));

        verify(sessionStore).reset("CA1", "caller asked to start over");
    }
}
