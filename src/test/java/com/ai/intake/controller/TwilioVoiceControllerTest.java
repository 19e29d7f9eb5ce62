package com.ai.intake.controller;

import com.ai.intake.component.ResponsePhrases;
import com.ai.intake.conversation.ConversationStep;
import com.ai.intake.service.ConversationService;
import com.ai.intake.service.TurnResult;
import com.ai.intake.session.SessionCorruptedException;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.test.web.servlet.MockMvc;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.allOf;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.not;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(TwilioVoiceController.class)
@Import(ResponsePhrases.class)
class TwilioVoiceControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private ConversationService conversationService;

    @Test
    void inboundCallGathersSpeechAfterGreeting() throws Exception {
        when(conversationService.openingPrompt()).thenReturn("Hi there! What's your name?");

        mockMvc.perform(post("/twilio/voice")
                        .param("CallSid", "CA1")
                        .param("From", "+18153288957"))
                .andExpect(status().isOk())
                .andExpect(content().string(allOf(
                        containsString("<Gather"),
                        containsString("input=\"speech\""),
                        containsString("/twilio/voice/collect"),
                        containsString("your name?"))));
    }

    @Test
    void collectRunsTurnAndGathersAgain() throws Exception {
        when(conversationService.handleTurn("CA1", "+18153288957", "My name is Johnny Walker"))
                .thenReturn(new TurnResult("Thanks, Johnny! What's your phone number?", false, ConversationStep.ASK_MOBILE));

        mockMvc.perform(post("/twilio/voice/collect")
                        .param("CallSid", "CA1")
                        .param("From", "+18153288957")
                        .param("SpeechResult", "My name is Johnny Walker"))
                .andExpect(status().isOk())
                .andExpect(content().string(allOf(
                        containsString("<Gather"),
                        containsString("your phone number?"),
                        not(containsString("<Hangup")))));
    }

    @Test
    void terminalTurnHangsUp() throws Exception {
        when(conversationService.handleTurn("CA1", null, "yes"))
                .thenReturn(new TurnResult("Your appointment is booked.", true, ConversationStep.COMPLETE));

        mockMvc.perform(post("/twilio/voice/collect")
                        .param("CallSid", "CA1")
                        .param("SpeechResult", "yes"))
                .andExpect(status().isOk())
                .andExpect(content().string(allOf(
                        containsString("Your appointment is booked."),
                        containsString("<Hangup"),
                        not(containsString("<Gather")))));
    }

    @Test
    void fatalErrorApologisesAndHangsUp() throws Exception {
        when(conversationService.handleTurn("CA1", null, "yes"))
                .thenThrow(new SessionCorruptedException("CA1", new IllegalArgumentException("bad")));

        mockMvc.perform(post("/twilio/voice/collect")
                        .param("CallSid", "CA1")
                        .param("SpeechResult", "yes"))
                .andExpect(status().isOk())
                .andExpect(content().string(allOf(
                        containsString("something went wrong"),
                        containsString("<Hangup"))));
    }

    @Test
    void fallbackTwimlEscapesPrompt() {
        assertThat(TwilioVoiceController.fallbackTwiml("Tom & Jerry <3"))
                .isEqualTo("<Response><Say>Tom &amp; Jerry &lt;3</Say></Response>");
        assertThat(TwilioVoiceController.fallbackTwiml(null)).isEqualTo("<Response><Say></Say></Response>");
    }
}
