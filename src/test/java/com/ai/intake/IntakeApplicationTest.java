package com.ai.intake;

import com.ai.intake.entity.Appointment;
import com.ai.intake.repository.AppointmentRepository;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
class IntakeApplicationTest {

    @TestConfiguration
    static class FixedClockConfig {

        // Monday 2026-10-19 09:00 in Edmonton
        @Bean
        @Primary
        Clock fixedClock() {
            return Clock.fixed(Instant.parse("2026-10-19T15:00:00Z"), ZoneOffset.UTC);
        }
    }

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private AppointmentRepository appointmentRepository;

    private void turn(String callId, String speech, boolean terminal) throws Exception {
        mockMvc.perform(post("/api/voice/turn")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"call_id\":\"" + callId + "\",\"speech_text\":\"" + speech + "\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.terminal").value(terminal));
    }

    @Test
    @Transactional
    void callBooksExactlyOneAppointment() throws Exception {
        turn("CA-e2e", "My name is Johnny Walker", false);
        turn("CA-e2e", "8153288957", false);
        turn("CA-e2e", "Thursday at 9:30am", false);
        turn("CA-e2e", "yes", true);
        turn("CA-e2e", "yes", true);

        assertThat(appointmentRepository.countBySourceCallId("CA-e2e")).isEqualTo(1);
        Appointment appointment = appointmentRepository.findBySourceCallId("CA-e2e").orElseThrow();
        assertThat(appointment.getUser().getPhone()).isEqualTo("+18153288957");
        assertThat(appointment.getUser().getFullName()).isEqualTo("Johnny Walker");
        assertThat(appointment.getStartTimeUtc()).isEqualTo(Instant.parse("2026-10-22T15:30:00Z"));
    }
}
