package com.ai.intake.service;

import com.ai.intake.client.CalendarSyncClient;
import com.ai.intake.conversation.ConversationSession;
import com.ai.intake.conversation.ConversationStep;
import com.ai.intake.entity.Appointment;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DataIntegrityViolationException;

import java.time.Instant;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class BookingFinalizerFailureTest {

    private static final Instant START = Instant.parse("2026-10-22T15:30:00Z");

    private AppointmentService appointmentService;
    private CalendarSyncClient calendarSync;
    private BookingFinalizer bookingFinalizer;

    @BeforeEach
    void setUp() {
        appointmentService = Mockito.mock(AppointmentService.class);
        calendarSync = Mockito.mock(CalendarSyncClient.class);
        bookingFinalizer = new BookingFinalizer(appointmentService, calendarSync);
    }

    private static ConversationSession confirmed(String callId) {
        ConversationSession session = ConversationSession.start(callId, Instant.parse("2026-10-19T15:00:00Z"), 900);
        session.getFields().setFullName("Johnny Walker");
        session.advanceTo(ConversationStep.ASK_MOBILE);
        session.getFields().setPhone("+18153288957");
        session.advanceTo(ConversationStep.ASK_TIME);
        session.getFields().setStartTimeUtc(START);
        session.advanceTo(ConversationStep.CONFIRM);
        return session;
    }

    @Test
    void storageFailureReportsBookingUnavailable() {
        when(appointmentService.findBySourceCallId("CA1")).thenReturn(Optional.empty());
        when(appointmentService.book(eq("CA1"), anyString(), anyString(), any(), anyInt(), anyString()))
                .thenThrow(new DataAccessResourceFailureException("database down"));
        ConversationSession session = confirmed("CA1");

        BookingResult result = bookingFinalizer.finalizeBooking(session);

        assertThat(result.outcome()).isEqualTo(BookingResult.Outcome.FAILED);
        assertThat(result.reason()).isEqualTo("booking_unavailable");
        assertThat(session.getCurrentStep()).isEqualTo(ConversationStep.CONFIRM);
        assertThat(session.getFields().isComplete()).isTrue();
        verify(calendarSync, never()).createEvent(any());
    }

    @Test
    void lostInsertRaceReturnsWinningAppointment() {
        Appointment winner = Appointment.builder().id(42L).sourceCallId("CA1").startTimeUtc(START)
                .durationMinutes(30).build();
        when(appointmentService.findBySourceCallId("CA1"))
                .thenReturn(Optional.empty())
                .thenReturn(Optional.of(winner));
        when(appointmentService.book(eq("CA1"), anyString(), anyString(), any(), anyInt(), anyString()))
                .thenThrow(new DataIntegrityViolationException("uk_appointment_source_call"));

        BookingResult result = bookingFinalizer.finalizeBooking(confirmed("CA1"));

        assertThat(result.outcome()).isEqualTo(BookingResult.Outcome.EXISTING);
        assertThat(result.appointment().getId()).isEqualTo(42L);
        verify(appointmentService, times(1)).book(eq("CA1"), anyString(), anyString(), any(), anyInt(), anyString());
    }
}
