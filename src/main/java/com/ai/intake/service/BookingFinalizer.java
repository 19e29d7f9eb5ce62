package com.ai.intake.service;

import com.ai.intake.client.CalendarSyncClient;
import com.ai.intake.conversation.ConversationSession;
import com.ai.intake.conversation.SessionFields;
import com.ai.intake.entity.Appointment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Turns a confirmed session into a User + Appointment. Safe to call more than once per call: the unique
 * source_call_id decides, and a lost insert race is resolved by reading the winner back.
 */
@Service
public class BookingFinalizer {

    private static final Logger log = LoggerFactory.getLogger(BookingFinalizer.class);

    public static final String BOOKING_UNAVAILABLE = "booking_unavailable";

    private final AppointmentService appointmentService;
    private final CalendarSyncClient calendarSync;

    public BookingFinalizer(AppointmentService appointmentService, CalendarSyncClient calendarSync) {
        this.appointmentService = appointmentService;
        this.calendarSync = calendarSync;
    }

    public BookingResult finalizeBooking(ConversationSession session) {
        String callId = session.getCallId();
        SessionFields fields = session.getFields();
        if (!fields.isComplete()) {
            log.warn("Finalize called with incomplete fields callId={}", callId);
            return BookingResult.failed("missing_fields");
        }

        try {
            Optional<Appointment> existing = appointmentService.findBySourceCallId(callId);
            if (existing.isPresent()) {
                log.info("BookingConflict: callId={} already booked as appointment {}", callId, existing.get().getId());
                return BookingResult.existing(existing.get());
            }

            Appointment created;
            try {
                created = book(session);
            } catch (DataIntegrityViolationException e) {
                Optional<Appointment> winner = appointmentService.findBySourceCallId(callId);
                if (winner.isPresent()) {
                    log.info("BookingConflict: concurrent finalize for callId={}, returning appointment {}",
                            callId, winner.get().getId());
                    return BookingResult.existing(winner.get());
                }
                // the user row raced instead; it exists now
                log.info("User insert raced for callId={}, retrying once", callId);
                created = book(session);
            }
            syncCalendar(created, session);
            return BookingResult.created(created);

        } catch (DataAccessException e) {
            log.error("BookingFailed: storage error for callId={}: {}", callId, e.getMessage());
            return BookingResult.failed(BOOKING_UNAVAILABLE);
        }
    }

    private Appointment book(ConversationSession session) {
        SessionFields f = session.getFields();
        return appointmentService.book(session.getCallId(), f.getFullName(), f.getPhone(),
                f.getStartTimeUtc(), f.getDurationMinutes(), "Booked via voice call " + session.getCallId());
    }

    private void syncCalendar(Appointment appointment, ConversationSession session) {
        if (!calendarSync.isEnabled()) return;
        SessionFields f = session.getFields();
        try {
            Optional<String> eventId = calendarSync.createEvent(new CalendarSyncClient.CalendarEvent(
                    "Appointment: " + f.getFullName(),
                    "Name: " + f.getFullName() + "\nPhone: " + f.getPhone() + "\nCall: " + session.getCallId(),
                    f.getStartTimeUtc(), f.getDurationMinutes(), session.getCallId()));
            if (eventId.isPresent()) {
                appointmentService.recordExternalEvent(appointment.getId(), eventId.get());
                appointment.setExternalEventId(eventId.get());
                log.info("Calendar event {} created for appointment {}", eventId.get(), appointment.getId());
            }
        } catch (RuntimeException e) {
            log.warn("Calendar sync failed for appointment {} (booking kept): {}", appointment.getId(), e.getMessage());
        }
    }
}
