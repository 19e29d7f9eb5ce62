package com.ai.intake.service;

import com.ai.intake.entity.Appointment;
import com.ai.intake.entity.User;
import com.ai.intake.repository.AppointmentRepository;
import com.ai.intake.repository.UserRepository;
import com.ai.intake.utils.PhoneMask;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Optional;

@Service
public class AppointmentService {

    private static final Logger log = LoggerFactory.getLogger(AppointmentService.class);

    private final AppointmentRepository appointmentRepository;
    private final UserRepository userRepository;

    public AppointmentService(AppointmentRepository appointmentRepository, UserRepository userRepository) {
        this.appointmentRepository = appointmentRepository;
        this.userRepository = userRepository;
    }

    @Transactional(readOnly = true)
    public Optional<Appointment> findBySourceCallId(String callId) {
        return appointmentRepository.findBySourceCallId(callId);
    }

    // =========================================================
    // BOOK (one appointment per call, enforced by source_call_id)
    // =========================================================
    @Transactional
    public Appointment book(String callId, String fullName, String phone, Instant startTimeUtc,
                            int durationMinutes, String notes) {

        User user = userRepository.findByPhone(phone).orElse(null);
        if (user == null) {
            user = userRepository.saveAndFlush(User.builder()
                    .fullName(fullName)
                    .phone(phone)
                    .build());
        } else if (!fullName.equals(user.getFullName())) {
            // existing user row is left as is
            notes = notes + "; caller gave name " + fullName;
        }

        Appointment appointment = Appointment.builder()
                .user(user)
                .startTimeUtc(startTimeUtc)
                .durationMinutes(durationMinutes)
                .status(Appointment.Status.BOOKED)
                .sourceCallId(callId)
                .notes(notes)
                .build();
        appointment = appointmentRepository.saveAndFlush(appointment);

        log.info("Booked appointment id={} callId={} phone={} start={} duration={}",
                appointment.getId(), callId, PhoneMask.mask(phone), startTimeUtc, durationMinutes);
        return appointment;
    }

    @Transactional
    public void recordExternalEvent(Long appointmentId, String eventId) {
        appointmentRepository.updateExternalEventId(appointmentId, eventId);
    }
}
