package com.ai.intake.repository;

import com.ai.intake.entity.Appointment;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Optional;

public interface AppointmentRepository extends JpaRepository<Appointment, Long> {

    Optional<Appointment> findBySourceCallId(String sourceCallId);

    long countBySourceCallId(String sourceCallId);

    @Modifying
    @Query("UPDATE Appointment a SET a.externalEventId = :eventId WHERE a.id = :id")
    int updateExternalEventId(@Param("id") Long id, @Param("eventId") String eventId);
}
