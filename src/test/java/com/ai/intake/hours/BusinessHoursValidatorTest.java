package com.ai.intake.hours;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.EnumMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BusinessHoursValidatorTest {

    private static final ZoneId EDMONTON = ZoneId.of("America/Edmonton");

    private BusinessHoursValidator validator;

    @BeforeEach
    void setUp() {
        Map<DayOfWeek, String> week = new EnumMap<>(DayOfWeek.class);
        for (DayOfWeek day : DayOfWeek.values()) {
            week.put(day, day.getValue() <= 5 ? "10:00-17:00" : "closed");
        }
        validator = new BusinessHoursValidator(BusinessCalendar.fromConfig(EDMONTON, week), 30, 14);
    }

    @Test
    void startBeforeOpeningIsOutsideHours() {
        // Thursday
        assertThat(validator.isWithinHours(LocalDateTime.of(2026, 10, 22, 9, 30), 30)).isFalse();
        assertThat(validator.isWithinHours(LocalDateTime.of(2026, 10, 22, 10, 0), 30)).isTrue();
    }

    @Test
    void appointmentMustEndByClosing() {
        assertThat(validator.isWithinHours(LocalDateTime.of(2026, 10, 22, 16, 30), 30)).isTrue();
        assertThat(validator.isWithinHours(LocalDateTime.of(2026, 10, 22, 16, 45), 30)).isFalse();
        assertThat(validator.isWithinHours(LocalDateTime.of(2026, 10, 22, 16, 0), 90)).isFalse();
    }

    @Test
    void closedDayIsNeverWithinHours() {
        assertThat(validator.isWithinHours(LocalDateTime.of(2026, 10, 24, 12, 0), 30)).isFalse();
    }

    @Test
    void nextOpeningSameDayWhenEarlyMorning() {
        assertThat(validator.nextOpening(LocalDateTime.of(2026, 10, 22, 9, 30), 30))
                .contains(LocalDateTime.of(2026, 10, 22, 10, 0));
    }

    @Test
    void nextOpeningRoundsUpToStep() {
        assertThat(validator.nextOpening(LocalDateTime.of(2026, 10, 22, 11, 5), 30))
                .contains(LocalDateTime.of(2026, 10, 22, 11, 30));
    }

    @Test
    void nextOpeningSkipsWeekend() {
        assertThat(validator.nextOpening(LocalDateTime.of(2026, 10, 23, 16, 45), 30))
                .contains(LocalDateTime.of(2026, 10, 26, 10, 0));
    }

    @Test
    void nextOpeningEmptyWhenNothingOpens() {
        BusinessHoursValidator closed = new BusinessHoursValidator(new BusinessCalendar(EDMONTON, Map.of()), 30, 14);

        assertThat(closed.nextOpening(LocalDateTime.of(2026, 10, 22, 9, 0), 30)).isEmpty();
    }

    @Test
    void checkConvertsUtcToBusinessZone() {
        // 16:00Z is 10:00 in Edmonton (MDT)
        BusinessHoursValidator.HoursCheck inside = validator.check(Instant.parse("2026-10-22T16:00:00Z"), 30);
        BusinessHoursValidator.HoursCheck outside = validator.check(Instant.parse("2026-10-22T15:30:00Z"), 30);

        assertThat(inside.withinHours()).isTrue();
        assertThat(inside.nextOpening()).isNull();
        assertThat(outside.withinHours()).isFalse();
        assertThat(outside.local()).isEqualTo(LocalDateTime.of(2026, 10, 22, 9, 30));
        assertThat(outside.nextOpening()).isEqualTo(LocalDateTime.of(2026, 10, 22, 10, 0));
    }

    @Test
    void rejectsInvalidOpeningHours() {
        assertThatThrownBy(() -> OpeningHours.parse("17:00-09:00"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(OpeningHours.parse("closed")).isNull();
    }
}
