package com.ai.intake.hours;

import java.time.DayOfWeek;
import java.time.ZoneId;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Open days and hours in the business time zone. Days missing from the map are closed.
 */
public final class BusinessCalendar {

    private final ZoneId zone;
    private final Map<DayOfWeek, OpeningHours> week;

    public BusinessCalendar(ZoneId zone, Map<DayOfWeek, OpeningHours> week) {
        this.zone = zone;
        this.week = week.isEmpty()
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new EnumMap<>(week));
    }

    public static BusinessCalendar fromConfig(ZoneId zone, Map<DayOfWeek, String> windows) {
        Map<DayOfWeek, OpeningHours> week = new EnumMap<>(DayOfWeek.class);
        windows.forEach((day, hours) -> {
            OpeningHours parsed = OpeningHours.parse(hours);
            if (parsed != null) week.put(day, parsed);
        });
        return new BusinessCalendar(zone, week);
    }

    public ZoneId getZone() {
        return zone;
    }

    public Optional<OpeningHours> hoursFor(DayOfWeek day) {
        return Optional.ofNullable(week.get(day));
    }

    public boolean hasAnyOpenDay() {
        return !week.isEmpty();
    }
}
