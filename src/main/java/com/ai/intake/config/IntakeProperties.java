package com.ai.intake.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.DayOfWeek;
import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

/**
 * Structured settings for the intake flow. Single knobs (OpenAI key, model) stay on {@code @Value}.
 */
@Data
@Component
@ConfigurationProperties(prefix = "intake")
public class IntakeProperties {

    private Session session = new Session();
    private Hours hours = new Hours();
    private Phone phone = new Phone();
    private Extraction extraction = new Extraction();
    private Ner ner = new Ner();
    private Calendar calendar = new Calendar();

    @Data
    public static class Session {

        /** redis | memory */
        private String backend = "redis";

        private String keyPrefix = "call_session:";

        private long ttlSeconds = 900;

        /** How long a completed session is kept so a repeated "yes" is answered terminally. */
        private long completedRetentionSeconds = 120;
    }

    @Data
    public static class Hours {

        private String zone = "America/Edmonton";

        private int lookaheadDays = 14;

        /** Increment used when walking forward to the next opening. */
        private int stepMinutes = 30;

        /** Per-day window as "HH:mm-HH:mm" or "closed". */
        private Map<DayOfWeek, String> week = defaultWeek();

        private static Map<DayOfWeek, String> defaultWeek() {
            Map<DayOfWeek, String> week = new EnumMap<>(DayOfWeek.class);
            week.put(DayOfWeek.MONDAY, "09:00-17:00");
            week.put(DayOfWeek.TUESDAY, "09:00-17:00");
            week.put(DayOfWeek.WEDNESDAY, "09:00-17:00");
            week.put(DayOfWeek.THURSDAY, "09:00-17:00");
            week.put(DayOfWeek.FRIDAY, "09:00-17:00");
            week.put(DayOfWeek.SATURDAY, "09:00-14:00");
            week.put(DayOfWeek.SUNDAY, "closed");
            return week;
        }
    }

    @Data
    public static class Phone {

        private String defaultRegion = "CA";
    }

    @Data
    public static class Extraction {

        /** Budget for a single layer that calls an external service. */
        private Duration layerTimeout = Duration.ofSeconds(2);

        private int executorThreads = 16;

        private boolean llmEnabled = true;
    }

    @Data
    public static class Ner {

        /** Blank disables the NER layer. */
        private String url = "";

        private Duration timeout = Duration.ofMillis(1500);
    }

    @Data
    public static class Calendar {

        /** Blank disables calendar sync. */
        private String url = "";

        private String apiKey = "";

        private Duration timeout = Duration.ofSeconds(3);
    }
}
