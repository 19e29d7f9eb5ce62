package com.ai.intake.extraction.time;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Fixes common transcription slips and rewrites relative day words into explicit date anchors,
 * e.g. "tomorrow at 2 p.m." becomes "on 2026-10-20 at 2 pm" and "next week" becomes "week of 2026-10-26".
 */
public class RelativeDayNormalizer {

    private static final Map<String, String> CORRECTIONS = new LinkedHashMap<>();

    static {
        CORRECTIONS.put("\\b(?:tomorow|tommorow|tommorrow|tomorrw|tmrw|tmrow|tmr)\\b", "tomorrow");
        CORRECTIONS.put("\\b([ap])\\.\\s?m\\b\\.?", "$1m");
        CORRECTIONS.put("\\b(\\d{1,2})([ap]m)\\b", "$1 $2");
        CORRECTIONS.put("\\bo'?clock\\b", "");
        CORRECTIONS.put("\\b(?:mid-day|midday|mid day)\\b", "noon");
        CORRECTIONS.put("\\bwensday\\b", "wednesday");
        CORRECTIONS.put("\\bthurday\\b", "thursday");
        CORRECTIONS.put("\\btuseday\\b", "tuesday");
    }

    public String normalize(String transcript, LocalDate today) {
        String text = transcript.toLowerCase(Locale.ROOT).replace('’', '\'');
        for (Map.Entry<String, String> c : CORRECTIONS.entrySet()) {
            text = text.replaceAll(c.getKey(), c.getValue());
        }
        text = text
                .replaceAll("\\b(?:the )?day after tomorrow\\b", "on " + today.plusDays(2))
                .replaceAll("\\btomorrow\\b", "on " + today.plusDays(1))
                .replaceAll("\\btonight\\b", "on " + today + " evening")
                .replaceAll("\\btoday\\b", "on " + today)
                .replaceAll("\\bnext week\\b", "week of " + today.plusWeeks(1))
                .replaceAll("\\bthis week\\b", "week of " + today);
        return text.replaceAll("\\s+", " ").trim();
    }
}
