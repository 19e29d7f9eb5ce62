package com.ai.intake.conversation;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

import java.time.Instant;

/**
 * Values collected so far for one call.
 */
@Getter
@Setter
@ToString
@EqualsAndHashCode
public class SessionFields {

    public static final int DEFAULT_DURATION_MINUTES = 30;

    private String fullName;

    /** E.164 */
    private String phone;

    private Instant startTimeUtc;

    private int durationMinutes = DEFAULT_DURATION_MINUTES;

    public boolean hasNameAndPhone() {
        return fullName != null && phone != null;
    }

    public boolean isComplete() {
        return hasNameAndPhone() && startTimeUtc != null;
    }
}
