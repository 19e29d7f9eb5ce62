package com.ai.intake.conversation;

import java.util.Arrays;
import java.util.Locale;

/**
 * Fixed sequence of information-gathering steps for one call.
 */
public enum ConversationStep {
    ASK_NAME,
    ASK_MOBILE,
    ASK_TIME,
    CONFIRM,
    COMPLETE;

    public ConversationStep next() {
        if (this == COMPLETE) {
            throw new InvalidTransitionException(this, this, "complete is terminal");
        }
        return values()[ordinal() + 1];
    }

    public boolean isTerminal() {
        return this == COMPLETE;
    }

    /** Name used in the persisted session record, e.g. "ask_name". */
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static ConversationStep fromWireName(String value) {
        return Arrays.stream(values())
                .filter(s -> s.wireName().equals(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown conversation step: " + value));
    }
}
