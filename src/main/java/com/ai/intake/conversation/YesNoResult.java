package com.ai.intake.conversation;

/**
 * Answer to the confirmation question.
 */
public enum YesNoResult {
    YES,
    NO,
    UNKNOWN
}
