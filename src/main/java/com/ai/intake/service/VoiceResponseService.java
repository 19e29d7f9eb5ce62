package com.ai.intake.service;

import com.ai.intake.component.ResponsePhrases;
import com.ai.intake.dto.FlowResponse;
import org.springframework.stereotype.Service;

/**
 * Converts structured FlowResponse into short, voice-friendly speech.
 * No flow logic, only type + payload to sentence(s).
 */
@Service
public class VoiceResponseService {

    private final ResponsePhrases phrases;

    public VoiceResponseService(ResponsePhrases phrases) {
        this.phrases = phrases;
    }

    public String greeting() {
        return phrases.greeting();
    }

    public String toSpeech(FlowResponse response) {
        if (response == null)
            return "";
        switch (response.getType()) {
            case ASK_NAME:
                return phrases.askName();
            case ASK_PHONE:
                return phrases.askPhone(response.getString("name"));
            case ASK_TIME:
                return phrases.askTime();
            case ASK_TIME_AGAIN:
                return phrases.askTimeAgain();
            case CONFIRM_BOOKING:
                return phrases.confirmBooking(
                        response.getString("name"),
                        response.getString("phone"),
                        response.getString("when"));
            case CONFIRM_UNCLEAR:
                return phrases.confirmUnclear(
                        response.getString("name"),
                        response.getString("phone"),
                        response.getString("when"));
            case CONFIRMED:
                if (Boolean.TRUE.equals(response.getPayload().get("alreadyBooked")))
                    return phrases.alreadyBooked(response.getString("when"));
                return phrases.bookingConfirmed(response.getString("when"));
            case REPEAT:
                return phrases.didntCatch() + " " + repeatStep(response.getString("step"));
            case CLARIFY_NAME:
                return phrases.clarifyName(response.getInt("attempt"));
            case CLARIFY_PHONE:
                return phrases.clarifyPhone(response.getInt("attempt"));
            case CLARIFY_TIME:
                return phrases.clarifyTime(response.getInt("attempt"));
            case TIME_IN_PAST:
                return phrases.timeInPast();
            case OUTSIDE_HOURS:
                String next = response.getString("nextOpening");
                return next != null ? phrases.outsideHours(next) : phrases.outsideHoursNoOpening();
            case BOOKING_FAILED:
                return phrases.bookingFailed();
            case GOODBYE:
                return phrases.goodbye();
            case APOLOGY:
                return phrases.apology();
            default:
                return "";
        }
    }

    private String repeatStep(String step) {
        if (step == null) return phrases.askName();
        switch (FlowResponse.Type.valueOf(step)) {
            case ASK_PHONE:
                return "What's your phone number?";
            case ASK_TIME:
                return "What date and time would you like?";
            case CONFIRM_BOOKING:
                return "Should I book it? Please say yes or no.";
            case ASK_NAME:
            default:
                return phrases.askName();
        }
    }
}
