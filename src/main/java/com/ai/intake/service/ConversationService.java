package com.ai.intake.service;

import com.ai.intake.conversation.ConversationSession;
import com.ai.intake.conversation.ConversationStep;
import com.ai.intake.conversation.SessionFields;
import com.ai.intake.conversation.YesNoResult;
import com.ai.intake.dto.FlowResponse;
import com.ai.intake.extraction.ExtractionResult;
import com.ai.intake.extraction.name.NameExtractor;
import com.ai.intake.extraction.phone.PhoneExtractor;
import com.ai.intake.extraction.phone.PhoneNumbers;
import com.ai.intake.extraction.time.TimeExtractor;
import com.ai.intake.hours.BusinessHoursValidator;
import com.ai.intake.session.SessionStore;
import com.ai.intake.session.StaleSessionException;
import com.ai.intake.utils.PhoneMask;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.OptionalInt;
import java.util.regex.Pattern;

/**
 * The per-call state machine: ask_name, ask_mobile, ask_time, confirm, complete. One call of
 * {@link #handleTurn} loads the session, applies one utterance, saves, and returns the next prompt.
 */
@Service
public class ConversationService {

    private static final Logger log = LoggerFactory.getLogger(ConversationService.class);

    private static final DateTimeFormatter SPOKEN = DateTimeFormatter.ofPattern("EEEE, MMMM d 'at' h:mm a", Locale.ENGLISH);

    private static final Pattern SAME_NUMBER = Pattern.compile(
            "\\b(this|same|current|my caller) (number|phone)\\b|\\bcalling (from|on)\\b", Pattern.CASE_INSENSITIVE);

    private final SessionStore sessionStore;
    private final NameExtractor nameExtractor;
    private final PhoneExtractor phoneExtractor;
    private final TimeExtractor timeExtractor;
    private final BusinessHoursValidator hoursValidator;
    private final YesNoClassifier yesNoClassifier;
    private final BookingFinalizer bookingFinalizer;
    private final VoiceResponseService voice;

    public ConversationService(SessionStore sessionStore, NameExtractor nameExtractor, PhoneExtractor phoneExtractor,
                               TimeExtractor timeExtractor, BusinessHoursValidator hoursValidator,
                               YesNoClassifier yesNoClassifier, BookingFinalizer bookingFinalizer,
                               VoiceResponseService voice) {
        this.sessionStore = sessionStore;
        this.nameExtractor = nameExtractor;
        this.phoneExtractor = phoneExtractor;
        this.timeExtractor = timeExtractor;
        this.hoursValidator = hoursValidator;
        this.yesNoClassifier = yesNoClassifier;
        this.bookingFinalizer = bookingFinalizer;
        this.voice = voice;
    }

    public TurnResult handleTurn(String callId, String callerNumber, String speechText) {
        ConversationSession session = sessionStore.get(callId);
        ConversationStep before = session.getCurrentStep();

        if (session.isComplete()) {
            log.info("Turn on completed session callId={}, ending call", callId);
            return new TurnResult(voice.toSpeech(FlowResponse.of(FlowResponse.Type.GOODBYE)), true, before);
        }

        FlowResponse response = apply(session, callerNumber, speechText == null ? "" : speechText.trim());

        try {
            sessionStore.save(session);
        } catch (StaleSessionException e) {
            ConversationSession current = sessionStore.get(callId);
            log.warn("Stale session write callId={} version={}, re-prompting for stored step {}",
                    callId, e.getExpectedVersion(), current.getCurrentStep());
            if (current.isComplete()) {
                return new TurnResult(voice.toSpeech(FlowResponse.of(FlowResponse.Type.GOODBYE)), true,
                        current.getCurrentStep());
            }
            return new TurnResult(voice.toSpeech(promptFor(current)), false, current.getCurrentStep());
        }

        log.info("Turn callId={} {} -> {} response={}", callId, before, session.getCurrentStep(), response.getType());
        return new TurnResult(voice.toSpeech(response), response.isEndCall(), session.getCurrentStep());
    }

    /** The greeting for a brand-new call. */
    public String openingPrompt() {
        return voice.greeting();
    }

    private FlowResponse apply(ConversationSession session, String callerNumber, String speech) {
        if (speech.isEmpty()) {
            session.recordFailedAttempt();
            return FlowResponse.repeat(promptFor(session).getType());
        }
        return switch (session.getCurrentStep()) {
            case ASK_NAME -> onName(session, speech);
            case ASK_MOBILE -> onPhone(session, callerNumber, speech);
            case ASK_TIME -> onTime(session, speech);
            case CONFIRM -> onConfirm(session, speech);
            case COMPLETE -> FlowResponse.of(FlowResponse.Type.GOODBYE);
        };
    }

    // =========================================================
    // STEPS
    // =========================================================

    private FlowResponse onName(ConversationSession session, String speech) {
        ExtractionResult<String> name = nameExtractor.extract(speech);
        if (!name.isSuccess()) {
            int attempt = session.recordFailedAttempt();
            log.info("ExtractionFailed{name} callId={} attempt={} reason={}", session.getCallId(), attempt, name.getReason());
            return FlowResponse.clarify(FlowResponse.Type.CLARIFY_NAME, attempt);
        }
        session.getFields().setFullName(name.getValue());
        session.advanceTo(ConversationStep.ASK_MOBILE);
        return FlowResponse.askPhone(name.getValue());
    }

    private FlowResponse onPhone(ConversationSession session, String callerNumber, String speech) {
        ExtractionResult<String> phone = phoneExtractor.extract(speech);
        if (!phone.isSuccess() && callerNumber != null && !callerNumber.isBlank()
                && SAME_NUMBER.matcher(speech).find()) {
            phone = phoneExtractor.extract(callerNumber);
        }
        if (!phone.isSuccess()) {
            int attempt = session.recordFailedAttempt();
            log.info("ExtractionFailed{phone} callId={} attempt={} reason={}", session.getCallId(), attempt, phone.getReason());
            return FlowResponse.clarify(FlowResponse.Type.CLARIFY_PHONE, attempt);
        }
        log.info("Phone captured callId={} phone={} layer={}", session.getCallId(),
                PhoneMask.mask(phone.getValue()), phone.getLayer());
        session.getFields().setPhone(phone.getValue());
        session.advanceTo(ConversationStep.ASK_TIME);
        return FlowResponse.of(FlowResponse.Type.ASK_TIME);
    }

    private FlowResponse onTime(ConversationSession session, String speech) {
        SessionFields fields = session.getFields();
        OptionalInt duration = timeExtractor.durationHint(speech);
        if (duration.isPresent()) {
            fields.setDurationMinutes(duration.getAsInt());
        }

        ExtractionResult<Instant> time = timeExtractor.extract(speech);
        if (!time.isSuccess()) {
            int attempt = session.recordFailedAttempt();
            if ("time_in_past".equals(time.getReason())) {
                log.info("ValidationFailed{time, time_in_past} callId={}", session.getCallId());
                return FlowResponse.of(FlowResponse.Type.TIME_IN_PAST);
            }
            log.info("ExtractionFailed{time} callId={} attempt={} reason={}", session.getCallId(), attempt, time.getReason());
            return FlowResponse.clarify(FlowResponse.Type.CLARIFY_TIME, attempt);
        }

        BusinessHoursValidator.HoursCheck check = hoursValidator.check(time.getValue(), fields.getDurationMinutes());
        if (!check.withinHours()) {
            session.recordFailedAttempt();
            log.info("ValidationFailed{time, outside_business_hours} callId={} requested={} next={}",
                    session.getCallId(), check.local(), check.nextOpening());
            return FlowResponse.outsideHours(check.nextOpening() == null ? null : spoken(check.nextOpening()));
        }

        fields.setStartTimeUtc(time.getValue());
        session.advanceTo(ConversationStep.CONFIRM);
        return confirmation(session, false);
    }

    private FlowResponse onConfirm(ConversationSession session, String speech) {
        YesNoResult answer = yesNoClassifier.classify(speech);
        switch (answer) {
            case YES: {
                BookingResult result = bookingFinalizer.finalizeBooking(session);
                if (!result.success()) {
                    session.recordFailedAttempt();
                    log.warn("BookingFailed callId={} reason={}", session.getCallId(), result.reason());
                    return FlowResponse.of(FlowResponse.Type.BOOKING_FAILED);
                }
                session.advanceTo(ConversationStep.COMPLETE);
                Instant start = result.appointment().getStartTimeUtc();
                return FlowResponse.confirmed(spoken(localOf(start)),
                        result.outcome() == BookingResult.Outcome.EXISTING);
            }
            case NO:
                session.advanceTo(ConversationStep.ASK_TIME);
                return FlowResponse.of(FlowResponse.Type.ASK_TIME_AGAIN);
            default:
                session.recordFailedAttempt();
                return confirmation(session, true);
        }
    }

    // =========================================================
    // PROMPTS
    // =========================================================

    /** The question for the session's current step, used when re-prompting. */
    private FlowResponse promptFor(ConversationSession session) {
        return switch (session.getCurrentStep()) {
            case ASK_NAME -> FlowResponse.of(FlowResponse.Type.ASK_NAME);
            case ASK_MOBILE -> FlowResponse.askPhone(session.getFields().getFullName());
            case ASK_TIME -> FlowResponse.of(FlowResponse.Type.ASK_TIME);
            case CONFIRM -> confirmation(session, false);
            case COMPLETE -> FlowResponse.of(FlowResponse.Type.GOODBYE);
        };
    }

    private FlowResponse confirmation(ConversationSession session, boolean unclear) {
        SessionFields f = session.getFields();
        String phone = PhoneNumbers.forSpeech(f.getPhone());
        String when = spoken(localOf(f.getStartTimeUtc()));
        return unclear
                ? FlowResponse.confirmUnclear(f.getFullName(), phone, when)
                : FlowResponse.confirmBooking(f.getFullName(), phone, when);
    }

    private LocalDateTime localOf(Instant instant) {
        return LocalDateTime.ofInstant(instant, hoursValidator.getCalendar().getZone());
    }

    private static String spoken(LocalDateTime local) {
        return SPOKEN.format(local);
    }
}
