package com.ai.intake.dto;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Structured outcome of one turn. No conversational text: only type and payload, rendered to speech separately.
 */
public final class FlowResponse {

    public enum Type {
        ASK_NAME,
        ASK_PHONE,
        ASK_TIME,
        ASK_TIME_AGAIN,
        CONFIRM_BOOKING,
        CONFIRMED,
        REPEAT,
        CLARIFY_NAME,
        CLARIFY_PHONE,
        CLARIFY_TIME,
        TIME_IN_PAST,
        OUTSIDE_HOURS,
        CONFIRM_UNCLEAR,
        BOOKING_FAILED,
        GOODBYE,
        APOLOGY
    }

    private final Type type;
    private final Map<String, Object> payload;
    private final boolean endCall;

    private FlowResponse(Type type, Map<String, Object> payload, boolean endCall) {
        this.type = type;
        this.payload = payload == null ? Collections.emptyMap() : new HashMap<>(payload);
        this.endCall = endCall;
    }

    public Type getType() {
        return type;
    }

    public Map<String, Object> getPayload() {
        return Collections.unmodifiableMap(payload);
    }

    public String getString(String key) {
        Object v = payload.get(key);
        return v == null ? null : v.toString();
    }

    public int getInt(String key) {
        Object v = payload.get(key);
        return v instanceof Number n ? n.intValue() : 0;
    }

    public boolean isEndCall() {
        return endCall;
    }

    public static FlowResponse of(Type type) {
        return new FlowResponse(type, null, isTerminal(type));
    }

    public static FlowResponse of(Type type, Map<String, Object> payload) {
        return new FlowResponse(type, payload, isTerminal(type));
    }

    private static boolean isTerminal(Type type) {
        return type == Type.CONFIRMED || type == Type.GOODBYE || type == Type.APOLOGY;
    }

    public static FlowResponse askPhone(String fullName) {
        Map<String, Object> p = new HashMap<>();
        p.put("name", fullName);
        return new FlowResponse(Type.ASK_PHONE, p, false);
    }

    public static FlowResponse confirmBooking(String fullName, String phone, String when) {
        Map<String, Object> p = new HashMap<>();
        p.put("name", fullName);
        p.put("phone", phone);
        p.put("when", when);
        return new FlowResponse(Type.CONFIRM_BOOKING, p, false);
    }

    public static FlowResponse confirmUnclear(String fullName, String phone, String when) {
        Map<String, Object> p = new HashMap<>();
        p.put("name", fullName);
        p.put("phone", phone);
        p.put("when", when);
        return new FlowResponse(Type.CONFIRM_UNCLEAR, p, false);
    }

    public static FlowResponse confirmed(String when, boolean alreadyBooked) {
        Map<String, Object> p = new HashMap<>();
        p.put("when", when);
        p.put("alreadyBooked", alreadyBooked);
        return new FlowResponse(Type.CONFIRMED, p, true);
    }

    public static FlowResponse outsideHours(String nextOpening) {
        Map<String, Object> p = new HashMap<>();
        if (nextOpening != null) p.put("nextOpening", nextOpening);
        return new FlowResponse(Type.OUTSIDE_HOURS, p, false);
    }

    public static FlowResponse clarify(Type type, int attempt) {
        Map<String, Object> p = new HashMap<>();
        p.put("attempt", attempt);
        return new FlowResponse(type, p, false);
    }

    /** Re-ask after empty speech; {@code step} is the prompt type to repeat. */
    public static FlowResponse repeat(Type step) {
        Map<String, Object> p = new HashMap<>();
        p.put("step", step.name());
        return new FlowResponse(Type.REPEAT, p, false);
    }
}
