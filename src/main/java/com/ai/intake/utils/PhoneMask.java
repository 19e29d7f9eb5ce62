package com.ai.intake.utils;

/**
 * Masks phone numbers for log output, keeping the country prefix and the last three digits.
 */
public final class PhoneMask {

    private PhoneMask() {
    }

    public static String mask(String phone) {
        if (phone == null || phone.isBlank()) return "";
        String p = phone.trim();
        if (p.length() <= 5) return "****";
        int keepHead = p.startsWith("+") ? 2 : 1;
        return p.substring(0, keepHead) + "****" + p.substring(p.length() - 3);
    }
}
