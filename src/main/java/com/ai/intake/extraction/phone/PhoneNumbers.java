package com.ai.intake.extraction.phone;

import com.google.i18n.phonenumbers.NumberParseException;
import com.google.i18n.phonenumbers.PhoneNumberUtil;
import com.google.i18n.phonenumbers.Phonenumber;

import java.util.Optional;

/**
 * libphonenumber helpers bound to one default region.
 */
public class PhoneNumbers {

    private final PhoneNumberUtil util = PhoneNumberUtil.getInstance();
    private final String defaultRegion;

    public PhoneNumbers(String defaultRegion) {
        this.defaultRegion = defaultRegion;
    }

    public PhoneNumberUtil util() {
        return util;
    }

    public String defaultRegion() {
        return defaultRegion;
    }

    /**
     * Parses a digit run in the default region and formats it as E.164 when it is structurally possible.
     * Local-only lengths (a 7-digit number without area code) are rejected.
     */
    public Optional<String> toE164(String candidate) {
        try {
            Phonenumber.PhoneNumber parsed = util.parse(candidate, defaultRegion);
            if (util.isPossibleNumberWithReason(parsed) != PhoneNumberUtil.ValidationResult.IS_POSSIBLE) {
                return Optional.empty();
            }
            return Optional.of(util.format(parsed, PhoneNumberUtil.PhoneNumberFormat.E164));
        } catch (NumberParseException e) {
            return Optional.empty();
        }
    }

    /**
     * "+18153288957" to "815 328 8957" for read-back; other numbers are returned digit-grouped in threes.
     */
    public static String forSpeech(String e164) {
        if (e164 == null) return "";
        String digits = e164.replaceAll("\\D", "");
        if (e164.startsWith("+1") && digits.length() == 11) {
            digits = digits.substring(1);
            return digits.substring(0, 3) + " " + digits.substring(3, 6) + " " + digits.substring(6);
        }
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < digits.length(); i++) {
            if (i > 0 && i % 3 == 0) sb.append(' ');
            sb.append(digits.charAt(i));
        }
        return sb.toString();
    }
}
