package com.ai.intake.extraction.phone;

import com.ai.intake.extraction.ExtractionLayer;
import com.ai.intake.extraction.ExtractionResult;
import com.google.i18n.phonenumbers.PhoneNumberMatch;
import com.google.i18n.phonenumbers.PhoneNumberUtil;

import java.util.Iterator;

/**
 * Scans free text for a number that is valid in the default region.
 */
public class RegionValidationLayer implements ExtractionLayer<String> {

    private final PhoneNumbers phoneNumbers;

    public RegionValidationLayer(PhoneNumbers phoneNumbers) {
        this.phoneNumbers = phoneNumbers;
    }

    @Override
    public String name() {
        return "region_validation";
    }

    @Override
    public ExtractionResult<String> extract(String transcript) {
        PhoneNumberUtil util = phoneNumbers.util();
        Iterator<PhoneNumberMatch> matches = util.findNumbers(
                transcript, phoneNumbers.defaultRegion(), PhoneNumberUtil.Leniency.VALID, Long.MAX_VALUE).iterator();
        if (!matches.hasNext()) {
            return ExtractionResult.failed("no_valid_number");
        }
        String e164 = util.format(matches.next().number(), PhoneNumberUtil.PhoneNumberFormat.E164);
        return ExtractionResult.success(e164, name());
    }
}
