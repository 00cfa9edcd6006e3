package com.eyelevel.docsummarizer.entity;

import com.eyelevel.docsummarizer.model.EntityType;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Minimal clean-up rules for recognizer output.
 */
@Component
public class EntityFilter {

    private static final Pattern PRODUCT_CODE = Pattern.compile("^[A-Z]{3}-[A-Z]{2}-\\d{4}$");
    private static final Pattern DIGITS = Pattern.compile("^\\d+$");

    /**
     * Rejects single characters, text spanning lines, bare numbers and product codes such as
     * {@code ABC-DE-1234}.
     */
    public boolean shouldKeep(final String text, final EntityType type) {
        final String cleaned = text.strip();
        if (cleaned.length() <= 1) {
            return false;
        }
        if (text.indexOf('\n') >= 0 || text.indexOf('\r') >= 0) {
            return false;
        }
        if (DIGITS.matcher(cleaned).matches()) {
            return false;
        }
        return !PRODUCT_CODE.matcher(text.toUpperCase(Locale.ROOT)).matches();
    }

    /**
     * Administrative regions named "... Governorate" are places, not people.
     */
    public EntityType reclassify(final String text, final EntityType type) {
        if (type == EntityType.PERSON && text.toLowerCase(Locale.ROOT).contains("governorate")) {
            return EntityType.LOCATION;
        }
        return type;
    }
}
