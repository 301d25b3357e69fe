package com.fulfillment.pipeline.compliance;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Redacts personal answers (names, birth data, payment references) so order input is safe to log.
 */
public final class UserInputMasker {

    private static final Set<String> PERSONAL_FIELDS = Set.of("name", "birthday", "birth_time", "birth_place", "gender");
    private static final String MASK = "***";

    private UserInputMasker() {}

    /** Copy of {@code input} with personal values masked; other values are kept. */
    public static Map<String, Object> mask(Map<String, Object> input) {
        if (input == null) return Map.of();
        Map<String, Object> masked = new LinkedHashMap<>();
        input.forEach((key, value) -> masked.put(key, PERSONAL_FIELDS.contains(key) ? maskValue(value) : value));
        return masked;
    }

    /** "pay_123456789" -> "pay_***6789". */
    public static String maskPaymentReference(String reference) {
        if (reference == null || reference.isBlank()) return null;
        if (reference.length() <= 8) return MASK;
        return reference.substring(0, 4) + MASK + reference.substring(reference.length() - 4);
    }

    private static Object maskValue(Object value) {
        if (value == null) return null;
        String s = value.toString();
        if (s.isEmpty()) return s;
        return s.charAt(0) + MASK;
    }
}
