package com.carecore.observability;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Redacts protected health information from field maps before they are logged.
 * <p>
 * Synthetic or not, patient identity fields (names, MRN, birth date, contact details) never reach
 * the logs; clinical values do. Field names are matched case-insensitively by substring.
 */
public final class PhiRedactor {

    /** The replacement string for redacted values. */
    public static final String REDACTED = "[REDACTED]";

    private static final Set<String> DEFAULT_PHI_PATTERNS = Set.of(
            "name", "mrn", "birth", "dob", "address", "phone", "email", "ssn"
    );

    private final Set<String> patterns;
    private final Pattern compiledPattern;

    /** Creates a redactor with the default identity-field patterns. */
    public PhiRedactor() {
        this(DEFAULT_PHI_PATTERNS);
    }

    /**
     * Creates a redactor with custom field name patterns.
     *
     * @param patterns field name fragments to treat as identifying
     */
    public PhiRedactor(Set<String> patterns) {
        if (patterns == null || patterns.isEmpty()) {
            throw new IllegalArgumentException("patterns must not be null or empty");
        }
        this.patterns = Set.copyOf(patterns);
        String regex = String.join("|", this.patterns.stream()
                .map(Pattern::quote)
                .toList());
        this.compiledPattern = Pattern.compile(regex, Pattern.CASE_INSENSITIVE);
    }

    /**
     * Returns a copy of {@code data} with identifying values replaced by {@value #REDACTED},
     * preserving key order. Null input returns an empty map.
     */
    public Map<String, Object> redact(Map<String, ?> data) {
        if (data == null || data.isEmpty()) {
            return Map.of();
        }
        Map<String, Object> result = new LinkedHashMap<>(data.size());
        data.forEach((key, value) -> result.put(key, isIdentifying(key) ? REDACTED : value));
        return result;
    }

    /**
     * Checks whether a field name matches an identifying pattern.
     */
    public boolean isIdentifying(String fieldName) {
        if (fieldName == null) {
            return false;
        }
        return compiledPattern.matcher(fieldName).find();
    }

    /** Returns the patterns this redactor uses. */
    public Set<String> patterns() {
        return patterns;
    }
}
