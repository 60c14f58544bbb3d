package com.bastion.observability;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Masks the values of sensitive keys in maps that are about to be logged
 * (configuration dumps, audit details).
 * <p>
 * A key is sensitive when it contains one of the patterns, case-insensitively.
 */
public final class SensitiveDataRedactor {

    /** Replacement for redacted values. */
    public static final String REDACTED = "[REDACTED]";

    /** Key fragments treated as sensitive by default. */
    public static final Set<String> DEFAULT_PATTERNS =
            Set.of("password", "secret", "salt", "token", "credential", "apikey", "authorization");

    private final Pattern pattern;

    public SensitiveDataRedactor() {
        this(DEFAULT_PATTERNS);
    }

    public SensitiveDataRedactor(Set<String> patterns) {
        if (patterns == null || patterns.isEmpty()) {
            throw new IllegalArgumentException("patterns must not be empty");
        }
        this.pattern = Pattern.compile(
                String.join("|", patterns.stream().map(Pattern::quote).toList()), Pattern.CASE_INSENSITIVE);
    }

    /**
     * Returns a copy of {@code data} with sensitive values replaced by {@value #REDACTED}.
     * Nested maps are redacted recursively. Null input yields an empty map.
     */
    public Map<String, Object> redact(Map<String, ?> data) {
        if (data == null || data.isEmpty()) {
            return Map.of();
        }
        Map<String, Object> out = new LinkedHashMap<>(data.size());
        for (Map.Entry<String, ?> entry : data.entrySet()) {
            Object value = entry.getValue();
            if (isSensitive(entry.getKey())) {
                out.put(entry.getKey(), REDACTED);
            } else if (value instanceof Map<?, ?> nested) {
                out.put(entry.getKey(), redact(stringKeys(nested)));
            } else {
                out.put(entry.getKey(), value);
            }
        }
        return out;
    }

    public boolean isSensitive(String key) {
        return key != null && pattern.matcher(key).find();
    }

    private static Map<String, Object> stringKeys(Map<?, ?> map) {
        Map<String, Object> copy = new LinkedHashMap<>(map.size());
        map.forEach((k, v) -> copy.put(String.valueOf(k), v));
        return copy;
    }
}
