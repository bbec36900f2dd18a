package com.modelretraining.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of the validation gate or the performance comparator. A rejection is an
 * expected result, not an error, so it is carried as a value with its reason.
 */
public record Verdict(boolean accepted, String reason, Map<String, Object> details) {

    public Verdict {
        details = details == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    public static Verdict accepted(Map<String, Object> details) {
        return new Verdict(true, null, details);
    }

    public static Verdict rejected(String reason) {
        return new Verdict(false, reason, Map.of("reason", reason));
    }

    public static Verdict rejected(String reason, Map<String, Object> details) {
        Map<String, Object> merged = new LinkedHashMap<>(details);
        merged.put("reason", reason);
        return new Verdict(false, reason, merged);
    }
}
