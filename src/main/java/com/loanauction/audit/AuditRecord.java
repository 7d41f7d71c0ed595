package com.loanauction.audit;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * State-changing event emitted by the engine after the change is published.
 */
public record AuditRecord(String eventType,
                          String entityType,
                          String entityId,
                          String userId,
                          String action,
                          Map<String, Object> details,
                          Instant timestamp) {

    public AuditRecord {
        details = details == null ? Map.of() : Map.copyOf(details);
    }

    /**
     * Builds a details map from alternating keys and values, skipping
     * {@code null} values.
     */
    public static Map<String, Object> details(Object... keysAndValues) {
        if (keysAndValues.length % 2 != 0) {
            throw new IllegalArgumentException("details expects key/value pairs");
        }
        Map<String, Object> details = new LinkedHashMap<>();
        for (int i = 0; i < keysAndValues.length; i += 2) {
            Object value = keysAndValues[i + 1];
            if (value != null) {
                details.put(String.valueOf(keysAndValues[i]), value);
            }
        }
        return details;
    }
}
