package tech.yump.auditstore.audit;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Validates and freezes the open-ended metadata bag of an audit event.
 * Accepted values: null, strings, numbers, booleans, nested maps with string keys,
 * and lists of accepted values.
 */
final class EventMetadata {

    private EventMetadata() {
    }

    static Map<String, Object> copyOf(Map<String, ?> metadata) {
        if (metadata == null || metadata.isEmpty()) {
            return Collections.emptyMap();
        }
        return copyMap(metadata, "metadata");
    }

    private static Map<String, Object> copyMap(Map<?, ?> source, String path) {
        Map<String, Object> copy = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : source.entrySet()) {
            if (!(entry.getKey() instanceof String key)) {
                throw new AuditEventValidationException("Metadata keys must be strings at " + path + ", got: " + entry.getKey());
            }
            copy.put(key, copyValue(entry.getValue(), path + "." + key));
        }
        return Collections.unmodifiableMap(copy);
    }

    private static Object copyValue(Object value, String path) {
        if (value == null || value instanceof String || value instanceof Number || value instanceof Boolean) {
            return value;
        }
        if (value instanceof Map<?, ?> nested) {
            return copyMap(nested, path);
        }
        if (value instanceof Collection<?> items) {
            List<Object> copy = new ArrayList<>(items.size());
            int index = 0;
            for (Object item : items) {
                copy.add(copyValue(item, path + "[" + index++ + "]"));
            }
            return Collections.unmodifiableList(copy);
        }
        throw new AuditEventValidationException(
                "Unsupported metadata value at " + path + ": " + value.getClass().getName());
    }
}
