package com.gt.tutor.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Profile document properties this application does not interpret, kept so a load and save cycle writes them back
 * unchanged. Values are plain JSON values (maps, lists, strings, numbers, booleans).
 */
public record RetainedProperties(Map<String, Object> profile,
                                 Map<String, Object> preferences,
                                 Map<String, Object> tracking) {

    public RetainedProperties {
        profile = copyOf(profile);
        preferences = copyOf(preferences);
        tracking = copyOf(tracking);
    }

    public static RetainedProperties empty() {
        return new RetainedProperties(Map.of(), Map.of(), Map.of());
    }

    private static Map<String, Object> copyOf(Map<String, Object> properties) {
        return properties == null || properties.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(properties));
    }
}
