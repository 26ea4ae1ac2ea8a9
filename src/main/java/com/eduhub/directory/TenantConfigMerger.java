package com.eduhub.directory;

import java.util.HashMap;
import java.util.Map;

/**
 * Shallow merge of tenant configuration maps.
 */
final class TenantConfigMerger {
    
    private TenantConfigMerger() {
    }
    
    static Map<String, Object> merge(Map<String, Object> existing, Map<String, Object> partial) {
        Map<String, Object> merged = existing != null ? new HashMap<>(existing) : new HashMap<>();
        if (partial == null) {
            return merged;
        }
        partial.forEach((key, value) -> {
            if (value == null) {
                merged.remove(key);
            } else {
                merged.put(key, value);
            }
        });
        return merged;
    }
}
