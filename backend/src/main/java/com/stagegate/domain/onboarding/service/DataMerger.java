package com.stagegate.domain.onboarding.service;

import com.stagegate.domain.onboarding.model.ExtractedValue;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Merges newly extracted fields into previously collected ones.
 *
 * <p>Only keys present in the incoming map are touched. Null and empty values are skipped.
 * A certain existing value is never replaced by an uncertain one; in every other case the
 * incoming value wins. Both inputs are left untouched and a new map is returned.
 */
@Component
public class DataMerger {

    public Map<String, ExtractedValue> merge(Map<String, ExtractedValue> existing,
                                             Map<String, ExtractedValue> incoming) {
        Map<String, ExtractedValue> merged = existing == null ? new LinkedHashMap<>() : new LinkedHashMap<>(existing);
        if (incoming == null) {
            return merged;
        }

        for (Map.Entry<String, ExtractedValue> entry : incoming.entrySet()) {
            ExtractedValue next = entry.getValue();
            if (next == null || next.isEmpty()) {
                continue;
            }
            ExtractedValue current = merged.get(entry.getKey());
            if (current != null && !current.isUncertain() && next.isUncertain()) {
                continue;
            }
            merged.put(entry.getKey(), next);
        }
        return merged;
    }

    /**
     * Same rules over the wire representation, where uncertainty is carried by the text prefix.
     */
    public Map<String, Object> mergeRaw(Map<String, Object> existing, Map<String, Object> incoming) {
        return render(merge(tag(existing), tag(incoming)));
    }

    public Map<String, ExtractedValue> tag(Map<String, Object> raw) {
        Map<String, ExtractedValue> tagged = new LinkedHashMap<>();
        if (raw != null) {
            raw.forEach((key, value) -> tagged.put(key, ExtractedValue.fromRaw(value)));
        }
        return tagged;
    }

    public Map<String, Object> render(Map<String, ExtractedValue> values) {
        Map<String, Object> raw = new LinkedHashMap<>();
        values.forEach((key, value) -> raw.put(key, value == null ? null : value.toRaw()));
        return raw;
    }
}
