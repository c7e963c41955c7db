package com.stagegate.domain.onboarding.service;

import com.stagegate.domain.onboarding.model.ExtractedValue;
import com.stagegate.domain.onboarding.model.OnboardingFlow;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Validates raw extracted data against the flow's stage catalog before it reaches the merger.
 * Unknown keys and unsupported value shapes are dropped with a warning.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BriefSchema {

    private final StageCatalog stageCatalog;

    public Map<String, ExtractedValue> parse(OnboardingFlow flow, Map<String, Object> raw) {
        Map<String, ExtractedValue> parsed = new LinkedHashMap<>();
        if (raw == null) {
            return parsed;
        }
        Set<String> known = stageCatalog.knownFields(flow);
        for (Map.Entry<String, Object> entry : raw.entrySet()) {
            String key = entry.getKey();
            Object value = entry.getValue();
            if (!known.contains(key)) {
                log.warn("[Onboarding] Dropping unknown {} field '{}'", flow, key);
                continue;
            }
            if (value == null) {
                continue;
            }
            if (!isSupported(value)) {
                log.warn("[Onboarding] Dropping {} field '{}' with unsupported type {}",
                        flow, key, value.getClass().getSimpleName());
                continue;
            }
            parsed.put(key, ExtractedValue.fromRaw(value));
        }
        return parsed;
    }

    private boolean isSupported(Object value) {
        if (value instanceof String || value instanceof Number || value instanceof Boolean) {
            return true;
        }
        if (value instanceof List<?> list) {
            return list.stream().allMatch(v -> v instanceof String || v instanceof Number || v instanceof Boolean);
        }
        return false;
    }
}
