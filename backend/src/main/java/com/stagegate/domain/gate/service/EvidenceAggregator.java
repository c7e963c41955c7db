package com.stagegate.domain.gate.service;

import com.stagegate.domain.gate.model.EvidenceItem;
import com.stagegate.domain.gate.model.EvidenceStrength;
import com.stagegate.domain.gate.model.EvidenceSummary;
import com.stagegate.domain.gate.model.EvidenceType;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Side-effect-free reducers over an ordered evidence list.
 * Null lists, null items and missing fields count as absent; nothing here throws.
 */
@Component
public class EvidenceAggregator {

    /**
     * Arithmetic mean of quality scores. Contradictions count like any other item.
     * Missing scores contribute 0 and scores outside [0,1] are clamped.
     *
     * @return 0 for an empty list
     */
    public double averageQuality(List<EvidenceItem> items) {
        List<EvidenceItem> present = present(items);
        if (present.isEmpty()) {
            return 0.0;
        }
        double sum = 0.0;
        for (EvidenceItem item : present) {
            sum += clampQuality(item.qualityScore());
        }
        return sum / present.size();
    }

    public int experimentCount(List<EvidenceItem> items) {
        return (int) present(items).stream()
                .filter(i -> i.type() == EvidenceType.EXPERIMENT)
                .count();
    }

    /**
     * @return counts for every strength tier, zero-filled
     */
    public Map<EvidenceStrength, Integer> strengthMix(List<EvidenceItem> items) {
        Map<EvidenceStrength, Integer> mix = new EnumMap<>(EvidenceStrength.class);
        for (EvidenceStrength strength : EvidenceStrength.values()) {
            mix.put(strength, 0);
        }
        for (EvidenceItem item : present(items)) {
            if (item.strength() != null) {
                mix.merge(item.strength(), 1, Integer::sum);
            }
        }
        return Collections.unmodifiableMap(mix);
    }

    public Set<EvidenceType> evidenceTypeSet(List<EvidenceItem> items) {
        Set<EvidenceType> types = EnumSet.noneOf(EvidenceType.class);
        for (EvidenceItem item : present(items)) {
            if (item.type() != null) {
                types.add(item.type());
            }
        }
        return Collections.unmodifiableSet(types);
    }

    public int contradictionCount(List<EvidenceItem> items) {
        return (int) present(items).stream().filter(EvidenceItem::contradiction).count();
    }

    public EvidenceSummary summarize(List<EvidenceItem> items) {
        return new EvidenceSummary(
                present(items).size(),
                experimentCount(items),
                averageQuality(items),
                strengthMix(items),
                evidenceTypeSet(items),
                contradictionCount(items));
    }

    private List<EvidenceItem> present(List<EvidenceItem> items) {
        if (items == null) {
            return List.of();
        }
        return items.stream().filter(Objects::nonNull).toList();
    }

    private double clampQuality(Double score) {
        if (score == null || score.isNaN()) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, score));
    }
}
