package com.stagegate.domain.gate.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Validation gates in the order a venture must pass them.
 */
public enum GateId {
    DESIRABILITY,
    FEASIBILITY,
    VIABILITY,
    SCALE;

    /**
     * @return the gate that follows this one, or empty for SCALE
     */
    public Optional<GateId> next() {
        GateId[] values = values();
        return ordinal() + 1 < values.length
                ? Optional.of(values[ordinal() + 1])
                : Optional.empty();
    }

    public boolean isFinal() {
        return this == SCALE;
    }

    /**
     * Case-insensitive lookup; unknown or blank names yield empty.
     */
    public static Optional<GateId> fromName(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        String normalized = name.trim().toUpperCase();
        return Arrays.stream(values())
                .filter(g -> g.name().equals(normalized))
                .findFirst();
    }
}
