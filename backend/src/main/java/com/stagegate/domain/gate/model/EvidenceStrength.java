package com.stagegate.domain.gate.model;

import java.util.Arrays;

public enum EvidenceStrength {
    WEAK("weak"),
    MEDIUM("medium"),
    STRONG("strong");

    private final String code;

    EvidenceStrength(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    public static EvidenceStrength fromCode(String code) {
        if (code == null) {
            return null;
        }
        String normalized = code.trim().toLowerCase();
        return Arrays.stream(values())
                .filter(s -> s.code.equals(normalized))
                .findFirst()
                .orElse(null);
    }
}
