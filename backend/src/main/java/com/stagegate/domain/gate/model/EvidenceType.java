package com.stagegate.domain.gate.model;

import java.util.Arrays;

public enum EvidenceType {
    INTERVIEW("interview"),
    DESK("desk"),
    ANALYTICS("analytics"),
    EXPERIMENT("experiment");

    private final String code;

    EvidenceType(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    /**
     * @return the matching type, or null when the code is missing or unknown
     */
    public static EvidenceType fromCode(String code) {
        if (code == null) {
            return null;
        }
        String normalized = code.trim().toLowerCase();
        return Arrays.stream(values())
                .filter(t -> t.code.equals(normalized))
                .findFirst()
                .orElse(null);
    }
}
