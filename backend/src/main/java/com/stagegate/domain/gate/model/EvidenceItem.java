package com.stagegate.domain.gate.model;

/**
 * A single recorded piece of evidence. Any component may be null when the source left it out.
 *
 * @param type          evidence type (nullable)
 * @param strength      qualitative strength tier (nullable)
 * @param qualityScore  quality in [0,1] (nullable)
 * @param contradiction true when the evidence contradicts the hypothesis under test
 */
public record EvidenceItem(
        EvidenceType type,
        EvidenceStrength strength,
        Double qualityScore,
        boolean contradiction
) {
    public static EvidenceItem of(EvidenceType type, EvidenceStrength strength, double qualityScore) {
        return new EvidenceItem(type, strength, qualityScore, false);
    }
}
