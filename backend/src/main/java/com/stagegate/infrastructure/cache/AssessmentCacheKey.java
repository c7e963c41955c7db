package com.stagegate.infrastructure.cache;

import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Builds deterministic keys for quality assessments, one per conversational turn.
 * Storage of the assessments is up to the caller; this only generates the key.
 */
@Component
public class AssessmentCacheKey {

    static final String PREFIX = "assessment_";
    private static final int MESSAGE_PREFIX_LENGTH = 50;
    private static final int HASH_LENGTH = 16;

    /**
     * @param sessionId    conversation id
     * @param messageIndex position of the message in the conversation
     * @param stage        onboarding stage the message belongs to
     * @param messageText  user message; only the first 50 characters are hashed, null is treated as empty
     * @return {@code assessment_} followed by the first 16 hex characters of the SHA-256 digest
     */
    public String key(String sessionId, int messageIndex, int stage, String messageText) {
        String text = messageText != null ? messageText : "";
        String head = text.length() > MESSAGE_PREFIX_LENGTH ? text.substring(0, MESSAGE_PREFIX_LENGTH) : text;

        String raw = sessionId + ":" + messageIndex + ":" + stage + ":" + head;
        return PREFIX + sha256(raw).substring(0, HASH_LENGTH);
    }

    private String sha256(String input) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(input.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
