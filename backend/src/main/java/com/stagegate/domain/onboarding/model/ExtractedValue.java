package com.stagegate.domain.onboarding.model;

/**
 * A value extracted from conversation, tagged with how confidently it was stated.
 *
 * <p>Upstream assessments mark hedged answers with the {@value #UNCERTAIN_PREFIX} text prefix.
 * That prefix is parsed once in {@link #fromRaw(Object)} and rendered again in {@link #toRaw()};
 * nothing else inspects string contents.
 */
public sealed interface ExtractedValue permits ExtractedValue.Certain, ExtractedValue.Uncertain {

    String UNCERTAIN_PREFIX = "uncertain: ";

    Object value();

    boolean isUncertain();

    /**
     * @return the wire representation, with the uncertainty prefix re-applied where needed
     */
    Object toRaw();

    /**
     * @return true for a certain empty string, which carries no information
     */
    default boolean isEmpty() {
        return !isUncertain() && "".equals(value());
    }

    /**
     * @return null for a null input; strings carrying the uncertainty prefix become {@link Uncertain};
     *         everything else, including non-string values, is {@link Certain}
     */
    static ExtractedValue fromRaw(Object raw) {
        if (raw == null) {
            return null;
        }
        if (raw instanceof ExtractedValue tagged) {
            return tagged;
        }
        if (raw instanceof String text && text.startsWith(UNCERTAIN_PREFIX)) {
            return new Uncertain(text.substring(UNCERTAIN_PREFIX.length()));
        }
        return new Certain(raw);
    }

    static Certain certain(Object value) {
        return new Certain(value);
    }

    static Uncertain uncertain(String value) {
        return new Uncertain(value);
    }

    record Certain(Object value) implements ExtractedValue {
        @Override
        public boolean isUncertain() {
            return false;
        }

        @Override
        public Object toRaw() {
            return value;
        }
    }

    record Uncertain(String value) implements ExtractedValue {
        @Override
        public boolean isUncertain() {
            return true;
        }

        @Override
        public Object toRaw() {
            return UNCERTAIN_PREFIX + value;
        }
    }
}
