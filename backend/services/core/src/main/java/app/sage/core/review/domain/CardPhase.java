package app.sage.core.review.domain;

import java.util.Locale;

public enum CardPhase {
    NEW, LEARNING, REVIEW, RELEARNING;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Lenient parse for values coming from the remote scheduler.
     *
     * @return the phase, or {@code null} when the value is blank or unknown
     */
    public static CardPhase fromWire(String v) {
        if (v == null || v.isBlank()) return null;
        for (CardPhase p : values()) {
            if (p.name().equalsIgnoreCase(v.trim())) return p;
        }
        return null;
    }
}
