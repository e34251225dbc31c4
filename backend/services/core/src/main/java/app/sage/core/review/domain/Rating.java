package app.sage.core.review.domain;

import java.util.Locale;

public enum Rating {
    AGAIN(1), HARD(2), GOOD(3), EASY(4);

    private final int code;
    Rating(int code) { this.code = code; }
    public int code() { return code; }

    public boolean isCorrect() {
        return compareTo(GOOD) >= 0;
    }

    public static Rating fromCode(int code) {
        for (Rating r : values()) {
            if (r.code == code) return r;
        }
        throw new IllegalArgumentException("Unknown rating code: " + code);
    }

    public static Rating fromString(String v) {
        if (v == null || v.isBlank()) {
            throw new IllegalArgumentException("Rating is required");
        }
        String trimmed = v.trim();
        if (trimmed.chars().allMatch(Character::isDigit)) {
            return fromCode(Integer.parseInt(trimmed));
        }
        return Rating.valueOf(trimmed.toUpperCase(Locale.ROOT));
    }
}
