package app.sage.core.review.session;

/**
 * @param current    1-based position of the card being shown, capped at {@code total}
 * @param percentage {@code current / total} in percent, rounded to two decimals, 0 for an empty session
 */
public record SessionProgress(int current, int total, double percentage) {

    public static final SessionProgress NONE = new SessionProgress(0, 0, 0.0);

    static SessionProgress of(int index, int total) {
        if (total <= 0) {
            return NONE;
        }
        int current = Math.min(index + 1, total);
        double pct = Math.round(current * 10000.0 / total) / 100.0;
        return new SessionProgress(current, total, Math.max(0.0, Math.min(100.0, pct)));
    }
}
