package app.sage.core.review.domain;

import java.time.Instant;

public record IntervalPreview(
        Rating rating,
        CardPhase phase,
        double scheduledDays,
        Instant due
) {
}
