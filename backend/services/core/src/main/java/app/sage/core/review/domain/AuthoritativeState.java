package app.sage.core.review.domain;

import java.time.Instant;

/**
 * Scheduling fields returned by the remote scheduler. Any field may be absent.
 */
public record AuthoritativeState(
        Double stability,
        Double difficulty,
        CardPhase phase,
        Instant due
) {
}
