package app.sage.core.sync.client;

import java.time.Instant;
import java.util.UUID;

/**
 * @param reviewedAt when the review happened; lets the remote side recognise a resubmission
 */
public record ReviewSubmissionRequest(
        UUID cardId,
        int rating,
        long reviewTimeMs,
        Instant reviewedAt
) {
}
