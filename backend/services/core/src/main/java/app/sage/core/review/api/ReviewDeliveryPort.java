package app.sage.core.review.api;

import app.sage.core.review.domain.AuthoritativeState;

import java.util.List;
import java.util.UUID;

/**
 * Delivery bookkeeping for reviews that still have to reach the remote scheduler.
 */
public interface ReviewDeliveryPort {

    List<PendingReview> findRetryable(int maxAttempts, int batchSize);

    List<PendingReview> findPending(UUID learnerId, int batchSize);

    /**
     * Stores the remote result for the review and marks it delivered.
     *
     * @return {@code false} when the stored state had already moved past this review
     */
    boolean confirm(PendingReview review, AuthoritativeState remote);

    /**
     * @return delivery attempts made so far, including this one
     */
    int recordFailure(PendingReview review, String error);
}
