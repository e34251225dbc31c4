package app.sage.core.review.service;

import app.sage.core.review.api.PendingReview;
import app.sage.core.review.api.ReviewDeliveryPort;
import app.sage.core.review.domain.AuthoritativeState;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;

@Service
public class ReviewDeliveryService implements ReviewDeliveryPort {

    private final SchedulingStateStore store;
    private final ReviewLogService reviewLog;

    public ReviewDeliveryService(SchedulingStateStore store, ReviewLogService reviewLog) {
        this.store = store;
        this.reviewLog = reviewLog;
    }

    @Override
    public List<PendingReview> findRetryable(int maxAttempts, int batchSize) {
        return reviewLog.findRetryable(maxAttempts, batchSize);
    }

    @Override
    public List<PendingReview> findPending(UUID learnerId, int batchSize) {
        return reviewLog.findPending(learnerId, batchSize);
    }

    @Override
    @Transactional
    public boolean confirm(PendingReview review, AuthoritativeState remote) {
        boolean applied = store.applyAuthoritative(review.learnerId(), review.cardId(), remote, review.reviewedAt())
                .isPresent();
        reviewLog.markSynced(review.reviewLogId());
        return applied;
    }

    @Override
    public int recordFailure(PendingReview review, String error) {
        return reviewLog.markFailed(review.reviewLogId(), error);
    }
}
