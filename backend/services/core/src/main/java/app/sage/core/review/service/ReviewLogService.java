package app.sage.core.review.service;

import app.sage.core.review.api.PendingReview;
import app.sage.core.review.domain.CardPhase;
import app.sage.core.review.domain.Rating;
import app.sage.core.review.domain.ReviewRecord;
import app.sage.core.review.domain.ReviewSyncStatus;
import app.sage.core.review.domain.SchedulingState;
import app.sage.core.review.entity.ReviewLogEntity;
import app.sage.core.review.repository.ReviewLogRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Append-only review history plus the delivery bookkeeping towards the remote scheduler.
 */
@Service
public class ReviewLogService {

    private static final Logger log = LoggerFactory.getLogger(ReviewLogService.class);
    private static final int MAX_ERROR_LENGTH = 500;

    private final ReviewLogRepository repository;
    private final Clock clock;

    public ReviewLogService(ReviewLogRepository repository, Clock clock) {
        this.repository = repository;
        this.clock = clock;
    }

    @Transactional
    public PendingReview record(UUID learnerId,
                                UUID deckId,
                                UUID cardId,
                                String algorithmId,
                                Rating rating,
                                SchedulingState before,
                                SchedulingState after,
                                long reviewTimeMs,
                                Instant reviewedAt) {
        ReviewLogEntity entity = new ReviewLogEntity();
        entity.setCardId(cardId);
        entity.setLearnerId(learnerId);
        entity.setDeckId(deckId);
        entity.setAlgorithmId(algorithmId);
        entity.setRating((short) rating.code());
        entity.setPhaseAtReview(before.phase().wireName());
        entity.setElapsedDays(after.elapsedDays());
        entity.setScheduledDays(after.scheduledDays());
        entity.setReviewTimeMs(reviewTimeMs);
        entity.setReviewedAt(reviewedAt);
        entity.setSyncStatus(ReviewSyncStatus.PENDING);
        entity.setSyncAttempts(0);
        ReviewLogEntity saved = repository.save(entity);
        return toPending(saved);
    }

    @Transactional
    public void markSynced(Long reviewLogId) {
        if (reviewLogId == null) {
            return;
        }
        repository.findById(reviewLogId).ifPresent(entity -> {
            entity.setSyncStatus(ReviewSyncStatus.SYNCED);
            entity.setSyncAttempts(entity.getSyncAttempts() + 1);
            entity.setLastSyncError(null);
            entity.setSyncedAt(clock.instant());
            repository.save(entity);
        });
    }

    /**
     * @return attempts made so far, including this one
     */
    @Transactional
    public int markFailed(Long reviewLogId, String error) {
        if (reviewLogId == null) {
            return 0;
        }
        return repository.findById(reviewLogId).map(entity -> {
            entity.setSyncAttempts(entity.getSyncAttempts() + 1);
            entity.setLastSyncError(truncate(error));
            repository.save(entity);
            return entity.getSyncAttempts();
        }).orElseGet(() -> {
            log.warn("Review log not found while recording sync failure reviewLogId={}", reviewLogId);
            return 0;
        });
    }

    @Transactional(readOnly = true)
    public List<PendingReview> findRetryable(int maxAttempts, int batchSize) {
        return repository.findRetryable(ReviewSyncStatus.PENDING, maxAttempts, PageRequest.of(0, Math.max(1, batchSize)))
                .stream()
                .map(ReviewLogService::toPending)
                .toList();
    }

    @Transactional(readOnly = true)
    public List<PendingReview> findPending(UUID learnerId, int batchSize) {
        return repository.findByLearnerAndStatus(learnerId, ReviewSyncStatus.PENDING, PageRequest.of(0, Math.max(1, batchSize)))
                .stream()
                .map(ReviewLogService::toPending)
                .toList();
    }

    @Transactional(readOnly = true)
    public long countNewCardsIntroducedSince(UUID learnerId, Instant since) {
        return repository.countByLearnerIdAndPhaseAtReviewAndReviewedAtGreaterThanEqual(
                learnerId, CardPhase.NEW.wireName(), since);
    }

    @Transactional(readOnly = true)
    public List<ReviewRecord> history(UUID learnerId) {
        List<ReviewRecord> out = new ArrayList<>();
        for (ReviewLogEntity entity : repository.findByLearnerIdOrderByReviewedAtAsc(learnerId)) {
            CardPhase phase = CardPhase.fromWire(entity.getPhaseAtReview());
            Rating rating;
            try {
                rating = Rating.fromCode(entity.getRating());
            } catch (IllegalArgumentException ex) {
                log.warn("Skipping review log with unknown rating reviewLogId={} rating={}", entity.getId(), entity.getRating());
                continue;
            }
            out.add(new ReviewRecord(
                    entity.getCardId(),
                    entity.getDeckId(),
                    rating,
                    phase == null ? CardPhase.NEW : phase,
                    entity.getReviewTimeMs(),
                    entity.getReviewedAt()
            ));
        }
        return out;
    }

    private static PendingReview toPending(ReviewLogEntity entity) {
        return new PendingReview(
                entity.getId(),
                entity.getLearnerId(),
                entity.getCardId(),
                Rating.fromCode(entity.getRating()),
                entity.getReviewTimeMs(),
                entity.getReviewedAt(),
                entity.getSyncAttempts()
        );
    }

    private static String truncate(String error) {
        if (error == null || error.length() <= MAX_ERROR_LENGTH) {
            return error;
        }
        return error.substring(0, MAX_ERROR_LENGTH);
    }
}
