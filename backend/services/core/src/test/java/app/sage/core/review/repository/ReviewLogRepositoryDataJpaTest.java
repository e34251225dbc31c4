package app.sage.core.review.repository;

import app.sage.core.review.domain.ReviewSyncStatus;
import app.sage.core.review.entity.ReviewLogEntity;
import app.sage.core.support.PostgresIntegrationTest;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.data.domain.PageRequest;
import org.springframework.test.context.ActiveProfiles;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

@DataJpaTest
@ActiveProfiles("test")
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
class ReviewLogRepositoryDataJpaTest extends PostgresIntegrationTest {

    @Autowired
    ReviewLogRepository repository;

    @Test
    void findRetryable_skipsSyncedAndExhaustedLogs() {
        UUID learnerId = UUID.randomUUID();
        ReviewLogEntity fresh = repository.save(log(learnerId, "new", Instant.parse("2025-03-10T09:00:00Z"), ReviewSyncStatus.PENDING, 0));
        ReviewLogEntity retried = repository.save(log(learnerId, "review", Instant.parse("2025-03-10T10:00:00Z"), ReviewSyncStatus.PENDING, 2));
        ReviewLogEntity exhausted = repository.save(log(learnerId, "review", Instant.parse("2025-03-10T11:00:00Z"), ReviewSyncStatus.PENDING, 3));
        repository.save(log(learnerId, "review", Instant.parse("2025-03-10T12:00:00Z"), ReviewSyncStatus.SYNCED, 1));
        repository.flush();

        List<ReviewLogEntity> retryable = repository.findRetryable(ReviewSyncStatus.PENDING, 3, PageRequest.of(0, 100));
        List<ReviewLogEntity> pending = repository.findByLearnerAndStatus(learnerId, ReviewSyncStatus.PENDING, PageRequest.of(0, 100));

        assertThat(retryable).extracting(ReviewLogEntity::getId)
                .contains(fresh.getId(), retried.getId())
                .doesNotContain(exhausted.getId());
        assertThat(pending).extracting(ReviewLogEntity::getId)
                .containsExactly(fresh.getId(), retried.getId(), exhausted.getId());
    }

    @Test
    void countNewCardsIntroducedSince_countsOnlyNewPhaseReviewsAfterCutoff() {
        UUID learnerId = UUID.randomUUID();
        repository.save(log(learnerId, "new", Instant.parse("2025-03-09T23:59:00Z"), ReviewSyncStatus.SYNCED, 1));
        repository.save(log(learnerId, "new", Instant.parse("2025-03-10T00:00:00Z"), ReviewSyncStatus.PENDING, 0));
        repository.save(log(learnerId, "new", Instant.parse("2025-03-10T08:00:00Z"), ReviewSyncStatus.PENDING, 0));
        repository.save(log(learnerId, "learning", Instant.parse("2025-03-10T08:05:00Z"), ReviewSyncStatus.PENDING, 0));
        repository.save(log(UUID.randomUUID(), "new", Instant.parse("2025-03-10T08:00:00Z"), ReviewSyncStatus.PENDING, 0));
        repository.flush();

        long count = repository.countByLearnerIdAndPhaseAtReviewAndReviewedAtGreaterThanEqual(
                learnerId, "new", Instant.parse("2025-03-10T00:00:00Z"));

        assertThat(count).isEqualTo(2);
    }

    private ReviewLogEntity log(UUID learnerId, String phase, Instant reviewedAt, ReviewSyncStatus status, int attempts) {
        ReviewLogEntity entity = new ReviewLogEntity();
        entity.setCardId(UUID.randomUUID());
        entity.setLearnerId(learnerId);
        entity.setDeckId(UUID.randomUUID());
        entity.setAlgorithmId("fsrs");
        entity.setRating((short) 3);
        entity.setPhaseAtReview(phase);
        entity.setElapsedDays(0.0);
        entity.setScheduledDays(1.0);
        entity.setReviewTimeMs(1000L);
        entity.setReviewedAt(reviewedAt);
        entity.setSyncStatus(status);
        entity.setSyncAttempts(attempts);
        return entity;
    }
}
