package app.sage.core.review.repository;

import app.sage.core.review.domain.ReviewSyncStatus;
import app.sage.core.review.entity.ReviewLogEntity;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Repository
public interface ReviewLogRepository extends JpaRepository<ReviewLogEntity, Long> {

    List<ReviewLogEntity> findByLearnerIdOrderByReviewedAtAsc(UUID learnerId);

    long countByLearnerIdAndPhaseAtReviewAndReviewedAtGreaterThanEqual(UUID learnerId,
                                                                      String phaseAtReview,
                                                                      Instant since);

    @Query("""
        select l
        from ReviewLogEntity l
        where l.syncStatus = :status
          and l.syncAttempts < :maxAttempts
        order by l.reviewedAt asc, l.id asc
        """)
    List<ReviewLogEntity> findRetryable(@Param("status") ReviewSyncStatus status,
                                        @Param("maxAttempts") int maxAttempts,
                                        Pageable pageable);

    @Query("""
        select l
        from ReviewLogEntity l
        where l.learnerId = :learnerId
          and l.syncStatus = :status
        order by l.reviewedAt asc, l.id asc
        """)
    List<ReviewLogEntity> findByLearnerAndStatus(@Param("learnerId") UUID learnerId,
                                                 @Param("status") ReviewSyncStatus status,
                                                 Pageable pageable);
}
