package app.sage.core.review.repository;

import app.sage.core.review.entity.StudySessionLogEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Repository
public interface StudySessionLogRepository extends JpaRepository<StudySessionLogEntity, UUID> {

    long countByLearnerIdAndEndedAtGreaterThanEqual(UUID learnerId, Instant since);

    @Query("select s.endedAt from StudySessionLogEntity s where s.learnerId = :learnerId order by s.endedAt asc")
    List<Instant> findEndTimes(@Param("learnerId") UUID learnerId);
}
