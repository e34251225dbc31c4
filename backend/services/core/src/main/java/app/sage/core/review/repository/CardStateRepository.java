package app.sage.core.review.repository;

import app.sage.core.review.entity.CardStateEntity;
import app.sage.core.review.entity.CardStateId;
import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface CardStateRepository extends JpaRepository<CardStateEntity, CardStateId> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select s from CardStateEntity s where s.cardId = :cardId and s.learnerId = :learnerId")
    Optional<CardStateEntity> findByIdForUpdate(@Param("cardId") UUID cardId,
                                                @Param("learnerId") UUID learnerId);

    List<CardStateEntity> findByLearnerIdAndCardIdIn(UUID learnerId, Collection<UUID> cardIds);

    List<CardStateEntity> findByLearnerIdAndDeckId(UUID learnerId, UUID deckId);

    List<CardStateEntity> findByLearnerId(UUID learnerId);

    @Query("""
        select s.cardId
        from CardStateEntity s
        where s.learnerId = :learnerId
          and s.deckId = :deckId
          and s.phase <> :newPhase
          and s.dueAt <= :now
        order by s.dueAt asc, s.cardId asc
        """)
    List<UUID> findDueCardIds(@Param("learnerId") UUID learnerId,
                              @Param("deckId") UUID deckId,
                              @Param("now") Instant now,
                              @Param("newPhase") String newPhase,
                              Pageable pageable);

    @Query("""
        select s.cardId
        from CardStateEntity s
        where s.learnerId = :learnerId
          and s.deckId = :deckId
          and s.phase <> :newPhase
        """)
    List<UUID> findStartedCardIds(@Param("learnerId") UUID learnerId,
                                  @Param("deckId") UUID deckId,
                                  @Param("newPhase") String newPhase);
}
