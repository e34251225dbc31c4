package app.sage.core.card.repository;

import app.sage.core.card.domain.entity.CardEntity;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.UUID;

@Repository
public interface CardRepository extends JpaRepository<CardEntity, UUID> {

    @Query("""
        select c.id
        from CardEntity c
        where c.deckId = :deckId
        order by c.position asc, c.id asc
        """)
    List<UUID> findIdsByDeckId(@Param("deckId") UUID deckId, Pageable pageable);

    @Query("""
        select c.id
        from CardEntity c
        where c.deckId = :deckId
          and c.id not in :excludedIds
        order by c.position asc, c.id asc
        """)
    List<UUID> findIdsByDeckIdExcluding(@Param("deckId") UUID deckId,
                                        @Param("excludedIds") Collection<UUID> excludedIds,
                                        Pageable pageable);

    long countByDeckId(UUID deckId);
}
