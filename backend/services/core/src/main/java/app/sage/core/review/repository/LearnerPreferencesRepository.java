package app.sage.core.review.repository;

import app.sage.core.review.entity.LearnerPreferencesEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.UUID;

@Repository
public interface LearnerPreferencesRepository extends JpaRepository<LearnerPreferencesEntity, UUID> {
}
