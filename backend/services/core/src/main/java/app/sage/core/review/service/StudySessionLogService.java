package app.sage.core.review.service;

import app.sage.core.review.entity.StudySessionLogEntity;
import app.sage.core.review.repository.StudySessionLogRepository;
import app.sage.core.review.session.SessionStatus;
import app.sage.core.review.session.SessionSummary;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Service
public class StudySessionLogService {

    private final StudySessionLogRepository repository;

    public StudySessionLogService(StudySessionLogRepository repository) {
        this.repository = repository;
    }

    @Transactional
    public void record(SessionSummary summary, Instant endedAt) {
        StudySessionLogEntity entity = new StudySessionLogEntity();
        entity.setSessionId(summary.sessionId());
        entity.setLearnerId(summary.learnerId());
        entity.setDeckId(summary.deckId());
        entity.setStartedAt(summary.startedAt());
        entity.setEndedAt(endedAt);
        entity.setDurationMs(Math.max(0, Duration.between(summary.startedAt(), endedAt).toMillis()));
        entity.setCardsTotal(summary.total());
        entity.setCardsReviewed(summary.reviewed());
        entity.setCardsCorrect(summary.correct());
        entity.setCompleted(summary.status() == SessionStatus.COMPLETE);
        repository.save(entity);
    }

    @Transactional(readOnly = true)
    public long countSessionsSince(UUID learnerId, Instant since) {
        return repository.countByLearnerIdAndEndedAtGreaterThanEqual(learnerId, since);
    }

    @Transactional(readOnly = true)
    public List<Instant> sessionEndTimes(UUID learnerId) {
        return repository.findEndTimes(learnerId);
    }
}
