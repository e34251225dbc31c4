package app.sage.core.review.algorithm;

import app.sage.core.review.algorithm.impl.FsrsAlgorithm;
import app.sage.core.review.domain.CardPhase;
import app.sage.core.review.domain.Rating;
import app.sage.core.review.domain.SchedulingState;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class FsrsAlgorithmTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final Instant NOW = Instant.parse("2025-03-10T12:00:00Z");

    private final FsrsAlgorithm algorithm = new FsrsAlgorithm();
    private final SchedulerSettings settings = SchedulerSettings.defaults();

    @Test
    void newCard_againStartsFirstLearningStep() {
        SchedulingState next = algorithm.apply(SchedulingState.newCard(NOW), Rating.AGAIN, NOW, settings);

        assertThat(next.phase()).isEqualTo(CardPhase.LEARNING);
        assertThat(next.learningStep()).isZero();
        assertThat(next.due()).isEqualTo(NOW.plus(Duration.ofMinutes(1)));
        assertThat(next.reps()).isEqualTo(1);
        assertThat(next.lapses()).isZero();
        assertThat(next.lastReview()).isEqualTo(NOW);
    }

    @Test
    void newCard_hardWaitsBetweenFirstTwoSteps() {
        SchedulingState next = algorithm.apply(SchedulingState.newCard(NOW), Rating.HARD, NOW, settings);

        assertThat(next.phase()).isEqualTo(CardPhase.LEARNING);
        assertThat(next.learningStep()).isZero();
        assertThat(next.due()).isEqualTo(NOW.plusSeconds(330));
    }

    @Test
    void newCard_goodMovesToNextStep() {
        SchedulingState next = algorithm.apply(SchedulingState.newCard(NOW), Rating.GOOD, NOW, settings);

        assertThat(next.phase()).isEqualTo(CardPhase.LEARNING);
        assertThat(next.learningStep()).isEqualTo(1);
        assertThat(next.due()).isEqualTo(NOW.plus(Duration.ofMinutes(10)));
    }

    @Test
    void newCard_easySkipsLearning() {
        SchedulingState next = algorithm.apply(SchedulingState.newCard(NOW), Rating.EASY, NOW, settings);

        assertThat(next.phase()).isEqualTo(CardPhase.REVIEW);
        assertThat(next.scheduledDays()).isEqualTo(4.0);
        assertThat(next.due()).isEqualTo(NOW.plus(Duration.ofDays(4)));
    }

    @Test
    void learning_goodOnLastStepGraduates() {
        SchedulingState learning = algorithm.apply(SchedulingState.newCard(NOW), Rating.GOOD, NOW, settings);
        Instant later = NOW.plus(Duration.ofMinutes(10));

        SchedulingState next = algorithm.apply(learning, Rating.GOOD, later, settings);

        assertThat(next.phase()).isEqualTo(CardPhase.REVIEW);
        assertThat(next.learningStep()).isZero();
        assertThat(next.due()).isEqualTo(later.plus(Duration.ofDays(1)));
        assertThat(next.reps()).isEqualTo(2);
    }

    @Test
    void learning_againReturnsToFirstStepWithoutLapse() {
        SchedulingState learning = algorithm.apply(SchedulingState.newCard(NOW), Rating.GOOD, NOW, settings);

        SchedulingState next = algorithm.apply(learning, Rating.AGAIN, NOW.plusSeconds(600), settings);

        assertThat(next.phase()).isEqualTo(CardPhase.LEARNING);
        assertThat(next.learningStep()).isZero();
        assertThat(next.lapses()).isZero();
    }

    @Test
    void review_againLapsesIntoRelearning() {
        SchedulingState review = reviewState(12.0, 5.0, 10);

        SchedulingState next = algorithm.apply(review, Rating.AGAIN, NOW, settings);

        assertThat(next.phase()).isEqualTo(CardPhase.RELEARNING);
        assertThat(next.lapses()).isEqualTo(review.lapses() + 1);
        assertThat(next.stability()).isLessThanOrEqualTo(review.stability());
        assertThat(next.due()).isEqualTo(NOW.plus(Duration.ofMinutes(10)));
    }

    @Test
    void review_successfulRatingsGrowStabilityAndUseWholeDays() {
        SchedulingState review = reviewState(12.0, 5.0, 10);

        SchedulingState hard = algorithm.apply(review, Rating.HARD, NOW, settings);
        SchedulingState good = algorithm.apply(review, Rating.GOOD, NOW, settings);
        SchedulingState easy = algorithm.apply(review, Rating.EASY, NOW, settings);

        assertThat(good.stability()).isGreaterThan(review.stability());
        assertThat(easy.stability()).isGreaterThan(good.stability());
        assertThat(hard.scheduledDays()).isGreaterThanOrEqualTo(1.0);
        assertThat(good.scheduledDays()).isGreaterThan(hard.scheduledDays());
        assertThat(easy.scheduledDays()).isGreaterThan(good.scheduledDays());
        assertThat(good.scheduledDays() % 1.0).isEqualTo(0.0);
        assertThat(good.phase()).isEqualTo(CardPhase.REVIEW);
        assertThat(good.lapses()).isEqualTo(review.lapses());
    }

    @Test
    void review_intervalIsCappedByMaximumInterval() {
        ObjectNode cfg = MAPPER.createObjectNode();
        cfg.put("maximumIntervalDays", 30);
        SchedulerSettings capped = SchedulerSettings.from(cfg);

        SchedulingState next = algorithm.apply(reviewState(500.0, 3.0, 400), Rating.EASY, NOW, capped);

        assertThat(next.scheduledDays()).isEqualTo(30.0);
        assertThat(next.due()).isEqualTo(NOW.plus(Duration.ofDays(30)));
    }

    @Test
    void stabilityAndDifficultyStayWithinBounds() {
        SchedulingState extreme = new SchedulingState(36000.0, 1.0, 0, 0, 50, 0, CardPhase.REVIEW, 0,
                NOW, NOW.minus(Duration.ofDays(3000)));

        SchedulingState next = algorithm.apply(extreme, Rating.EASY, NOW, settings);

        assertThat(next.stability()).isBetween(SchedulerSettings.MIN_STABILITY, SchedulerSettings.MAX_STABILITY);
        assertThat(next.difficulty()).isBetween(SchedulerSettings.MIN_DIFFICULTY, SchedulerSettings.MAX_DIFFICULTY);
    }

    @Test
    void nonFiniteStoredValuesAreSanitized() {
        SchedulingState broken = new SchedulingState(Double.NaN, -3.0, 0, 0, 4, 1, CardPhase.REVIEW, 0,
                NOW, NOW.minus(Duration.ofDays(5)));

        SchedulingState next = algorithm.apply(broken, Rating.GOOD, NOW, settings);

        assertThat(Double.isFinite(next.stability())).isTrue();
        assertThat(next.difficulty()).isBetween(SchedulerSettings.MIN_DIFFICULTY, SchedulerSettings.MAX_DIFFICULTY);
    }

    @Test
    void emptyLearningStepsFallBackToMinimumInterval() {
        ObjectNode cfg = MAPPER.createObjectNode();
        cfg.putArray("learningStepsMinutes");
        cfg.put("minimumIntervalMinutes", 5);
        SchedulerSettings noSteps = SchedulerSettings.from(cfg);

        SchedulingState again = algorithm.apply(SchedulingState.newCard(NOW), Rating.AGAIN, NOW, noSteps);
        SchedulingState good = algorithm.apply(SchedulingState.newCard(NOW), Rating.GOOD, NOW, noSteps);

        assertThat(again.due()).isEqualTo(NOW.plus(Duration.ofMinutes(5)));
        assertThat(good.phase()).isEqualTo(CardPhase.REVIEW);
    }

    @Test
    void relearning_goodGraduatesBackToReview() {
        SchedulingState lapsed = algorithm.apply(reviewState(12.0, 5.0, 10), Rating.AGAIN, NOW, settings);
        Instant later = NOW.plus(Duration.ofMinutes(10));

        SchedulingState next = algorithm.apply(lapsed, Rating.GOOD, later, settings);

        assertThat(next.phase()).isEqualTo(CardPhase.REVIEW);
        assertThat(next.scheduledDays()).isGreaterThanOrEqualTo(1.0);
        assertThat(next.lapses()).isEqualTo(lapsed.lapses());
        assertThat(next.elapsedDays()).isCloseTo(10.0 / 1440.0, within(1e-9));
    }

    private static SchedulingState reviewState(double stability, double difficulty, int daysSinceReview) {
        Instant last = NOW.minus(Duration.ofDays(daysSinceReview));
        return new SchedulingState(stability, difficulty, 0, daysSinceReview, 5, 1, CardPhase.REVIEW, 0,
                NOW, last);
    }
}
