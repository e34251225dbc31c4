package app.sage.core.review.algorithm.impl;

import app.sage.core.review.algorithm.SchedulerSettings;
import app.sage.core.review.algorithm.SrsAlgorithm;
import app.sage.core.review.domain.CardPhase;
import app.sage.core.review.domain.Rating;
import app.sage.core.review.domain.SchedulingState;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static app.sage.core.review.algorithm.SchedulerSettings.MAX_DIFFICULTY;
import static app.sage.core.review.algorithm.SchedulerSettings.MAX_STABILITY;
import static app.sage.core.review.algorithm.SchedulerSettings.MIN_DIFFICULTY;
import static app.sage.core.review.algorithm.SchedulerSettings.MIN_STABILITY;

/**
 * FSRS-style stability/difficulty scheduler with configurable learning and relearning steps.
 */
@Component
public class FsrsAlgorithm implements SrsAlgorithm {

    private static final double DAY_MINUTES = 1440.0;

    @Override
    public String id() {
        return "fsrs";
    }

    @Override
    public SchedulingState initialState(Instant now) {
        return SchedulingState.newCard(now);
    }

    @Override
    public SchedulingState apply(SchedulingState state, Rating rating, Instant now, SchedulerSettings cfg) {
        double elapsedDays = elapsedDays(state.lastReview(), now);
        return switch (state.phase()) {
            case NEW -> handleNew(state, rating, now, cfg);
            case LEARNING -> handleSteps(state, rating, now, elapsedDays, cfg, CardPhase.LEARNING);
            case RELEARNING -> handleSteps(state, rating, now, elapsedDays, cfg, CardPhase.RELEARNING);
            case REVIEW -> handleReview(state, rating, now, elapsedDays, cfg);
        };
    }

    private SchedulingState handleNew(SchedulingState st, Rating rating, Instant now, SchedulerSettings cfg) {
        int g = grade(rating);
        double s = initialStability(cfg, g);
        double d = initialDifficulty(cfg, g);
        Step next = nextStep(effectiveSteps(cfg.learningStepsMinutes(), cfg), 0, rating);
        if (next.graduate()) {
            double days = rating == Rating.EASY ? cfg.easyIntervalDays() : cfg.graduatingIntervalDays();
            return review(st, s, d, 0.0, days, st.lapses(), now, cfg);
        }
        return stepState(st, CardPhase.LEARNING, next, s, d, 0.0, st.lapses(), now, cfg);
    }

    private SchedulingState handleSteps(SchedulingState st, Rating rating, Instant now, double elapsedDays,
                                        SchedulerSettings cfg, CardPhase phase) {
        List<Integer> steps = effectiveSteps(phase == CardPhase.LEARNING
                ? cfg.learningStepsMinutes()
                : cfg.relearningStepsMinutes(), cfg);
        int g = grade(rating);
        double s = sanitizeStability(st.stability(), cfg);
        double d = sanitizeDifficulty(st.difficulty(), cfg);
        double newD = updateDifficulty(cfg, d, g);
        double newS = elapsedDays < 1.0
                ? stabilitySameDay(cfg, s, g)
                : stabilityAfterRecall(cfg, newD, s, retrievability(cfg, elapsedDays, s), g);

        Step next = nextStep(steps, Math.min(st.learningStep(), steps.size() - 1), rating);
        if (!next.graduate()) {
            return stepState(st, phase, next, newS, newD, elapsedDays, st.lapses(), now, cfg);
        }

        double days;
        if (phase == CardPhase.LEARNING) {
            days = rating == Rating.EASY ? cfg.easyIntervalDays() : cfg.graduatingIntervalDays();
        } else {
            double retained = Math.max(1.0, Math.round(intervalFromRetention(cfg, newS, cfg.requestRetention())));
            days = rating == Rating.EASY
                    ? Math.max(cfg.easyIntervalDays(), retained * cfg.w(16))
                    : Math.max(cfg.graduatingIntervalDays(), retained);
        }
        return review(st, newS, newD, elapsedDays, days, st.lapses(), now, cfg);
    }

    private SchedulingState handleReview(SchedulingState st, Rating rating, Instant now, double elapsedDays,
                                         SchedulerSettings cfg) {
        int g = grade(rating);
        double s = sanitizeStability(st.stability(), cfg);
        double d = sanitizeDifficulty(st.difficulty(), cfg);
        double r = retrievability(cfg, elapsedDays, s);

        if (rating == Rating.AGAIN) {
            double newD = updateDifficulty(cfg, d, g);
            double newS = Math.min(s, stabilityAfterForgetting(cfg, newD, s, r));
            List<Integer> steps = effectiveSteps(cfg.relearningStepsMinutes(), cfg);
            return stepState(st, CardPhase.RELEARNING, new Step(false, 0, steps.get(0)),
                    newS, newD, elapsedDays, st.lapses() + 1, now, cfg);
        }

        // Hard, good and easy intervals are derived together so that they stay strictly ordered.
        double[] stabilities = new double[3];
        long[] days = new long[3];
        for (int i = 0; i < 3; i++) {
            int grade = i + 2;
            double newD = updateDifficulty(cfg, d, grade);
            stabilities[i] = elapsedDays < 1.0
                    ? stabilitySameDay(cfg, s, grade)
                    : stabilityAfterRecall(cfg, newD, s, r, grade);
            days[i] = Math.max(1, Math.round(intervalFromRetention(cfg, stabilities[i], cfg.requestRetention())));
        }
        days[1] = Math.max(days[1], days[0] + 1);
        days[2] = Math.max(days[2], days[1] + 1);

        int idx = g - 2;
        double interval = Math.min(days[idx], cfg.maximumIntervalDays());
        return review(st, stabilities[idx], updateDifficulty(cfg, d, g), elapsedDays, interval, st.lapses(), now, cfg);
    }

    private SchedulingState stepState(SchedulingState st, CardPhase phase, Step step, double s, double d,
                                      double elapsedDays, int lapses, Instant now, SchedulerSettings cfg) {
        double days = clamp(step.delayMinutes() / DAY_MINUTES, cfg.minimumIntervalDays(), cfg.maximumIntervalDays());
        return new SchedulingState(
                clamp(s, MIN_STABILITY, MAX_STABILITY),
                clamp(d, MIN_DIFFICULTY, MAX_DIFFICULTY),
                elapsedDays,
                days,
                st.reps() + 1,
                lapses,
                phase,
                step.index(),
                due(now, days),
                now
        );
    }

    private SchedulingState review(SchedulingState st, double s, double d, double elapsedDays, double intervalDays,
                                   int lapses, Instant now, SchedulerSettings cfg) {
        double days = clamp(intervalDays, cfg.minimumIntervalDays(), cfg.maximumIntervalDays());
        return new SchedulingState(
                clamp(s, MIN_STABILITY, MAX_STABILITY),
                clamp(d, MIN_DIFFICULTY, MAX_DIFFICULTY),
                elapsedDays,
                days,
                st.reps() + 1,
                lapses,
                CardPhase.REVIEW,
                0,
                due(now, days),
                now
        );
    }

    /**
     * Again restarts the step list, hard repeats the current step with a longer delay, good moves on
     * (graduating past the last step) and easy graduates immediately.
     */
    private static Step nextStep(List<Integer> steps, int current, Rating rating) {
        return switch (rating) {
            case AGAIN -> new Step(false, 0, steps.get(0));
            case HARD -> new Step(false, current, hardDelay(steps, current));
            case GOOD -> current + 1 >= steps.size()
                    ? new Step(true, 0, 0)
                    : new Step(false, current + 1, steps.get(current + 1));
            case EASY -> new Step(true, 0, 0);
        };
    }

    private static double hardDelay(List<Integer> steps, int current) {
        int delay = steps.get(current);
        if (current == 0 && steps.size() > 1) {
            return (steps.get(0) + steps.get(1)) / 2.0;
        }
        if (steps.size() == 1) {
            return Math.min(delay * 1.5, delay + DAY_MINUTES);
        }
        return delay;
    }

    private static List<Integer> effectiveSteps(List<Integer> steps, SchedulerSettings cfg) {
        return steps == null || steps.isEmpty() ? List.of(cfg.minimumIntervalMinutes()) : steps;
    }

    private double retrievability(SchedulerSettings cfg, double tDays, double s) {
        double w20 = safeW20(cfg.w(20));
        double factor = Math.pow(0.9, -1.0 / w20) - 1.0;
        return Math.pow(1.0 + factor * (tDays / s), -w20);
    }

    private double intervalFromRetention(SchedulerSettings cfg, double s, double r) {
        double w20 = safeW20(cfg.w(20));
        double factor = Math.pow(0.9, -1.0 / w20) - 1.0;
        return (s / factor) * (Math.pow(r, -1.0 / w20) - 1.0);
    }

    private double stabilitySameDay(SchedulerSettings cfg, double s, int g) {
        double inc = Math.exp(cfg.w(17) * (g - 3.0 + cfg.w(18))) * Math.pow(s, -cfg.w(19));
        if (g >= 3) inc = Math.max(1.0, inc);
        return clamp(s * inc, MIN_STABILITY, MAX_STABILITY);
    }

    private double stabilityAfterRecall(SchedulerSettings cfg, double d, double s, double r, int g) {
        double hardMul = (g == 2) ? cfg.w(15) : 1.0;
        double easyMul = (g == 4) ? cfg.w(16) : 1.0;

        double term = Math.exp(cfg.w(8))
                * (11.0 - d)
                * Math.pow(s, -cfg.w(9))
                * (Math.exp(cfg.w(10) * (1.0 - r)) - 1.0)
                * hardMul
                * easyMul;

        return clamp(s * (term + 1.0), MIN_STABILITY, MAX_STABILITY);
    }

    private double stabilityAfterForgetting(SchedulerSettings cfg, double d, double s, double r) {
        double out = cfg.w(11)
                * Math.pow(d, -cfg.w(12))
                * (Math.pow(s + 1.0, cfg.w(13)) - 1.0)
                * Math.exp(cfg.w(14) * (1.0 - r));
        return clamp(out, MIN_STABILITY, MAX_STABILITY);
    }

    private double initialStability(SchedulerSettings cfg, int g) {
        int idx = Math.max(0, Math.min(3, g - 1));
        return clamp(cfg.w(idx), MIN_STABILITY, MAX_STABILITY);
    }

    private double initialDifficulty(SchedulerSettings cfg, int g) {
        double d = cfg.w(4) - Math.exp(cfg.w(5) * (g - 1.0)) + 1.0;
        return clamp(d, MIN_DIFFICULTY, MAX_DIFFICULTY);
    }

    private double updateDifficulty(SchedulerSettings cfg, double d, int g) {
        double delta = -cfg.w(6) * (g - 3.0);
        double d1 = d + delta * (10.0 - d) / 9.0;

        double d0Easy = initialDifficulty(cfg, 4);
        double d2 = cfg.w(7) * d0Easy + (1.0 - cfg.w(7)) * d1;

        return clamp(d2, MIN_DIFFICULTY, MAX_DIFFICULTY);
    }

    private double sanitizeStability(double s, SchedulerSettings cfg) {
        return (!Double.isFinite(s) || s <= 0.0) ? initialStability(cfg, 3) : clamp(s, MIN_STABILITY, MAX_STABILITY);
    }

    private double sanitizeDifficulty(double d, SchedulerSettings cfg) {
        return (!Double.isFinite(d) || d <= 0.0) ? initialDifficulty(cfg, 3) : clamp(d, MIN_DIFFICULTY, MAX_DIFFICULTY);
    }

    private static int grade(Rating r) {
        return switch (r) {
            case AGAIN -> 1;
            case HARD -> 2;
            case GOOD -> 3;
            case EASY -> 4;
        };
    }

    private static double elapsedDays(Instant lastReview, Instant now) {
        if (lastReview == null) return 0.0;
        return Math.max(0.0, Duration.between(lastReview, now).toSeconds() / 86400.0);
    }

    private static Instant due(Instant now, double days) {
        return now.plus(Duration.ofSeconds(Math.round(days * 86400)));
    }

    private static double safeW20(double w20) {
        return (w20 <= 0.0) ? 1.0 : w20;
    }

    private static double clamp(double v, double lo, double hi) {
        return Math.max(lo, Math.min(hi, v));
    }

    private record Step(boolean graduate, int index, double delayMinutes) {
    }
}
