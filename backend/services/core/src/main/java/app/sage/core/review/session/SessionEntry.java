package app.sage.core.review.session;

import app.sage.core.review.domain.IntervalPreview;
import app.sage.core.review.domain.Rating;
import app.sage.core.review.domain.SchedulingState;
import app.sage.core.review.domain.StudyCard;

import java.util.Map;

/**
 * One card of a session with its latest known state. Mutated only under the owning session's lock.
 */
final class SessionEntry {

    private final StudyCard card;
    private SchedulingState state;
    private final Map<Rating, IntervalPreview> previews;
    private Boolean choiceCorrect;
    private Rating rating;

    SessionEntry(StudyCard card, SchedulingState state, Map<Rating, IntervalPreview> previews) {
        this.card = card;
        this.state = state;
        this.previews = Map.copyOf(previews);
    }

    StudyCard card() {
        return card;
    }

    SchedulingState state() {
        return state;
    }

    void state(SchedulingState state) {
        this.state = state;
    }

    Map<Rating, IntervalPreview> previews() {
        return previews;
    }

    Boolean choiceCorrect() {
        return choiceCorrect;
    }

    void answerChoice(boolean correct) {
        this.choiceCorrect = correct;
    }

    Rating rating() {
        return rating;
    }

    void rated(Rating rating) {
        this.rating = rating;
    }

    boolean isRated() {
        return rating != null;
    }

    boolean isRestricted() {
        return Boolean.FALSE.equals(choiceCorrect);
    }
}
