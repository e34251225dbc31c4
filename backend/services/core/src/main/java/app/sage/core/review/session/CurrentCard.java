package app.sage.core.review.session;

import app.sage.core.review.domain.IntervalPreview;
import app.sage.core.review.domain.Rating;
import app.sage.core.review.domain.SchedulingState;
import app.sage.core.review.domain.StudyCard;

import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * The card at the session's current position together with its rating previews.
 *
 * @param choiceCorrect {@code null} until a choice answer has been submitted
 */
public record CurrentCard(
        UUID sessionId,
        int index,
        StudyCard card,
        SchedulingState state,
        Map<Rating, IntervalPreview> previews,
        Set<Rating> allowedRatings,
        Boolean choiceCorrect,
        Rating rating
) {
    public boolean rated() {
        return rating != null;
    }
}
