package app.sage.core.review.domain;

import java.util.Map;

public record ScheduleResult(
        SchedulingState nextState,
        Map<Rating, IntervalPreview> previews
) {
}
