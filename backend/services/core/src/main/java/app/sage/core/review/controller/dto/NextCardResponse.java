package app.sage.core.review.controller.dto;

import app.sage.core.review.session.CurrentCard;
import app.sage.core.review.session.SessionProgress;
import app.sage.core.review.session.SessionStatus;

public record NextCardResponse(
        boolean hasMore,
        SessionStatus status,
        CurrentCard current,
        SessionProgress progress
) {}
