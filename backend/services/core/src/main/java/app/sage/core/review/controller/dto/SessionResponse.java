package app.sage.core.review.controller.dto;

import app.sage.core.review.session.CurrentCard;
import app.sage.core.review.session.SessionProgress;
import app.sage.core.review.session.SessionSummary;

public record SessionResponse(
        SessionSummary session,
        CurrentCard current,
        SessionProgress progress
) {}
