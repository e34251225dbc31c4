package app.sage.core.review.session;

public enum SessionStatus {
    NOT_STARTED, IN_PROGRESS, COMPLETE
}
