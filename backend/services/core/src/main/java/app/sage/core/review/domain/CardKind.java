package app.sage.core.review.domain;

public enum CardKind {
    SIMPLE, CHOICE
}
