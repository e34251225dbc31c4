package app.sage.core.review.controller.dto;

/**
 * @param rating 1-4 or again/hard/good/easy
 */
public record RateCardRequest(
        String rating,
        Long reviewTimeMs
) {}
