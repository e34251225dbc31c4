package app.sage.core.review.controller.dto;

public record ChoiceAnswerRequest(
        String option
) {}
