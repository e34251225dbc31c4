package app.sage.core.review.controller.dto;

import com.fasterxml.jackson.databind.JsonNode;

public record PreferencesDto(
        JsonNode schedulerOverrides,
        Integer newCardsPerDay,
        Integer dailyGoal,
        String timeZone
) {}
