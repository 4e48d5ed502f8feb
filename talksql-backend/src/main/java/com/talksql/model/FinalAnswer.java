package com.talksql.model;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Synthesized answer for the user. At least one of {@code answer} and {@code chartData} is present.
 *
 * @param answer natural-language answer, may be null when only a chart is returned
 * @param chartData ECharts-style configuration, passed through opaquely, may be null
 * @param onlyChart whether the model chose to answer with a chart alone
 */
public record FinalAnswer(String answer, JsonNode chartData, boolean onlyChart) {
}
