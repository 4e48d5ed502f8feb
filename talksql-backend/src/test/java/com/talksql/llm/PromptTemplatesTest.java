package com.talksql.llm;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class PromptTemplatesTest {

    @Test
    void substitutesKnownPlaceholdersOnce() {
        Map<String, Object> context = new HashMap<>();
        context.put("question", "How much is {price}?");
        context.put("dialect", "sqlite");

        String rendered = PromptTemplates.render("Q: {question} on {dialect} ({missing})", context);

        assertThat(rendered).isEqualTo("Q: How much is {price}? on sqlite ({missing})");
    }

    @Test
    void replacementTextIsLiteral() {
        String rendered = PromptTemplates.render("{query}", Map.of("query", "SELECT '$1' AS \\x"));

        assertThat(rendered).isEqualTo("SELECT '$1' AS \\x");
    }

    @Test
    void jsonBracesInTemplatesSurvive() {
        String rendered = PromptTemplates.render(PromptTemplates.FINAL_ANSWER,
                Map.of("user_input", "sales by city", "response", "[]", "query", "SELECT 1"));

        assertThat(rendered)
                .contains("**User Input**: sales by city")
                .contains("{name: string, value: number}")
                .contains("\"chart_data\": null | {<ECharts JSON object>}");
    }

    @Test
    void generationTemplateCarriesAllInputs() {
        assertThat(PromptTemplates.QUERY_GENERATION)
                .contains("{dialect}", "{schema}", "{dialect_features}", "{question}",
                        "{example_question_1}", "{example_query_3}");
        assertThat(PromptTemplates.QUERY_FIXER).contains("{previous_query}", "{error}");
        assertThat(PromptTemplates.QUERY_VALIDATION).contains("{query}", "appears to be correct");
    }
}
