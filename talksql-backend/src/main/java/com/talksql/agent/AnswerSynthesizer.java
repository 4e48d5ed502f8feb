package com.talksql.agent;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.talksql.llm.CompletionClient;
import com.talksql.llm.PromptTemplates;
import com.talksql.model.ExecutionResult;
import com.talksql.model.FinalAnswer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns a successful query result into a natural-language answer and optional chart configuration.
 */
@Slf4j
@Component
public class AnswerSynthesizer {
    private static final Pattern FENCED_JSON = Pattern.compile("```(?:json)?\\s*\\n(.*?)```", Pattern.DOTALL | Pattern.CASE_INSENSITIVE);
    private static final int MAX_RESULT_CHARS = 20_000;

    private final CompletionClient completionClient;
    private final ObjectMapper objectMapper;

    public AnswerSynthesizer(CompletionClient completionClient, ObjectMapper objectMapper) {
        this.completionClient = completionClient;
        this.objectMapper = objectMapper;
    }

    /**
     * Synthesize the answer.
     *
     * @param question question text
     * @param result successful execution result
     * @return final answer with at least one of answer and chart data
     * @throws com.talksql.llm.CompletionException when the model cannot be reached
     */
    public FinalAnswer answer(String question, ExecutionResult result) {
        Map<String, Object> context = new HashMap<>();
        context.put("user_input", question);
        context.put("response", serializeResult(result));
        context.put("query", result.getExecutedSql());

        String reply = completionClient.complete(PromptTemplates.FINAL_ANSWER, context);
        return parse(reply);
    }

    FinalAnswer parse(String reply) {
        String text = reply == null ? "" : reply.trim();
        JsonNode root = readJsonObject(text);
        if (root == null) {
            return new FinalAnswer(text.isEmpty() ? "No answer was produced." : text, null, false);
        }

        JsonNode chart = root.get("chart_data");
        JsonNode chartData = chart == null || chart.isNull() || chart.isMissingNode() ? null : chart;
        JsonNode nl = root.get("nl_response");
        String answer = nl != null && nl.isTextual() && !nl.asText().isBlank() ? nl.asText() : null;
        boolean onlyChart = root.path("only_chart").asBoolean(false) && chartData != null;

        if (answer == null && chartData == null) {
            return new FinalAnswer(text, null, false);
        }
        return new FinalAnswer(answer, chartData, onlyChart && answer == null);
    }

    private JsonNode readJsonObject(String text) {
        if (text.isEmpty()) {
            return null;
        }
        String candidate = text;
        Matcher m = FENCED_JSON.matcher(text);
        if (m.find()) {
            candidate = m.group(1).trim();
        } else {
            int start = text.indexOf('{');
            int end = text.lastIndexOf('}');
            if (start < 0 || end <= start) {
                return null;
            }
            candidate = text.substring(start, end + 1);
        }
        try {
            JsonNode node = objectMapper.readTree(candidate);
            return node != null && node.isObject() ? node : null;
        } catch (JsonProcessingException e) {
            log.debug("Answer is not JSON, using raw text: {}", e.getOriginalMessage());
            return null;
        }
    }

    private String serializeResult(ExecutionResult result) {
        String json;
        try {
            json = objectMapper.writeValueAsString(result.payload());
        } catch (JsonProcessingException e) {
            json = String.valueOf(result.payload());
        }
        if (json.length() > MAX_RESULT_CHARS) {
            json = json.substring(0, MAX_RESULT_CHARS) + " ... (truncated)";
        }
        return json;
    }
}
