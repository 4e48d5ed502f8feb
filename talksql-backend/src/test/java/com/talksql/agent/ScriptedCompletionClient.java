package com.talksql.agent;

import com.talksql.llm.CompletionClient;
import com.talksql.llm.CompletionException;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Completion client that answers each prompt template from a fixed script. The last scripted reply
 * repeats; a scripted {@link RuntimeException} is thrown instead of returned.
 */
class ScriptedCompletionClient implements CompletionClient {
    private final Map<String, List<Object>> scripts = new HashMap<>();
    private final Map<String, Integer> positions = new HashMap<>();
    final List<String> templates = new ArrayList<>();
    final List<Map<String, Object>> contexts = new ArrayList<>();

    ScriptedCompletionClient on(String template, Object... replies) {
        scripts.put(template, List.of(replies));
        return this;
    }

    int calls(String template) {
        return (int) templates.stream().filter(template::equals).count();
    }

    Map<String, Object> lastContext(String template) {
        for (int i = templates.size() - 1; i >= 0; i--) {
            if (templates.get(i).equals(template)) {
                return contexts.get(i);
            }
        }
        return null;
    }

    @Override
    public String complete(String prompt, Map<String, Object> context) {
        templates.add(prompt);
        contexts.add(context);
        List<Object> replies = scripts.get(prompt);
        if (replies == null) {
            throw new CompletionException("No scripted reply");
        }
        int i = positions.merge(prompt, 1, Integer::sum) - 1;
        Object reply = replies.get(Math.min(i, replies.size() - 1));
        if (reply instanceof RuntimeException e) {
            throw e;
        }
        return (String) reply;
    }
}
