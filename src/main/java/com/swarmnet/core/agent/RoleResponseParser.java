package com.swarmnet.core.agent;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * RoleResponseParser - raw model text → AgentResult.
 *
 * Expected envelope:
 *   {"content": "...", "confidence": 0.8, "reasoning": "...",
 *    "sources": [{"url", "title", "kind", "credibility", "relevance"}],
 *    "questions": ["..."]}
 *
 * Tolerates markdown fences and prose before the first '{'. Anything that is
 * still not a JSON object is kept verbatim as content with confidence 0.5.
 * Sources without a url are dropped.
 */
public final class RoleResponseParser {

    private static final Logger       log    = LoggerFactory.getLogger(RoleResponseParser.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    static final double TEXT_FALLBACK_CONFIDENCE = 0.5;
    static final double DEFAULT_SOURCE_SCORE     = 0.5;

    private RoleResponseParser() {
    }

    public static AgentResult parse(Role role, String rawText, long processingMillis) {
        String raw = rawText != null ? rawText.trim() : "";

        try {
            JsonNode root = MAPPER.readTree(stripToJson(raw));
            if (root != null && root.isObject()) {
                return fromJson(role, root, processingMillis);
            }
        } catch (JsonProcessingException e) {
            log.debug("[Parser] {} output is not JSON: {}", role, e.getOriginalMessage());
        }

        log.warn("[Parser] {} returned unstructured output ({} chars); keeping it as text", role, raw.length());
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put(AgentResult.META_OUTPUT_FORMAT, "text");

        return AgentResult.builder(role)
                .content(raw)
                .confidence(TEXT_FALLBACK_CONFIDENCE)
                .reasoning("Unstructured model output")
                .metadata(metadata)
                .processingMillis(processingMillis)
                .build();
    }

    private static AgentResult fromJson(Role role, JsonNode root, long processingMillis) {
        List<SourceRecord> sources = new ArrayList<>();
        for (JsonNode node : root.path("sources")) {
            String url = node.path("url").asText("");
            if (url.isBlank()) continue;
            sources.add(new SourceRecord(
                    url,
                    node.path("title").asText(url),
                    SourceKind.fromText(node.path("kind").asText(null)),
                    node.path("credibility").asDouble(DEFAULT_SOURCE_SCORE),
                    node.path("relevance").asDouble(DEFAULT_SOURCE_SCORE)
            ));
        }

        List<String> questions = new ArrayList<>();
        for (JsonNode node : root.path("questions")) {
            String question = node.asText("");
            if (!question.isBlank()) questions.add(question);
        }

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put(AgentResult.META_OUTPUT_FORMAT, "json");

        return AgentResult.builder(role)
                .content(root.path("content").asText(""))
                .confidence(root.path("confidence").asDouble(TEXT_FALLBACK_CONFIDENCE))
                .reasoning(root.path("reasoning").asText(""))
                .sources(sources)
                .questionsRaised(questions)
                .metadata(metadata)
                .processingMillis(processingMillis)
                .build();
    }

    private static String stripToJson(String text) {
        String cleaned = text;

        // Strip markdown fences
        if (cleaned.startsWith("```")) {
            int start = cleaned.indexOf('\n') + 1;
            int end   = cleaned.lastIndexOf("```");
            if (start > 0 && end > start) cleaned = cleaned.substring(start, end).trim();
        }

        // Skip leading prose to first '{'
        int jsonStart = cleaned.indexOf('{');
        if (jsonStart > 0) cleaned = cleaned.substring(jsonStart);

        return cleaned;
    }
}
