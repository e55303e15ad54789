package com.swarmnet.llm;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.swarmnet.core.agent.Role;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Profile;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.HashMap;
import java.util.Map;

/**
 * OllamaLLMClient - LLMClient backed by a local Ollama server.
 *
 * Role personas live here and nowhere else. Every persona asks for the same
 * JSON envelope that RoleResponseParser reads.
 */
@Component
@Profile("!mock & !test")
public class OllamaLLMClient implements LLMClient {

    private static final Logger log = LoggerFactory.getLogger(OllamaLLMClient.class);

    private static final String RESPONSE_FORMAT = """
            Respond ONLY with a JSON object of this shape:
            {"content": "...", "confidence": 0.0-1.0, "reasoning": "...",
             "sources": [{"url": "...", "title": "...", "kind": "PEER_REVIEWED|PREPRINT|EXPERIMENTAL|THEORETICAL|EDUCATIONAL|OTHER",
                          "credibility": 0.0-1.0, "relevance": 0.0-1.0}],
             "questions": ["..."]}
            """;

    @Value("${ollama.base-url:http://localhost:11434}")
    private String baseUrl;

    @Value("${ollama.model:llama3:8b}")
    private String model;

    private final RestTemplate restTemplate = new RestTemplate();
    private final ObjectMapper objectMapper = new ObjectMapper();

    // =========================================================================
    // LLMClient contract
    // =========================================================================

    @Override
    public String generateWithRole(Role role, String userPrompt, double temperature, int maxTokens) {
        String fullPrompt = getSystemPromptForRole(role) + "\n" + RESPONSE_FORMAT + "\n" + userPrompt;

        log.debug("[Ollama] role={} temperature={} maxTokens={} promptLen={}",
                role, temperature, maxTokens, fullPrompt.length());

        return callOllama(fullPrompt, temperature, maxTokens);
    }

    @Override
    public boolean healthCheck() {
        try {
            ResponseEntity<String> response = restTemplate.getForEntity(baseUrl + "/api/tags", String.class);
            return response.getStatusCode().is2xxSuccessful();
        } catch (RestClientException e) {
            log.warn("[Ollama] Health check against {} failed: {}", baseUrl, e.getMessage());
            return false;
        }
    }

    // =========================================================================
    // System prompts
    // =========================================================================

    private String getSystemPromptForRole(Role role) {
        return switch (role) {
            case MASTER -> """
                    You are the lead physicist of a research panel.
                    Weigh the panel's contributions and give the final, rigorous answer.
                    Explain the underlying mechanism, define the key terms and state causes explicitly.
                    """;

            case SEARCH -> """
                    You are a research librarian for physics.
                    Gather the strongest published evidence and cite every source with a url.
                    Prefer peer-reviewed and experimental work over secondary material.
                    """;

            case INNOVATION -> """
                    You are an inventive theoretical physicist.
                    Reason from first principles and propose novel angles or hypotheses.
                    Flag clearly which ideas are speculative.
                    """;

            case ANALYSIS -> """
                    You are a critical analyst.
                    Probe assumptions, trace implications and consequences, and list the
                    open questions a careful reviewer would raise.
                    """;
        };
    }

    // =========================================================================
    // HTTP client
    // =========================================================================

    private String callOllama(String prompt, double temperature, int maxTokens) {
        try {
            String url = baseUrl + "/api/generate";

            Map<String, Object> options = new HashMap<>();
            options.put("temperature", temperature);
            options.put("num_predict", maxTokens);

            Map<String, Object> body = new HashMap<>();
            body.put("model",   model);
            body.put("prompt",  prompt);
            body.put("options", options);
            body.put("stream",  false);

            HttpHeaders headers = new HttpHeaders();
            headers.setContentType(MediaType.APPLICATION_JSON);

            ResponseEntity<String> response =
                    restTemplate.postForEntity(url, new HttpEntity<>(body, headers), String.class);

            JsonNode root = objectMapper.readTree(response.getBody());

            String result = root.has("response") ? root.get("response").asText() : "";
            log.debug("[Ollama] responseLen={}", result.length());
            return result;

        } catch (Exception e) {
            log.error("[Ollama] Call failed: {}", e.getMessage());
            throw new LlmCallException("Ollama LLM call failed: " + e.getMessage(), e);
        }
    }
}
