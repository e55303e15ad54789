package com.swarmnet.core.agent;

import com.swarmnet.config.RoleSettings;
import com.swarmnet.config.SwarmSettings;
import com.swarmnet.core.error.RoleExecutionException;
import com.swarmnet.core.error.RoleUnavailableException;
import com.swarmnet.core.query.Query;
import com.swarmnet.llm.LLMClient;
import com.swarmnet.llm.LlmCallException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Map;

/**
 * LlmRoleAgent - Agent whose content comes from one LLM call per query.
 *
 * Subclasses only supply the role and the role-specific instructions; prompt
 * layout, retries and response parsing are shared. Retries are this layer's
 * business: the orchestration core never retries a role.
 */
public abstract class LlmRoleAgent implements Agent {

    private static final Logger log = LoggerFactory.getLogger(LlmRoleAgent.class);

    private final Role         role;
    private final LLMClient    llmClient;
    private final RoleSettings settings;

    private volatile boolean initialized = false;

    protected LlmRoleAgent(Role role, LLMClient llmClient, SwarmSettings swarmSettings) {
        this.role      = role;
        this.llmClient = llmClient;
        this.settings  = swarmSettings.forRole(role);
    }

    @Override
    public String getAgentId() {
        return role.name().toLowerCase() + "-agent-1";
    }

    @Override
    public Role getRole() {
        return role;
    }

    @Override
    public void initialize() throws RoleUnavailableException {
        if (!llmClient.healthCheck()) {
            initialized = false;
            throw new RoleUnavailableException(role, "LLM backend did not pass its health check");
        }
        initialized = true;
    }

    @Override
    public boolean isInitialized() {
        return initialized;
    }

    @Override
    public AgentResult processQuery(Query query, AgentContext context) throws RoleExecutionException {

        String prompt    = buildPrompt(query, context);
        long   startTime = System.currentTimeMillis();

        LlmCallException lastError = null;

        for (int attempt = 1; attempt <= settings.getRetryAttempts(); attempt++) {
            if (Thread.currentThread().isInterrupted()) {
                // the executor gave up on this call (timeout or cancellation)
                throw new RoleExecutionException(role, "interrupted before LLM attempt " + attempt, lastError);
            }
            try {
                String raw = llmClient.generateWithRole(role, prompt, settings.getTemperature(), settings.getMaxTokens());
                return RoleResponseParser.parse(role, raw, System.currentTimeMillis() - startTime);
            } catch (LlmCallException e) {
                lastError = e;
                log.warn("[{}] LLM attempt {}/{} failed: {}", role, attempt, settings.getRetryAttempts(), e.getMessage());
            }
        }

        throw new RoleExecutionException(role,
                "LLM call failed after " + settings.getRetryAttempts() + " attempts", lastError);
    }

    /** Role-specific instructions appended after the shared question block. */
    protected abstract String roleInstructions(Query query, AgentContext context);

    // =========================================================================
    // Prompt builder
    // =========================================================================

    String buildPrompt(Query query, AgentContext context) {
        StringBuilder hints = new StringBuilder();
        for (Map.Entry<String, String> hint : context.getHints().entrySet()) {
            hints.append("- ").append(hint.getKey()).append(": ").append(hint.getValue()).append('\n');
        }

        String prompt = """
                Question: %s
                Context: %s
                Complexity: %s

                Task hints:
                %s
                %s
                """.formatted(
                query.getQuestion(),
                query.getContext().isBlank() ? "(none)" : query.getContext(),
                query.getComplexity(),
                hints.length() == 0 ? "- (none)\n" : hints.toString(),
                roleInstructions(query, context)
        );

        if (context.hasPeerResults()) {
            prompt += "\n" + peerSection(context);
        }
        return prompt;
    }

    private static String peerSection(AgentContext context) {
        StringBuilder sb = new StringBuilder("Results from other panel members:\n");
        for (AgentResult peer : context.getPeerResults().values()) {
            String content = peer.getContent();
            if (content.length() > 1500) content = content.substring(0, 1500) + " [...]";
            sb.append("[").append(peer.getRole()).append(", confidence ")
              .append(String.format(Locale.ROOT, "%.2f", peer.getConfidence()))
              .append(peer.isDegraded() ? ", degraded" : "")
              .append("]\n")
              .append(content)
              .append("\n\n");
        }
        return sb.toString();
    }
}
