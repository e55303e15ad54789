package com.swarmnet.core.agent;

import com.swarmnet.config.RoleSettings;
import com.swarmnet.config.SwarmSettings;
import com.swarmnet.core.error.RoleExecutionException;
import com.swarmnet.core.error.RoleUnavailableException;
import com.swarmnet.core.query.Query;
import com.swarmnet.llm.LLMClient;
import com.swarmnet.llm.LlmCallException;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class LlmRoleAgentTest {

    private static final String ANSWER = "{\"content\": \"The mechanism is diffusion.\", \"confidence\": 0.9}";

    /** Fails the first {@code failures} calls, then answers. Records every prompt. */
    private static final class ScriptedClient implements LLMClient {
        private final AtomicInteger failuresLeft;
        private final boolean       healthy;
        private final List<String>  prompts = new CopyOnWriteArrayList<>();

        ScriptedClient(int failures, boolean healthy) {
            this.failuresLeft = new AtomicInteger(failures);
            this.healthy      = healthy;
        }

        @Override
        public String generateWithRole(Role role, String userPrompt, double temperature, int maxTokens) {
            prompts.add(userPrompt);
            if (failuresLeft.getAndDecrement() > 0) {
                throw new LlmCallException("connection refused", null);
            }
            return ANSWER;
        }

        @Override
        public boolean healthCheck() {
            return healthy;
        }
    }

    private static SwarmSettings settingsWithRetries(int retries) {
        Map<Role, RoleSettings> roles = new EnumMap<>(Role.class);
        for (Role role : Role.values()) {
            roles.put(role, new RoleSettings(role, Duration.ofSeconds(5), 0.4, 500, retries));
        }
        return new SwarmSettings(roles);
    }

    private final Query query = Query.builder("How does heat spread?").context("Solids only").build();

    @Test
    void testRetriesUntilSuccess() throws RoleExecutionException {
        ScriptedClient client = new ScriptedClient(1, true);
        SearchAgent    agent  = new SearchAgent(client, settingsWithRetries(2));

        AgentResult result = agent.processQuery(query, AgentContext.empty());

        assertEquals("The mechanism is diffusion.", result.getContent());
        assertEquals(Role.SEARCH, result.getRole());
        assertEquals(2, client.prompts.size());
    }

    @Test
    void testGivesUpAfterConfiguredAttempts() {
        ScriptedClient client = new ScriptedClient(5, true);
        AnalysisAgent  agent  = new AnalysisAgent(client, settingsWithRetries(3));

        RoleExecutionException e = assertThrows(RoleExecutionException.class,
                () -> agent.processQuery(query, AgentContext.empty()));
        assertEquals(Role.ANALYSIS, e.getRole());
        assertInstanceOf(LlmCallException.class, e.getCause());
        assertEquals(3, client.prompts.size());
    }

    @Test
    void testInitializeFollowsHealthCheck() throws RoleUnavailableException {
        MasterAgent down = new MasterAgent(new ScriptedClient(0, false), settingsWithRetries(1));
        assertFalse(down.isInitialized());
        assertThrows(RoleUnavailableException.class, down::initialize);
        assertFalse(down.isInitialized());

        MasterAgent up = new MasterAgent(new ScriptedClient(0, true), settingsWithRetries(1));
        up.initialize();
        assertTrue(up.isInitialized());
        assertEquals("master-agent-1", up.getAgentId());
    }

    @Test
    void testPromptCarriesHintsAndPeerResults() throws RoleExecutionException {
        ScriptedClient client = new ScriptedClient(0, true);
        MasterAgent    agent  = new MasterAgent(client, settingsWithRetries(1));

        Map<Role, AgentResult> peers = new EnumMap<>(Role.class);
        peers.put(Role.SEARCH, AgentResult.builder(Role.SEARCH).content("Fourier's law applies.").confidence(0.8).build());

        agent.processQuery(query, new AgentContext(Map.of("query_type", "mechanism"), peers));

        String prompt = client.prompts.get(0);
        assertTrue(prompt.contains("How does heat spread?"));
        assertTrue(prompt.contains("Solids only"));
        assertTrue(prompt.contains("query_type: mechanism"));
        assertTrue(prompt.contains("mechanism question"));
        assertTrue(prompt.contains("Fourier's law applies."));
        assertTrue(prompt.contains("[SEARCH, confidence 0.80]"));
    }

    @Test
    void testInterruptedCallerMakesNoFurtherAttempts() {
        ScriptedClient client = new ScriptedClient(0, true);
        SearchAgent    agent  = new SearchAgent(client, settingsWithRetries(3));

        Thread.currentThread().interrupt();
        try {
            RoleExecutionException e = assertThrows(RoleExecutionException.class,
                    () -> agent.processQuery(query, AgentContext.empty()));
            assertTrue(e.getMessage().contains("interrupted"));
            assertTrue(client.prompts.isEmpty());
        } finally {
            Thread.interrupted();
        }
    }

    @Test
    void testRetryAttemptsBelowOneAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> settingsWithRetries(0));
    }
}
