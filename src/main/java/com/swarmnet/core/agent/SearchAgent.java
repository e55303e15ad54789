package com.swarmnet.core.agent;

import com.swarmnet.config.SwarmSettings;
import com.swarmnet.core.query.Query;
import com.swarmnet.llm.LLMClient;

import org.springframework.stereotype.Component;

@Component
public class SearchAgent extends LlmRoleAgent {

    public SearchAgent(LLMClient llmClient, SwarmSettings settings) {
        super(Role.SEARCH, llmClient, settings);
    }

    @Override
    protected String roleInstructions(Query query, AgentContext context) {
        String focus = context.hint("focus") != null ? context.hint("focus").replace('_', ' ') : "any credible sources";
        return "Collect the most credible evidence on the question, focusing on " + focus + ". "
                + "Cite at least three sources with urls and rate each one's credibility and relevance.";
    }
}
