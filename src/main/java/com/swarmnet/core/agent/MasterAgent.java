package com.swarmnet.core.agent;

import com.swarmnet.config.SwarmSettings;
import com.swarmnet.core.query.Query;
import com.swarmnet.llm.LLMClient;

import org.springframework.stereotype.Component;

/**
 * MASTER - the panel's final verdict. Under HIERARCHICAL it sees every peer
 * result; under the other strategies it answers alone.
 */
@Component
public class MasterAgent extends LlmRoleAgent {

    public MasterAgent(LLMClient llmClient, SwarmSettings settings) {
        super(Role.MASTER, llmClient, settings);
    }

    @Override
    protected String roleInstructions(Query query, AgentContext context) {
        String queryType = context.hint("query_type");

        StringBuilder sb = new StringBuilder();
        sb.append("Give the panel's final answer");
        if (queryType != null) sb.append(" to this ").append(queryType.replace('_', ' ')).append(" question");
        sb.append(". Explain the mechanism, define the key terms and identify the causes.");

        if (context.hasPeerResults()) {
            sb.append(" Build on the panel results below and say explicitly where you disagree with them.");
        }
        return sb.toString();
    }
}
