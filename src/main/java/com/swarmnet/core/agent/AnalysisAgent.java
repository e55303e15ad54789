package com.swarmnet.core.agent;

import com.swarmnet.config.SwarmSettings;
import com.swarmnet.core.query.Query;
import com.swarmnet.llm.LLMClient;

import org.springframework.stereotype.Component;

@Component
public class AnalysisAgent extends LlmRoleAgent {

    public AnalysisAgent(LLMClient llmClient, SwarmSettings settings) {
        super(Role.ANALYSIS, llmClient, settings);
    }

    @Override
    protected String roleInstructions(Query query, AgentContext context) {
        String instructions = "Critically examine the question. Trace implications and consequences, "
                + "and list the open questions a reviewer would raise.";
        if (context.hasPeerResults()) {
            instructions += " Test the evidence gathered below against those questions.";
        }
        return instructions;
    }
}
