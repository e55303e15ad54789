package com.swarmnet.core.agent;

import com.swarmnet.config.SwarmSettings;
import com.swarmnet.core.query.Query;
import com.swarmnet.llm.LLMClient;

import org.springframework.stereotype.Component;

@Component
public class InnovationAgent extends LlmRoleAgent {

    public InnovationAgent(LLMClient llmClient, SwarmSettings settings) {
        super(Role.INNOVATION, llmClient, settings);
    }

    @Override
    protected String roleInstructions(Query query, AgentContext context) {
        return """
                Reason from first principles. Offer at least one novel angle or testable hypothesis,
                and mark clearly what is speculative.""";
    }
}
