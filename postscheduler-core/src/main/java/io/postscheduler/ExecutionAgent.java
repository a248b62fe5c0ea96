package io.postscheduler;

import io.postscheduler.core.AgentRequest;
import io.postscheduler.core.AgentResult;

/**
 * Performs the actual marketplace post for one job.
 *
 * <p>Calls are blocking and may take minutes. The scheduler bounds each call with its agent
 * timeout and interrupts the calling thread when the budget is exceeded. Returning
 * {@link AgentResult#failure(String)} and throwing are both treated as a failed post.
 */
public interface ExecutionAgent {
    AgentResult execute(AgentRequest request) throws Exception;
}
