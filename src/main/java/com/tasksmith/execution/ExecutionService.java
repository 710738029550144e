package com.tasksmith.execution;

/**
 * Runs a single task with an AI agent. Implementations block until the agent stops.
 */
public interface ExecutionService {

    /**
     * @param request   what to run and where
     * @param callbacks progress sink
     * @return the agent's result
     * @throws Exception if the execution could not be carried out; the run is then failed
     */
    ExecutionResult runTask(ExecutionRequest request, ExecutionCallbacks callbacks) throws Exception;
}
