package com.tasksmith.execution;

import com.tasksmith.core.model.TodoItem;

import java.util.List;

/**
 * Progress sink handed to {@link ExecutionService#runTask}. Calls may arrive on any thread.
 */
public interface ExecutionCallbacks {

    void onLog(String message);

    void onTodo(List<TodoItem> todos);

    void onSession(String sessionId);

    void onNotice(AgentNotice notice);

    /** Registers the handle that cancellation uses to stop this execution. */
    void onInterruptible(InterruptHandle handle);
}
