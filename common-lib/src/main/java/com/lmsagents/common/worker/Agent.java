package com.lmsagents.common.worker;

/**
 * A worker with its own receive loop and/or ticker. Start and stop are idempotent;
 * stop is cooperative and returns before the worker has fully drained.
 */
public interface Agent {

    String agentName();

    void start();

    void stop();

    boolean isRunning();
}
