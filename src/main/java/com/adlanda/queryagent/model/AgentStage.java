package com.adlanda.queryagent.model;

/**
 * States of one query-answer cycle. ANSWERED and ERROR are terminal.
 */
public enum AgentStage {
    START,
    ROUTED,
    FULFILLED,
    ANSWERED,
    ERROR;

    public boolean isTerminal() {
        return this == ANSWERED || this == ERROR;
    }
}
