package com.adlanda.queryagent.model;

import com.adlanda.queryagent.exception.ErrorKind;

/**
 * Failure recorded on a query cycle that ended in the ERROR stage.
 */
public record AgentError(ErrorKind kind, String message) {}
