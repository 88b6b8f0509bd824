package io.liarslie.model;

public enum AgentStatus {
    UNINITIALIZED,
    READY,
    KILLED
}
