package com.tarantula.crawl.model;

public enum RunState {
    STARTING,
    RUNNING,
    DRAINING,
    COMPLETED,
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == CANCELLED;
    }
}
