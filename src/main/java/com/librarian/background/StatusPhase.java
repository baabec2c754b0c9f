package com.librarian.background;

public enum StatusPhase {
    STARTING,
    RUNNING,
    COMPLETED,
    INTERRUPTED,
    ERROR;

    public boolean isTerminal() {
        return this == COMPLETED || this == INTERRUPTED || this == ERROR;
    }
}
