package com.jdocs.dispatch;

/**
 * Where a user turn currently is in the dispatch loop.
 */
public enum DispatchState {
    AWAITING_INPUT,
    DECIDING,
    ANSWERING,
    EXECUTING,
    SYNTHESIZING
}
