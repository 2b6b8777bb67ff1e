package com.github.rudygunawan.nagare.state;

import java.util.concurrent.CancellationException;

/**
 * Signals that the outcome of a run was discarded because a newer run, a reset or closing the
 * owner superseded it. Never retried and never reported to error callbacks.
 */
public class ExecutionCancelledException extends CancellationException {
    private static final long serialVersionUID = 1L;

    public ExecutionCancelledException(String message) {
        super(message);
    }
}
