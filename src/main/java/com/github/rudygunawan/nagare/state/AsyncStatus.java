package com.github.rudygunawan.nagare.state;

/**
 * Lifecycle status of an asynchronous operation.
 */
public enum AsyncStatus {
    /** Nothing has run since creation or the last reset. */
    IDLE,
    /** A run is outstanding. */
    LOADING,
    /** The latest run produced data. */
    SUCCESS,
    /** The latest run failed after its retries. */
    ERROR
}
