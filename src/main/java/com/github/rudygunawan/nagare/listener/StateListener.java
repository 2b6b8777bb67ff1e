package com.github.rudygunawan.nagare.listener;

import com.github.rudygunawan.nagare.state.AsyncState;

/**
 * Receives every state committed by an {@code AsyncStateMachine}, in commit order per thread.
 * Exceptions are logged and ignored.
 *
 * @param <T> the type of the data
 */
@FunctionalInterface
public interface StateListener<T> {

    void onStateChange(AsyncState<T> state);
}
