package com.github.rudygunawan.nagare.state;

import java.util.Objects;

/**
 * Immutable snapshot of an asynchronous operation's state.
 *
 * <p>Outside {@link AsyncStatus#IDLE} and {@link AsyncStatus#LOADING} exactly one of
 * {@link #getData()} and {@link #getError()} is meaningful: data on success, the last error on
 * failure. A loading state keeps the previous data so views can keep showing it.
 *
 * @param <T> the type of the data
 */
public final class AsyncState<T> {
    private final T data;
    private final Throwable error;
    private final AsyncStatus status;

    private AsyncState(T data, Throwable error, AsyncStatus status) {
        this.data = data;
        this.error = error;
        this.status = Objects.requireNonNull(status, "status cannot be null");
    }

    /**
     * Creates a state with arbitrary fields, for tests and for restoring a snapshot.
     */
    public static <T> AsyncState<T> of(AsyncStatus status, T data, Throwable error) {
        return new AsyncState<>(data, error, status);
    }

    public static <T> AsyncState<T> idle(T initialData) {
        return new AsyncState<>(initialData, null, AsyncStatus.IDLE);
    }

    public static <T> AsyncState<T> success(T data) {
        return new AsyncState<>(data, null, AsyncStatus.SUCCESS);
    }

    public static <T> AsyncState<T> failure(Throwable error) {
        return new AsyncState<>(null, error, AsyncStatus.ERROR);
    }

    /**
     * Returns this state moved to LOADING, keeping the data and dropping the error.
     */
    public AsyncState<T> toLoading() {
        return new AsyncState<>(data, null, AsyncStatus.LOADING);
    }

    /**
     * Returns this state moved to ERROR with {@code error}, keeping the data.
     */
    public AsyncState<T> withError(Throwable error) {
        return new AsyncState<>(data, error, AsyncStatus.ERROR);
    }

    public T getData() {
        return data;
    }

    public Throwable getError() {
        return error;
    }

    public AsyncStatus getStatus() {
        return status;
    }

    public boolean isIdle() {
        return status == AsyncStatus.IDLE;
    }

    public boolean isLoading() {
        return status == AsyncStatus.LOADING;
    }

    public boolean isSuccess() {
        return status == AsyncStatus.SUCCESS;
    }

    public boolean isError() {
        return status == AsyncStatus.ERROR;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AsyncState)) return false;
        AsyncState<?> that = (AsyncState<?>) o;
        return Objects.equals(data, that.data) && Objects.equals(error, that.error) && status == that.status;
    }

    @Override
    public int hashCode() {
        return Objects.hash(data, error, status);
    }

    @Override
    public String toString() {
        return "AsyncState{status=" + status + ", data=" + data + ", error=" + error + '}';
    }
}
