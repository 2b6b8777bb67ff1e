package com.github.rudygunawan.nagare.state;

import com.github.rudygunawan.nagare.api.AsyncFunction;
import com.github.rudygunawan.nagare.api.AsyncTask;
import com.github.rudygunawan.nagare.listener.StateListener;
import com.github.rudygunawan.nagare.policy.RetryPolicy;
import com.github.rudygunawan.nagare.util.Futures;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Tracks the status of an asynchronous operation through IDLE, LOADING, SUCCESS and ERROR.
 *
 * <p>Every {@link #execute(Object)} starts a run tagged with a new generation. Only the run
 * holding the latest generation may commit its outcome; a reset or a newer run supersedes older
 * ones. A superseded run makes no further attempts and its caller receives
 * {@link ExecutionCancelledException}: right away when {@code abortPrevious} is set, otherwise
 * once its in-flight attempt settles. Cancellation is cooperative, the operation itself is never
 * interrupted. Once {@link #close()} is called (the owner is gone) nothing is committed any more.
 *
 * <p>Any failure of a current run, a {@link java.util.concurrent.CancellationException} raised by
 * the operation included, is retried and then committed as ERROR.
 *
 * <p>Failed attempts are retried according to the configured {@link RetryPolicy} before the run
 * settles as ERROR. Callbacks and listeners run on the thread completing the run, outside the
 * machine's lock; their exceptions are logged at WARNING under
 * {@code com.github.rudygunawan.nagare.State}.
 *
 * <pre>{@code
 * AsyncStateMachine<String, Vault> vault = AsyncStateMachine.create(
 *     id -> client.vault(id),
 *     AsyncOptions.<Vault>builder().retry(RetryPolicy.linear(2, 1, TimeUnit.SECONDS)).build());
 *
 * vault.addListener(state -> view.render(state));
 * vault.execute("42");
 * }</pre>
 *
 * @param <A> the type of the operation's argument, {@code Void} for none
 * @param <T> the type of the data
 */
public class AsyncStateMachine<A, T> implements AutoCloseable {
    static final Logger LOGGER = Logger.getLogger("com.github.rudygunawan.nagare.State");

    private final AsyncFunction<? super A, T> function;
    private final AsyncOptions<T> options;
    private final List<StateListener<T>> listeners = new CopyOnWriteArrayList<>();

    // Guarded by this
    private AsyncState<T> state;
    private long generation;
    private Run<T> current;
    private boolean closed;

    AsyncStateMachine(AsyncFunction<? super A, T> function, AsyncOptions<T> options) {
        this.function = Objects.requireNonNull(function, "function cannot be null");
        this.options = Objects.requireNonNull(options, "options cannot be null");
        this.state = AsyncState.idle(options.initialData());
    }

    /**
     * Creates a machine, executing it once right away when {@link AsyncOptions#immediate()} is set.
     */
    public static <A, T> AsyncStateMachine<A, T> create(AsyncFunction<? super A, T> function, AsyncOptions<T> options) {
        AsyncStateMachine<A, T> machine = new AsyncStateMachine<>(function, options);
        if (options.immediate()) {
            machine.execute(null);
        }
        return machine;
    }

    /**
     * Creates a machine with default options.
     */
    public static <A, T> AsyncStateMachine<A, T> create(AsyncFunction<? super A, T> function) {
        return create(function, AsyncOptions.defaults());
    }

    /**
     * Creates a machine for an operation without arguments.
     */
    public static <T> AsyncStateMachine<Void, T> forTask(AsyncTask<T> task, AsyncOptions<T> options) {
        Objects.requireNonNull(task, "task cannot be null");
        return create(ignored -> task.call(), options);
    }

    /**
     * Executes the operation with a {@code null} argument.
     */
    public CompletableFuture<T> execute() {
        return execute(null);
    }

    /**
     * Starts a new run of the operation.
     *
     * @param argument the argument passed to every attempt of this run
     * @return a future completing with this run's data, failing with its last error, or failing
     *     with {@link ExecutionCancelledException} if the run was superseded, reset or the machine
     *     closed
     */
    public CompletableFuture<T> execute(A argument) {
        Run<T> run;
        Run<T> aborted = null;
        AsyncState<T> loading;
        synchronized (this) {
            if (closed) {
                return CompletableFuture.failedFuture(new ExecutionCancelledException("State machine is closed"));
            }
            if (options.abortPrevious()) {
                aborted = current;
            }
            run = new Run<>(++generation);
            current = run;
            state = state.toLoading();
            loading = state;
        }
        if (aborted != null) {
            aborted.cancel();
        }
        publish(loading);
        invoke("onLoading", options.onLoading());

        attempt(run, argument, 0);
        return run.result;
    }

    private void attempt(Run<T> run, A argument, int attempt) {
        if (!isCurrent(run)) {
            run.cancel();
            return;
        }
        AsyncTask.start(function.bind(argument)).whenComplete((value, error) -> {
            if (error == null) {
                succeed(run, value);
                return;
            }
            Throwable failure = Futures.unwrap(error);
            if (!isCurrent(run)) {
                run.cancel();
                return;
            }
            RetryPolicy retry = options.retry();
            if (attempt + 1 < retry.maxAttempts()) {
                long delay = retry.delayAfterAttempt(attempt);
                if (LOGGER.isLoggable(Level.FINE)) {
                    LOGGER.fine("Attempt " + (attempt + 1) + " of run " + run.generation + " failed ("
                            + failure + "), retrying in " + delay + " ms");
                }
                options.scheduler().delay(delay, TimeUnit.MILLISECONDS)
                        .thenRun(() -> attempt(run, argument, attempt + 1));
                return;
            }
            fail(run, failure);
        });
    }

    private synchronized boolean isCurrent(Run<T> run) {
        return !closed && run.generation == generation;
    }

    private void succeed(Run<T> run, T value) {
        AsyncState<T> committed = null;
        synchronized (this) {
            if (!closed && run.generation == generation) {
                state = AsyncState.success(value);
                committed = state;
            }
        }
        if (committed == null) {
            run.cancel();
            return;
        }
        publish(committed);
        invoke("onSuccess", () -> options.onSuccess().accept(value));
        run.result.complete(value);
    }

    private void fail(Run<T> run, Throwable failure) {
        AsyncState<T> committed = null;
        synchronized (this) {
            if (!closed && run.generation == generation) {
                state = AsyncState.failure(failure);
                committed = state;
            }
        }
        if (committed == null) {
            run.cancel();
            return;
        }
        publish(committed);
        invoke("onError", () -> options.onError().accept(failure));
        run.result.completeExceptionally(failure);
    }

    /**
     * Supersedes any outstanding run and returns to IDLE with the initial data.
     */
    public void reset() {
        Run<T> aborted;
        AsyncState<T> idle;
        synchronized (this) {
            generation++;
            aborted = current;
            current = null;
            state = AsyncState.idle(options.initialData());
            idle = state;
        }
        if (aborted != null) {
            aborted.cancel();
        }
        publish(idle);
        invoke("onReset", options.onReset());
    }

    /**
     * Sets SUCCESS with {@code data} without running the operation, e.g. for optimistic updates.
     * An outstanding run may still commit over it.
     */
    public void setData(T data) {
        AsyncState<T> updated;
        synchronized (this) {
            if (closed) {
                return;
            }
            state = AsyncState.success(data);
            updated = state;
        }
        publish(updated);
    }

    /**
     * Sets ERROR with {@code error} without running the operation, keeping the current data.
     */
    public void setError(Throwable error) {
        Objects.requireNonNull(error, "error cannot be null");
        AsyncState<T> updated;
        synchronized (this) {
            if (closed) {
                return;
            }
            state = state.withError(error);
            updated = state;
        }
        publish(updated);
    }

    public synchronized AsyncState<T> getState() {
        return state;
    }

    public T getData() {
        return getState().getData();
    }

    public Throwable getError() {
        return getState().getError();
    }

    public AsyncStatus getStatus() {
        return getState().getStatus();
    }

    public boolean isLoading() {
        return getState().isLoading();
    }

    public synchronized boolean isClosed() {
        return closed;
    }

    public void addListener(StateListener<T> listener) {
        listeners.add(Objects.requireNonNull(listener, "listener cannot be null"));
    }

    public void removeListener(StateListener<T> listener) {
        listeners.remove(listener);
    }

    /**
     * Marks the owner as gone. Outstanding runs are aborted and nothing is committed afterwards.
     */
    @Override
    public void close() {
        Run<T> aborted;
        synchronized (this) {
            closed = true;
            aborted = current;
            current = null;
        }
        if (aborted != null) {
            aborted.cancel();
        }
    }

    private void publish(AsyncState<T> committed) {
        for (StateListener<T> listener : listeners) {
            try {
                listener.onStateChange(committed);
            } catch (RuntimeException e) {
                LOGGER.log(Level.WARNING, "StateListener threw exception for state: " + committed.getStatus(), e);
            }
        }
    }

    private static void invoke(String callback, Runnable action) {
        try {
            action.run();
        } catch (RuntimeException e) {
            LOGGER.log(Level.WARNING, callback + " callback threw exception", e);
        }
    }

    private static final class Run<T> {
        final long generation;
        final CompletableFuture<T> result = new CompletableFuture<>();

        Run(long generation) {
            this.generation = generation;
        }

        void cancel() {
            result.completeExceptionally(new ExecutionCancelledException("Execution cancelled"));
        }
    }
}
