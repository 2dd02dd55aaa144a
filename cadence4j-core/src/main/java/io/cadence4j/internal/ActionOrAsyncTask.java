package io.cadence4j.internal;

import io.cadence4j.CheckedRunnable;

import java.util.Objects;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.function.Supplier;

/**
 * Inline work of a scheduled event: either a blocking action or an asynchronous task that is
 * awaited.
 */
final class ActionOrAsyncTask {

    private final CheckedRunnable action;
    private final Supplier<? extends CompletionStage<?>> asyncTask;

    private ActionOrAsyncTask(CheckedRunnable action, Supplier<? extends CompletionStage<?>> asyncTask) {
        this.action = action;
        this.asyncTask = asyncTask;
    }

    static ActionOrAsyncTask of(CheckedRunnable action) {
        return new ActionOrAsyncTask(Objects.requireNonNull(action, "action must not be null"), null);
    }

    static ActionOrAsyncTask ofAsync(Supplier<? extends CompletionStage<?>> asyncTask) {
        return new ActionOrAsyncTask(null, Objects.requireNonNull(asyncTask, "asyncTask must not be null"));
    }

    void invoke() throws Exception {
        if (action != null) {
            action.run();
        } else {
            await(asyncTask.get());
        }
    }

    /**
     * Block until the stage completes, rethrowing the failure it completed with.
     */
    static <T> T await(CompletionStage<T> stage) throws Exception {
        if (stage == null) {
            return null;
        }
        try {
            return stage.toCompletableFuture().get();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw ex;
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause();
            if (cause instanceof Exception e) {
                throw e;
            }
            if (cause instanceof Error err) {
                throw err;
            }
            throw ex;
        }
    }
}
