package org.dynamis.async.runtime;

import java.util.List;

/**
 * Deferred result of an async procedure.
 * <p>
 * A lowered procedure's entry method returns a fresh {@code Task}; its dispatcher completes, cancels
 * or fails it when the last segment has run. The static factories {@link #delay(float)},
 * {@link #delayFrames(int)} and {@link #yieldFrame()} only exist to be awaited: the lowering pass
 * turns them into scheduling requests and never evaluates them. {@link #whenAll(Task[])} and
 * {@link #whenAny(Task[])} are real combinators whose status follows their children.
 *
 * @param <T> type of the value delivered on completion, {@link Void} for none
 */
public class Task<T> {

    private TaskStatus status;
    private T result;
    private String error;

    public Task() {
        this.status = TaskStatus.WAITING_FOR_ACTIVATION;
    }

    public static <T> Task<T> completed(T value) {
        Task<T> task = new Task<>();
        task.complete(value);
        return task;
    }

    public static <T> Task<T> canceled() {
        Task<T> task = new Task<>();
        task.cancel();
        return task;
    }

    public static <T> Task<T> failed(String error) {
        Task<T> task = new Task<>();
        task.fail(error);
        return task;
    }

    // ── Awaitable primitives ─────────────────────────────────────────────

    public static Task<Void> delay(float seconds) {
        throw new IllegalStateException("Task.delay(" + seconds + ") can only be awaited directly inside an async procedure");
    }

    public static Task<Void> delayFrames(int frames) {
        throw new IllegalStateException("Task.delayFrames(" + frames + ") can only be awaited directly inside an async procedure");
    }

    public static Task<Void> yieldFrame() {
        throw new IllegalStateException("Task.yieldFrame() can only be awaited directly inside an async procedure");
    }

    public static Task<Void> whenAll(Task<?>... tasks) {
        if (tasks == null || tasks.length == 0) {
            return completed(null);
        }
        return new AllOf(List.of(tasks));
    }

    /**
     * Completes with the index of the first child found done.
     */
    public static Task<Integer> whenAny(Task<?>... tasks) {
        if (tasks == null || tasks.length == 0) {
            return completed(-1);
        }
        return new AnyOf(List.of(tasks));
    }

    // ── State ────────────────────────────────────────────────────────────

    public TaskStatus getStatus() {
        return status;
    }

    public boolean isDone() {
        return getStatus().isTerminal();
    }

    public boolean isCompletedSuccessfully() {
        return getStatus() == TaskStatus.RAN_TO_COMPLETION;
    }

    public boolean isCanceled() {
        return getStatus() == TaskStatus.CANCELED;
    }

    public boolean isFaulted() {
        return getStatus() == TaskStatus.FAULTED;
    }

    public String getError() {
        getStatus();
        return error;
    }

    /**
     * @throws IllegalStateException if the task did not run to completion
     */
    public T getResult() {
        TaskStatus current = getStatus();
        if (current != TaskStatus.RAN_TO_COMPLETION) {
            throw new IllegalStateException("Task has no result in status " + current);
        }
        return result;
    }

    // First terminal transition wins, later ones are ignored.

    public boolean complete(T value) {
        if (status.isTerminal()) {
            return false;
        }
        this.result = value;
        this.status = TaskStatus.RAN_TO_COMPLETION;
        return true;
    }

    public boolean cancel() {
        if (status.isTerminal()) {
            return false;
        }
        this.status = TaskStatus.CANCELED;
        return true;
    }

    public boolean fail(String error) {
        if (status.isTerminal()) {
            return false;
        }
        this.error = error;
        this.status = TaskStatus.FAULTED;
        return true;
    }

    @Override
    public String toString() {
        return "Task{" + "status=" + status + (error != null ? ", error='" + error + '\'' : "") + '}';
    }

    private static final class AllOf extends Task<Void> {

        private final List<Task<?>> children;

        AllOf(List<Task<?>> children) {
            this.children = children;
        }

        @Override
        public TaskStatus getStatus() {
            TaskStatus own = super.getStatus();
            if (own.isTerminal()) {
                return own;
            }
            String firstError = null;
            boolean anyCanceled = false;
            for (Task<?> child : children) {
                if (!child.isDone()) {
                    return own;
                }
                if (child.isFaulted() && firstError == null) {
                    firstError = child.getError();
                } else if (child.isCanceled()) {
                    anyCanceled = true;
                }
            }
            if (firstError != null) {
                fail(firstError);
            } else if (anyCanceled) {
                cancel();
            } else {
                complete(null);
            }
            return super.getStatus();
        }
    }

    private static final class AnyOf extends Task<Integer> {

        private final List<Task<?>> children;

        AnyOf(List<Task<?>> children) {
            this.children = children;
        }

        @Override
        public TaskStatus getStatus() {
            TaskStatus own = super.getStatus();
            if (own.isTerminal()) {
                return own;
            }
            for (int i = 0; i < children.size(); i++) {
                if (children.get(i).isDone()) {
                    complete(i);
                    break;
                }
            }
            return super.getStatus();
        }
    }
}
