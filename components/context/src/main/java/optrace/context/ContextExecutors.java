package optrace.context;

import static java.util.Objects.requireNonNull;

import java.util.List;
import java.util.concurrent.AbstractExecutorService;
import java.util.concurrent.Callable;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Decorates tasks and executors so that tasks run with the {@link ContextSnapshot} of the thread
 * that launched them.
 *
 * <p>The snapshot is captured when the task is wrapped, or submitted for the propagating
 * executors, and restored around the task body only.
 */
public final class ContextExecutors {
  private ContextExecutors() {}

  /**
   * Wraps a task to run with the thread local state of the calling thread.
   *
   * @param task the task to wrap.
   * @return the wrapped task.
   */
  public static Runnable wrap(Runnable task) {
    requireNonNull(task, "Task cannot be null");
    if (task instanceof ContextRunnable) {
      return task;
    }
    return new ContextRunnable(task, ContextSnapshot.capture());
  }

  /**
   * Wraps a task to run with the thread local state of the calling thread.
   *
   * @param task the task to wrap.
   * @return the wrapped task.
   */
  public static <T> Callable<T> wrap(Callable<T> task) {
    requireNonNull(task, "Task cannot be null");
    if (task instanceof ContextCallable) {
      return task;
    }
    return new ContextCallable<>(task, ContextSnapshot.capture());
  }

  /**
   * Decorates an executor so that each task runs with the thread local state of its submitter.
   *
   * @param executor the executor running the tasks.
   * @return the propagating executor.
   */
  public static Executor propagating(Executor executor) {
    requireNonNull(executor, "Executor cannot be null");
    return task -> executor.execute(wrap(task));
  }

  /**
   * Decorates an executor service so that each task runs with the thread local state of its
   * submitter. Life-cycle operations are delegated.
   *
   * @param executor the executor service running the tasks.
   * @return the propagating executor service.
   */
  public static ExecutorService propagating(ExecutorService executor) {
    requireNonNull(executor, "Executor cannot be null");
    if (executor instanceof PropagatingExecutorService) {
      return executor;
    }
    return new PropagatingExecutorService(executor);
  }

  static final class ContextRunnable implements Runnable {
    private final Runnable task;
    private final ContextSnapshot snapshot;

    ContextRunnable(Runnable task, ContextSnapshot snapshot) {
      this.task = task;
      this.snapshot = snapshot;
    }

    @Override
    public void run() {
      try (ContextScope ignored = this.snapshot.restore()) {
        this.task.run();
      }
    }

    @Override
    public String toString() {
      return "ContextRunnable{" + this.task + '}';
    }
  }

  static final class ContextCallable<T> implements Callable<T> {
    private final Callable<T> task;
    private final ContextSnapshot snapshot;

    ContextCallable(Callable<T> task, ContextSnapshot snapshot) {
      this.task = task;
      this.snapshot = snapshot;
    }

    @Override
    public T call() throws Exception {
      try (ContextScope ignored = this.snapshot.restore()) {
        return this.task.call();
      }
    }

    @Override
    public String toString() {
      return "ContextCallable{" + this.task + '}';
    }
  }

  // submit() and invokeAll() funnel through execute() on the submitting thread
  static final class PropagatingExecutorService extends AbstractExecutorService {
    private final ExecutorService delegate;

    PropagatingExecutorService(ExecutorService delegate) {
      this.delegate = delegate;
    }

    @Override
    public void execute(Runnable command) {
      this.delegate.execute(wrap(command));
    }

    @Override
    public void shutdown() {
      this.delegate.shutdown();
    }

    @Override
    public List<Runnable> shutdownNow() {
      return this.delegate.shutdownNow();
    }

    @Override
    public boolean isShutdown() {
      return this.delegate.isShutdown();
    }

    @Override
    public boolean isTerminated() {
      return this.delegate.isTerminated();
    }

    @Override
    public boolean awaitTermination(long timeout, TimeUnit unit) throws InterruptedException {
      return this.delegate.awaitTermination(timeout, unit);
    }
  }
}
