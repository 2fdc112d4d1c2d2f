package bio.terra.iamdrift.common.utils;

import bio.terra.iamdrift.common.exception.InternalLogicException;
import bio.terra.iamdrift.common.exception.WorkerPoolException;
import com.google.common.base.Preconditions;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs independent tasks on a fixed number of threads, bounding how many cloud API calls are in
 * flight at once.
 *
 * <p>Tasks are submitted with {@link #submit(String, Callable)} and joined with {@link #done()},
 * which returns the results in submission order. With stop-on-error set, the first failure stops
 * the pool: tasks that have not started yet are skipped, running tasks finish, and {@link
 * #done()} throws a {@link WorkerPoolException} whose cause is that first failure. Without it,
 * every task runs and {@link #done()} throws if any of them failed.
 *
 * @param <T> the task result type
 */
public class WorkerPool<T> implements AutoCloseable {
  private static final Logger logger = LoggerFactory.getLogger(WorkerPool.class);
  private static final long CLOSE_WAIT_SECONDS = 30;

  private final String name;
  private final boolean stopOnError;
  private final ExecutorService executor;
  private final List<SubmittedTask<T>> tasks = new ArrayList<>();
  private final AtomicBoolean stopped = new AtomicBoolean(false);
  private final AtomicReference<FailedTask> firstFailure = new AtomicReference<>();
  private boolean joined;

  public WorkerPool(String name, int concurrency, boolean stopOnError) {
    Preconditions.checkArgument(concurrency > 0, "Worker pool concurrency must be positive");
    this.name = name;
    this.stopOnError = stopOnError;
    this.executor =
        Executors.newFixedThreadPool(
            concurrency,
            new ThreadFactoryBuilder().setNameFormat(name + "-%d").setDaemon(true).build());
  }

  /**
   * Queue a task. Once the pool has stopped on an error, new tasks are not admitted.
   *
   * @param taskName name used in logs and errors
   * @param task the work to run
   * @return true if the task was queued, false if the pool has stopped
   */
  public synchronized boolean submit(String taskName, Callable<T> task) {
    if (joined) {
      throw new InternalLogicException(
          String.format("Task %s submitted to worker pool %s after done()", taskName, name));
    }
    if (stopped.get()) {
      logger.debug("Worker pool {} is stopped, not running task {}", name, taskName);
      return false;
    }
    Future<TaskOutcome<T>> future = executor.submit(() -> runTask(taskName, task));
    tasks.add(new SubmittedTask<>(taskName, future));
    return true;
  }

  /**
   * Wait for every submitted task and return their results in submission order.
   *
   * @return results of the tasks that ran
   * @throws WorkerPoolException if any task failed
   */
  public List<T> done() {
    List<SubmittedTask<T>> toJoin;
    synchronized (this) {
      joined = true;
      toJoin = List.copyOf(tasks);
    }
    executor.shutdown();

    List<T> results = new ArrayList<>();
    List<String> failures = new ArrayList<>();
    Throwable firstJoinFailure = null;
    for (SubmittedTask<T> task : toJoin) {
      try {
        TaskOutcome<T> outcome = task.future().get();
        if (!outcome.skipped()) {
          results.add(outcome.value());
        }
      } catch (ExecutionException e) {
        failures.add(task.name() + ": " + e.getCause().getMessage());
        if (firstJoinFailure == null) {
          firstJoinFailure = e.getCause();
        }
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        executor.shutdownNow();
        throw new InternalLogicException(
            String.format("Interrupted while joining task %s in worker pool %s", task.name(), name),
            e);
      }
    }

    FailedTask failure = firstFailure.get();
    if (failure != null) {
      throw new WorkerPoolException(
          String.format("failed to execute task %s in worker pool %s", failure.name(), name),
          failure.cause(),
          failures);
    }
    if (firstJoinFailure != null) {
      throw new WorkerPoolException(
          String.format("failed to execute task in worker pool %s", name),
          firstJoinFailure,
          failures);
    }
    return Collections.unmodifiableList(results);
  }

  @Override
  public void close() {
    executor.shutdownNow();
    boolean terminated =
        Rethrow.onInterrupted(
            () -> executor.awaitTermination(CLOSE_WAIT_SECONDS, TimeUnit.SECONDS),
            "close worker pool " + name);
    if (!terminated) {
      logger.warn("Worker pool {} did not terminate within {}s", name, CLOSE_WAIT_SECONDS);
    }
  }

  private TaskOutcome<T> runTask(String taskName, Callable<T> task) throws Exception {
    if (stopped.get()) {
      logger.debug("Skipping task {} in stopped worker pool {}", taskName, name);
      return TaskOutcome.skip();
    }
    try {
      return TaskOutcome.of(task.call());
    } catch (Throwable t) {
      recordFailure(taskName, t);
      throw t;
    }
  }

  private void recordFailure(String taskName, Throwable cause) {
    if (firstFailure.compareAndSet(null, new FailedTask(taskName, cause))) {
      logger.debug("Task {} in worker pool {} failed first", taskName, name, cause);
    }
    if (stopOnError) {
      stopped.set(true);
    }
  }

  private record SubmittedTask<T>(String name, Future<TaskOutcome<T>> future) {}

  private record FailedTask(String name, Throwable cause) {}

  private record TaskOutcome<T>(T value, boolean skipped) {
    static <T> TaskOutcome<T> of(T value) {
      return new TaskOutcome<>(value, false);
    }

    static <T> TaskOutcome<T> skip() {
      return new TaskOutcome<>(null, true);
    }
  }
}
