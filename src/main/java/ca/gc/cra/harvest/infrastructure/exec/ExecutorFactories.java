package ca.gc.cra.harvest.infrastructure.exec;

import java.lang.Thread.UncaughtExceptionHandler;
import java.util.Objects;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;

/**
 * Factory helpers for the executors driving HARVEST collection loops.
 */
public final class ExecutorFactories {

  private ExecutorFactories() {}

  /**
   * Builds a single-thread scheduler for one server's log collection loop.
   *
   * <p>A single thread keeps pipeline invocations for one server sequential. Cancelled ticks are removed from the
   * queue and no delayed task runs after shutdown.</p>
   *
   * @param name thread name, typically {@code harvest-logs-<section>}
   * @param handler uncaught exception handler installed on the thread
   * @return configured scheduler
   */
  public static ScheduledExecutorService newCollectionScheduler(String name, UncaughtExceptionHandler handler) {
    String threadName = (name == null || name.isBlank()) ? "harvest-logs" : name;
    UncaughtExceptionHandler effectiveHandler = Objects.requireNonNullElse(handler, (t, ex) -> {});
    ThreadFactory factory =
        runnable -> {
          Thread thread = new Thread(runnable, threadName);
          thread.setDaemon(false);
          thread.setUncaughtExceptionHandler(effectiveHandler);
          return thread;
        };
    ScheduledThreadPoolExecutor executor = new ScheduledThreadPoolExecutor(1, factory);
    executor.setRemoveOnCancelPolicy(true);
    executor.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
    return executor;
  }
}
