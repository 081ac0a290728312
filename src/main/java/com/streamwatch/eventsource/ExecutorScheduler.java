package com.streamwatch.eventsource;

import com.launchdarkly.logging.LDLogger;

import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * The default {@link Scheduler}, backed by a single-threaded
 * {@link ScheduledExecutorService}.
 */
final class ExecutorScheduler implements Scheduler {
  private final ScheduledExecutorService executor;
  private final boolean shouldCloseExecutor;
  private final LDLogger logger;

  ExecutorScheduler(ScheduledExecutorService executor, boolean shouldCloseExecutor, LDLogger logger) {
    this.executor = executor;
    this.shouldCloseExecutor = shouldCloseExecutor;
    this.logger = logger;
  }

  static ExecutorScheduler create(String threadBaseName, LDLogger logger) {
    ScheduledThreadPoolExecutor executor = new ScheduledThreadPoolExecutor(1,
        makeSimpleDaemonThreadFactory("eventsource-loop", threadBaseName));
    executor.setRemoveOnCancelPolicy(true);
    executor.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
    return new ExecutorScheduler(executor, true, logger);
  }

  @Override
  public void execute(Runnable task) {
    try {
      executor.execute(task);
    } catch (RejectedExecutionException e) {
      // only happens after close(), when there is nothing left to do
      logger.debug("Dropped task because the event loop is shut down");
    }
  }

  @Override
  public Task schedule(Runnable task, long delayMillis) {
    final ScheduledFuture<?> future;
    try {
      future = executor.schedule(task, delayMillis, TimeUnit.MILLISECONDS);
    } catch (RejectedExecutionException e) {
      logger.debug("Dropped timer because the event loop is shut down");
      return () -> {};
    }
    return () -> future.cancel(false);
  }

  @Override
  public long now() {
    return TimeUnit.NANOSECONDS.toMillis(System.nanoTime());
  }

  @Override
  public void close() {
    if (shouldCloseExecutor) {
      executor.shutdown();
    }
  }

  @Override
  public boolean awaitTermination(long timeoutMillis) throws InterruptedException {
    if (!shouldCloseExecutor) {
      return true; // the caller owns the executor's lifecycle
    }
    return executor.awaitTermination(timeoutMillis, TimeUnit.MILLISECONDS);
  }

  private static ThreadFactory makeSimpleDaemonThreadFactory(String categoryName, String threadBaseName) {
    final String baseName = categoryName + "[" + threadBaseName + "]";
    final AtomicInteger counter = new AtomicInteger(0);
    return new ThreadFactory() {
      @Override
      public Thread newThread(Runnable r) {
        Thread t = new Thread(r, baseName + "-" + counter.incrementAndGet());
        t.setDaemon(true);
        return t;
      }
    };
  }
}
