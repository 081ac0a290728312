package com.streamwatch.eventsource;

/**
 * The event loop that all of EventSource's state changes run on.
 * <p>
 * Tasks passed to {@link #execute(Runnable)} and {@link #schedule(Runnable, long)} run one
 * at a time, never concurrently with each other. Tests substitute an implementation with
 * a manual clock.
 */
interface Scheduler {
  /**
   * A pending delayed task.
   */
  interface Task {
    /**
     * Prevents the task from running if it has not started yet. Safe to call more than
     * once, or after the task has run.
     */
    void cancel();
  }

  void execute(Runnable task);

  Task schedule(Runnable task, long delayMillis);

  /**
   * Returns the current time in milliseconds, on a clock that is only meaningful for
   * measuring intervals.
   */
  long now();

  /**
   * Stops accepting tasks. Pending delayed tasks are discarded.
   */
  void close();

  boolean awaitTermination(long timeoutMillis) throws InterruptedException;
}
