package ca.gc.cra.eventbuffer.infrastructure.exec;

import java.lang.Thread.UncaughtExceptionHandler;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Factory helpers for notification delivery executors.
 */
public final class ExecutorFactories {
  private static final Logger log = LoggerFactory.getLogger(ExecutorFactories.class);

  private ExecutorFactories() {}

  /**
   * Builds a single-threaded executor that runs delivery tasks in submission order on a daemon thread.
   *
   * @param prefix thread-name prefix used to tag the delivery thread
   * @return configured executor service; callers own shutdown
   */
  public static ExecutorService newDeliveryExecutor(String prefix) {
    return newDeliveryExecutor(prefix, (thread, ex) ->
        log.error("Uncaught failure on delivery thread {}", thread.getName(), ex));
  }

  /**
   * Builds a single-threaded executor that runs delivery tasks in submission order on a daemon thread.
   *
   * @param prefix thread-name prefix used to tag the delivery thread
   * @param handler uncaught exception handler installed on the delivery thread
   * @return configured executor service; callers own shutdown
   */
  public static ExecutorService newDeliveryExecutor(String prefix, UncaughtExceptionHandler handler) {
    String threadPrefix = (prefix == null || prefix.isBlank()) ? "event-delivery" : prefix.trim();
    UncaughtExceptionHandler effectiveHandler = Objects.requireNonNullElse(handler, (t, ex) -> {});
    AtomicInteger index = new AtomicInteger();
    ThreadFactory factory =
        runnable -> {
          Thread thread = new Thread(runnable);
          thread.setName(threadPrefix + "-" + index.getAndIncrement());
          thread.setDaemon(true);
          thread.setUncaughtExceptionHandler(effectiveHandler);
          return thread;
        };

    return new ThreadPoolExecutor(
        1,
        1,
        0L,
        TimeUnit.MILLISECONDS,
        new LinkedBlockingQueue<>(),
        factory,
        new ThreadPoolExecutor.AbortPolicy());
  }
}
