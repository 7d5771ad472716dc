package ca.gc.cra.eventbuffer.infrastructure.exec;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

class ExecutorFactoriesTest {

  @Test
  void deliveryThreadIsNamedDaemon() throws Exception {
    ExecutorService executor = ExecutorFactories.newDeliveryExecutor("audit-delivery");
    try {
      Thread thread = executor.submit(Thread::currentThread).get(5, TimeUnit.SECONDS);

      assertEquals("audit-delivery-0", thread.getName());
      assertTrue(thread.isDaemon());
    } finally {
      executor.shutdownNow();
    }
  }

  @Test
  void blankPrefixFallsBackToDefault() throws Exception {
    ExecutorService executor = ExecutorFactories.newDeliveryExecutor(" ");
    try {
      String name = executor.submit(() -> Thread.currentThread().getName()).get(5, TimeUnit.SECONDS);

      assertTrue(name.startsWith("event-delivery-"));
    } finally {
      executor.shutdownNow();
    }
  }
}
