package ca.gc.cra.eventbuffer.application.buffer;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.eventbuffer.infrastructure.exec.ExecutorFactories;
import ca.gc.cra.eventbuffer.infrastructure.source.InMemoryNotificationSource;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

class EventBufferConcurrencyTest {
  private static final int THREADS = 4;
  private static final int PER_THREAD = 2_000;

  @Test
  void concurrentDeliveryNeverExceedsCapacity() throws Exception {
    InMemoryNotificationSource<Integer> source = InMemoryNotificationSource.of("counter", "values");
    EventBuffer<Integer, Integer> buffer = new EventBuffer<>(source, "values",
        EventBufferOptions.<Integer>builder().capacity(100).build());

    runPublishers(source, () -> {
      assertTrue(buffer.count() <= 100);
      buffer.all();
    });

    assertEquals(100, buffer.count());
    EventBufferStatus status = buffer.status();
    assertEquals((long) THREADS * PER_THREAD, status.accepted());
    assertEquals((long) THREADS * PER_THREAD - 100, status.evicted());
  }

  @Test
  void perThreadOrderIsPreserved() throws Exception {
    InMemoryNotificationSource<Integer> source = InMemoryNotificationSource.of("counter", "values");
    EventBuffer<Integer, Integer> buffer = new EventBuffer<>(source, "values",
        EventBufferOptions.<Integer>builder().capacity(THREADS * PER_THREAD).build());

    runPublishers(source, () -> {});

    List<Integer> all = buffer.all();
    assertEquals(THREADS * PER_THREAD, all.size());
    int[] lastSeen = new int[THREADS];
    Arrays.fill(lastSeen, -1);
    for (int value : all) {
      int thread = value / PER_THREAD;
      int index = value % PER_THREAD;
      assertTrue(index > lastSeen[thread], "notifications from one publisher stay in order");
      lastSeen[thread] = index;
    }
  }

  @Test
  void closeDuringDeliveryLeavesConsistentState() throws Exception {
    InMemoryNotificationSource<Integer> source = InMemoryNotificationSource.of("counter", "values");
    EventBuffer<Integer, Integer> buffer = new EventBuffer<>(source, "values",
        EventBufferOptions.<Integer>builder().capacity(THREADS * PER_THREAD).build());

    runPublishers(source, buffer::close);

    int retained = buffer.count();
    assertEquals(BufferState.CLOSED, buffer.state());
    assertEquals(retained, buffer.all().size());
    source.publish("values", -1);
    assertEquals(retained, buffer.count());
    assertEquals(0, source.subscriberCount("values"));
  }

  @Test
  void singleThreadDeliveryExecutorPreservesPublishOrder() throws Exception {
    ExecutorService delivery = ExecutorFactories.newDeliveryExecutor("values-delivery");
    try {
      InMemoryNotificationSource<Integer> source =
          new InMemoryNotificationSource<>("counter", List.of("values"), delivery);
      EventBuffer<Integer, Integer> buffer = new EventBuffer<>(source, "values",
          EventBufferOptions.<Integer>builder().capacity(1_000).build());

      List<Integer> expected = new ArrayList<>();
      for (int i = 0; i < 500; i++) {
        source.publish("values", i);
        expected.add(i);
      }
      delivery.shutdown();
      assertTrue(delivery.awaitTermination(10, TimeUnit.SECONDS));

      assertEquals(expected, buffer.all());
    } finally {
      delivery.shutdownNow();
    }
  }

  private static void runPublishers(InMemoryNotificationSource<Integer> source, Runnable midway) throws Exception {
    ExecutorService pool = Executors.newFixedThreadPool(THREADS);
    CountDownLatch start = new CountDownLatch(1);
    try {
      List<Future<?>> futures = new ArrayList<>();
      for (int t = 0; t < THREADS; t++) {
        int base = t * PER_THREAD;
        futures.add(pool.submit(() -> {
          start.await();
          for (int i = 0; i < PER_THREAD; i++) {
            source.publish("values", base + i);
          }
          return null;
        }));
      }
      start.countDown();
      midway.run();
      for (Future<?> future : futures) {
        future.get(30, TimeUnit.SECONDS);
      }
    } finally {
      pool.shutdownNow();
    }
  }
}
