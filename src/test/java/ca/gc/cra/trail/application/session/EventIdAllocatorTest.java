package ca.gc.cra.trail.application.session;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.trail.domain.events.EventIds;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

class EventIdAllocatorTest {

  @Test
  void allocatesSequentialIdsFromOne() {
    EventIdAllocator allocator = new EventIdAllocator(3);

    assertEquals(0, allocator.eventCount());
    assertEquals("evt_001", allocator.nextEventId());
    assertEquals("evt_002", allocator.nextEventId());
    assertEquals(2, allocator.eventCount());
  }

  @Test
  void rejectsWidthOutOfRange() {
    assertThrows(IllegalArgumentException.class, () -> new EventIdAllocator(0));
    assertThrows(IllegalArgumentException.class, () -> new EventIdAllocator(19));
  }

  @Test
  void concurrentAllocationIsGaplessAndUnique() throws Exception {
    EventIdAllocator allocator = new EventIdAllocator(3);
    ExecutorService pool = Executors.newFixedThreadPool(8);
    Set<String> ids = ConcurrentHashMap.newKeySet();
    List<Future<?>> futures = new ArrayList<>();
    try {
      for (int t = 0; t < 8; t++) {
        futures.add(pool.submit(() -> {
          for (int i = 0; i < 1_000; i++) {
            ids.add(allocator.nextEventId());
          }
        }));
      }
      for (Future<?> future : futures) {
        future.get(10, TimeUnit.SECONDS);
      }
    } finally {
      pool.shutdownNow();
    }

    assertEquals(8_000, ids.size());
    assertEquals(8_000, allocator.eventCount());
    for (long seq = 1; seq <= 8_000; seq++) {
      assertTrue(ids.contains(EventIds.format(seq, 3)), "missing " + seq);
    }
  }
}
