package optrace.core;

import static java.util.Arrays.asList;
import static java.util.Collections.emptyList;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import optrace.core.device.DeviceBackends;
import optrace.core.time.ControllableTimeSource;
import optrace.instrumentation.ThreadIds;
import org.junit.jupiter.api.Test;

class ProfilerSessionTest {
  private final ControllableTimeSource time = new ControllableTimeSource();

  private ProfilerSession session(ProfilerState state) {
    return new ProfilerSession(new ProfilerConfig(state), DeviceBackends.none(), this.time, 4);
  }

  @Test
  void recordsRangesInCallOrder() {
    ProfilerSession session = session(ProfilerState.CPU);
    session.pushRange("add", 7, asList(asList(2L, 3L), emptyList()));
    this.time.advance(100);
    session.pushRange("mul");
    session.popRange();
    session.popRange();
    session.mark("done");

    List<Event> events = session.consolidate().events(ThreadIds.current());
    assertEquals(5, events.size());
    Event add = events.get(0);
    assertEquals(EventKind.PUSH_RANGE, add.kind());
    assertEquals("add", add.name());
    assertEquals(7, add.sequenceNr());
    assertEquals(asList(asList(2L, 3L), emptyList()), add.shapes());
    assertEquals(Event.NO_SEQUENCE_NR, events.get(1).sequenceNr());
    assertEquals(EventKind.POP_RANGE, events.get(2).kind());
    assertEquals(EventKind.MARK, events.get(4).kind());
    assertEquals(0.1, add.cpuElapsedUs(events.get(3)), 1e-9);
  }

  @Test
  void disabledSessionRecordsNothing() {
    ProfilerSession session = session(ProfilerState.DISABLED);
    session.mark("ignored");
    session.pushRange("ignored");
    session.popRange();
    assertTrue(session.consolidate().isEmpty());
  }

  @Test
  void consolidatesOnce() {
    ProfilerSession session = session(ProfilerState.CPU);
    session.mark("first");
    ConsolidatedTrace trace = session.consolidate();
    assertThrows(IllegalStateException.class, session::consolidate);
    session.mark("late");
    assertEquals(1, trace.eventCount());
  }

  @Test
  void threadsGetTheirOwnListsOrderedById() throws Exception {
    ProfilerSession session = session(ProfilerState.CPU);
    int threads = 4;
    int events = 10;
    CountDownLatch ready = new CountDownLatch(1);
    List<Thread> workers = new ArrayList<>();
    long[] ids = new long[threads];
    for (int t = 0; t < threads; t++) {
      int index = t;
      Thread worker =
          new Thread(
              () -> {
                ids[index] = ThreadIds.current();
                try {
                  ready.await();
                } catch (InterruptedException e) {
                  Thread.currentThread().interrupt();
                  return;
                }
                for (int i = 0; i < events; i++) {
                  session.pushRange("op-" + index);
                  session.popRange();
                }
              });
      workers.add(worker);
      worker.start();
    }
    ready.countDown();
    for (Thread worker : workers) {
      worker.join();
    }

    ConsolidatedTrace trace = session.consolidate();
    assertEquals(threads, trace.threads().size());
    long previous = Long.MIN_VALUE;
    for (long threadId : trace.threads().keySet()) {
      assertTrue(threadId > previous);
      previous = threadId;
    }
    for (int t = 0; t < threads; t++) {
      List<Event> threadEvents = trace.events(ids[t]);
      assertEquals(2 * events, threadEvents.size());
      for (Event event : threadEvents) {
        assertEquals(ids[t], event.threadId());
      }
      assertEquals("op-" + t, threadEvents.get(0).name());
    }
  }

  @Test
  void deviceTimedFallsBackToCpuWhenMarkerFails() {
    ProfilerSession session = session(ProfilerState.DEVICE_TIMED);
    this.time.set(42);
    session.mark("no device");
    Event mark = session.consolidate().allEvents().get(0);
    assertEquals(42, mark.cpuNanos());
    assertEquals(Event.NO_DEVICE, mark.deviceId());
  }

  @Test
  void consolidationReleasesBuffersOfPooledThreads() throws Exception {
    ProfilerSession session = session(ProfilerState.CPU);
    ExecutorService worker = Executors.newSingleThreadExecutor();
    try {
      worker.submit(() -> session.mark("big-mark")).get();
      assertEquals(1, (int) worker.submit(session::localEventCount).get());

      ConsolidatedTrace trace = session.consolidate();
      assertEquals("big-mark", trace.allEvents().get(0).name());
      // the pooled thread outlives the session but no longer holds its events
      assertEquals(0, (int) worker.submit(session::localEventCount).get());

      worker.submit(() -> session.mark("late")).get();
      assertEquals(0, (int) worker.submit(session::localEventCount).get());
      assertEquals(1, trace.eventCount());
    } finally {
      worker.shutdownNow();
      worker.awaitTermination(5, TimeUnit.SECONDS);
    }
  }
}
