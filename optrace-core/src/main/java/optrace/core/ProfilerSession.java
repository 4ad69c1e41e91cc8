package optrace.core;

import static java.util.Collections.emptyList;
import static java.util.Collections.unmodifiableList;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.concurrent.atomic.AtomicBoolean;
import optrace.core.device.DeviceBackend;
import optrace.core.device.DeviceRecord;
import optrace.core.time.TimeSource;
import optrace.instrumentation.ThreadIds;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * State of one profiling session: its configuration and one {@link RangeEventList} per thread that
 * recorded into it.
 *
 * <p>The lock of the session is only taken the first time a thread records, to register the list
 * of that thread. Later events of the thread are appended without locking.
 *
 * <p>Recording operations never throw. Once the session is {@link #consolidate() consolidated},
 * they are ignored.
 */
public final class ProfilerSession {
  private static final Logger log = LoggerFactory.getLogger(ProfilerSession.class);

  private final ProfilerConfig config;
  private final DeviceBackend deviceBackend;
  private final TimeSource timeSource;
  private final int blockSize;
  private final EventRecorder recorder;

  private final Object lock = new Object();
  // guarded by lock
  private final Map<Long, RangeEventList> eventLists = new HashMap<>();
  private final ThreadLocal<RangeEventList> localEventList = new ThreadLocal<>();
  private final AtomicBoolean consolidated = new AtomicBoolean();
  private final AtomicBoolean stopped = new AtomicBoolean();

  ProfilerSession(
      ProfilerConfig config, DeviceBackend deviceBackend, TimeSource timeSource, int blockSize) {
    this.config = config;
    this.deviceBackend = deviceBackend;
    this.timeSource = timeSource;
    this.blockSize = blockSize;
    this.recorder = config.state().recorder(this);
  }

  public ProfilerConfig config() {
    return this.config;
  }

  DeviceBackend deviceBackend() {
    return this.deviceBackend;
  }

  public void mark(String name) {
    mark(name, true);
  }

  /**
   * Records an instantaneous mark.
   *
   * @param name the mark name.
   * @param includeDevice whether to record a device marker in the device timed state.
   */
  public void mark(String name, boolean includeDevice) {
    this.recorder.mark(name, includeDevice);
  }

  /**
   * Opens a range on the calling thread.
   *
   * @param name the range name.
   * @param sequenceNr the sequence number of the recorded call; negative if there is none.
   * @param shapes the shapes of the call arguments; empty if they are not captured.
   */
  public void pushRange(String name, long sequenceNr, List<List<Long>> shapes) {
    this.recorder.pushRange(name, sequenceNr, shapes);
  }

  public void pushRange(String name) {
    pushRange(name, Event.NO_SEQUENCE_NR, emptyList());
  }

  /** Closes the last range opened on the calling thread. */
  public void popRange() {
    this.recorder.popRange();
  }

  void record(
      EventKind kind,
      String name,
      long sequenceNr,
      List<List<Long>> shapes,
      boolean includeDevice) {
    if (this.consolidated.get()) {
      this.localEventList.remove();
      if (log.isDebugEnabled()) {
        log.debug("Dropping {} {} recorded after the session was consolidated", kind, name);
      }
      return;
    }
    long threadId = ThreadIds.current();
    Event event = null;
    if (includeDevice) {
      try {
        DeviceRecord record = this.deviceBackend.record();
        event =
            new Event(
                kind,
                name,
                threadId,
                record.cpuNanos(),
                record.marker(),
                record.deviceId(),
                sequenceNr,
                shapes);
      } catch (RuntimeException e) {
        log.debug("Failed to record a device marker for {} {}", kind, name, e);
      }
    }
    if (event == null) {
      event =
          new Event(
              kind,
              name,
              threadId,
              this.timeSource.getNanoTicks(),
              null,
              Event.NO_DEVICE,
              sequenceNr,
              shapes);
    }
    eventList(threadId).append(event);
  }

  private RangeEventList eventList(long threadId) {
    RangeEventList eventList = this.localEventList.get();
    if (eventList == null) {
      synchronized (this.lock) {
        eventList = this.eventLists.get(threadId);
        if (eventList == null) {
          eventList = new RangeEventList(this.blockSize);
          this.eventLists.put(threadId, eventList);
        }
      }
      this.localEventList.set(eventList);
    }
    return eventList;
  }

  /** Number of events held by the list cached for the calling thread. */
  int localEventCount() {
    RangeEventList eventList = this.localEventList.get();
    return eventList == null ? 0 : eventList.size();
  }

  /** Claims the stop of the session; {@code false} if it was already stopped. */
  boolean markStopped() {
    return this.stopped.compareAndSet(false, true);
  }

  public boolean isConsolidated() {
    return this.consolidated.get();
  }

  /**
   * Collects the events of every thread. Threads must have stopped recording into the session.
   *
   * @return the events per thread, ordered by thread id.
   * @throws IllegalStateException if the session was already consolidated.
   */
  public ConsolidatedTrace consolidate() {
    if (!this.consolidated.compareAndSet(false, true)) {
      throw new IllegalStateException("Profiler session was already consolidated");
    }
    SortedMap<Long, List<Event>> threads = new TreeMap<>();
    synchronized (this.lock) {
      for (Map.Entry<Long, RangeEventList> entry : this.eventLists.entrySet()) {
        threads.put(entry.getKey(), unmodifiableList(entry.getValue().snapshot()));
        // worker threads keep their cached list until they touch the session again
        entry.getValue().clear();
      }
      this.eventLists.clear();
    }
    return new ConsolidatedTrace(threads);
  }

  @Override
  public String toString() {
    return "ProfilerSession{" + this.config.state() + (isConsolidated() ? ", consolidated}" : "}");
  }
}
