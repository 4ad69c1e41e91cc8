package optrace.core;

import static java.util.Collections.emptyList;
import static java.util.Objects.requireNonNull;

import java.util.List;
import javax.annotation.Nullable;
import optrace.core.device.DeviceBackend;
import optrace.core.device.DeviceBackends;
import optrace.core.device.DeviceMarker;

/**
 * A recorded mark or range boundary.
 *
 * <p>Events carry a CPU timestamp and, when recorded in the device timed state, a {@link
 * DeviceMarker}. Durations are measured between two events with {@link #cpuElapsedUs(Event)} and
 * {@link #deviceElapsedUs(Event)}.
 */
public final class Event {
  public static final int NO_DEVICE = -1;
  public static final long NO_SEQUENCE_NR = -1;

  private final EventKind kind;
  private final String name;
  private final long threadId;
  private final long cpuNanos;
  @Nullable private final DeviceMarker deviceMarker;
  private final int deviceId;
  private final long sequenceNr;
  private final List<List<Long>> shapes;

  public Event(
      EventKind kind,
      String name,
      long threadId,
      long cpuNanos,
      @Nullable DeviceMarker deviceMarker,
      int deviceId,
      long sequenceNr,
      List<List<Long>> shapes) {
    this.kind = requireNonNull(kind, "Event kind cannot be null");
    this.name = requireNonNull(name, "Event name cannot be null");
    this.threadId = threadId;
    this.cpuNanos = cpuNanos;
    this.deviceMarker = deviceMarker;
    this.deviceId = deviceMarker == null ? NO_DEVICE : deviceId;
    this.sequenceNr = sequenceNr;
    this.shapes = shapes;
  }

  /** Creates an event with a CPU timestamp only. */
  public static Event cpu(EventKind kind, String name, long threadId, long cpuNanos) {
    return new Event(kind, name, threadId, cpuNanos, null, NO_DEVICE, NO_SEQUENCE_NR, emptyList());
  }

  public EventKind kind() {
    return this.kind;
  }

  public String name() {
    return this.name;
  }

  public long threadId() {
    return this.threadId;
  }

  public long cpuNanos() {
    return this.cpuNanos;
  }

  @Nullable
  public DeviceMarker deviceMarker() {
    return this.deviceMarker;
  }

  /** Returns the device of the marker; {@link #NO_DEVICE} without one. */
  public int deviceId() {
    return this.deviceId;
  }

  public boolean hasDevice() {
    return this.deviceMarker != null;
  }

  /** Returns the sequence number of the recorded call; {@link #NO_SEQUENCE_NR} without one. */
  public long sequenceNr() {
    return this.sequenceNr;
  }

  /** Returns the shapes of the call arguments; empty unless they were captured. */
  public List<List<Long>> shapes() {
    return this.shapes;
  }

  /**
   * Measures the CPU time from this event to the given one.
   *
   * @param end the later event.
   * @return the elapsed time in microseconds.
   */
  public double cpuElapsedUs(Event end) {
    return (end.cpuNanos - this.cpuNanos) / 1000.0;
  }

  /**
   * Measures the device time from this event to the given one with the registered backend.
   *
   * @see #deviceElapsedUs(Event, DeviceBackend)
   */
  public double deviceElapsedUs(Event end) {
    return deviceElapsedUs(end, DeviceBackends.current());
  }

  /**
   * Measures the device time from this event to the given one.
   *
   * @param end the later event.
   * @param backend the backend that recorded both events.
   * @return the elapsed time in microseconds.
   * @throws MeasurementException if either event has no device marker or if they were recorded on
   *     different devices.
   */
  public double deviceElapsedUs(Event end, DeviceBackend backend) {
    if (this.deviceMarker == null || end.deviceMarker == null) {
      throw new MeasurementException("Events were not recorded on a device");
    }
    if (this.deviceId != end.deviceId) {
      throw new MeasurementException("Events are not on the same device");
    }
    return backend.elapsedMicros(this.deviceMarker, end.deviceMarker);
  }

  @Override
  public String toString() {
    StringBuilder builder =
        new StringBuilder("Event{")
            .append(this.kind)
            .append(' ')
            .append(this.name)
            .append(", thread=")
            .append(this.threadId)
            .append(", cpuNanos=")
            .append(this.cpuNanos);
    if (this.deviceMarker != null) {
      builder.append(", device=").append(this.deviceId);
    }
    if (this.sequenceNr >= 0) {
      builder.append(", seq=").append(this.sequenceNr);
    }
    if (!this.shapes.isEmpty()) {
      builder.append(", shapes=").append(this.shapes);
    }
    return builder.append('}').toString();
  }
}
