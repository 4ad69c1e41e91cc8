package optrace.core.device;

import static java.util.Objects.requireNonNull;

/** Result of {@link DeviceBackend#record()}: a device marker and the matching CPU timestamp. */
public final class DeviceRecord {
  private final DeviceMarker marker;
  private final int deviceId;
  private final long cpuNanos;

  public DeviceRecord(DeviceMarker marker, int deviceId, long cpuNanos) {
    this.marker = requireNonNull(marker, "Device marker cannot be null");
    this.deviceId = deviceId;
    this.cpuNanos = cpuNanos;
  }

  public DeviceMarker marker() {
    return this.marker;
  }

  public int deviceId() {
    return this.deviceId;
  }

  public long cpuNanos() {
    return this.cpuNanos;
  }

  @Override
  public String toString() {
    return "DeviceRecord{device=" + this.deviceId + ", cpuNanos=" + this.cpuNanos + '}';
  }
}
