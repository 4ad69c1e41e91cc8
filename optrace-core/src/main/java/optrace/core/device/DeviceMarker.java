package optrace.core.device;

/**
 * Opaque timestamp token recorded on an accelerator clock. Markers are only comparable to markers
 * of the same device, through {@link DeviceBackend#elapsedMicros(DeviceMarker, DeviceMarker)}.
 *
 * <p>Backends may complete the device side of a marker asynchronously; resolving it is their
 * concern and happens at most once.
 */
public interface DeviceMarker {
  /** Returns the device the marker was recorded on. */
  int deviceId();
}
