package optrace.core.device;

import java.util.function.IntConsumer;

/**
 * Accelerator timing backend used by the device profiling states.
 *
 * <p>Implementations wrap a vendor runtime. They are registered process wide with {@link
 * DeviceBackends#register(DeviceBackend)}.
 */
public interface DeviceBackend {
  /** Tells whether a device is usable. Device profiling states require it. */
  boolean isAvailable();

  /**
   * Records a marker on the current device of the calling thread.
   *
   * @return the marker with the CPU timestamp taken when it was recorded.
   */
  DeviceRecord record();

  /** Blocks until the work queued on the current device completed. */
  void synchronize();

  /**
   * Measures the device time between two markers recorded on the same device.
   *
   * @return the elapsed time in microseconds.
   */
  double elapsedMicros(DeviceMarker start, DeviceMarker end);

  int deviceCount();

  /** Runs the operation with each device in turn made current, passing its id. */
  void onEachDevice(IntConsumer operation);

  /** Opens a named range in the vendor tools. */
  void rangePush(String label);

  /** Closes the last range opened in the vendor tools. */
  void rangePop();

  /** Records an instantaneous named marker in the vendor tools. */
  void mark(String label);
}
