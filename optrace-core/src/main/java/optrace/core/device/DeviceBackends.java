package optrace.core.device;

import static java.util.Objects.requireNonNull;

import java.util.function.IntConsumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Holds the process wide {@link DeviceBackend}. */
public final class DeviceBackends {
  private static final Logger log = LoggerFactory.getLogger(DeviceBackends.class);

  private static volatile DeviceBackend current = NoDeviceBackend.INSTANCE;

  private DeviceBackends() {}

  /**
   * Registers the device backend, replacing the current one.
   *
   * @param backend the backend to use for new sessions.
   */
  public static void register(DeviceBackend backend) {
    requireNonNull(backend, "Device backend cannot be null");
    log.debug("Registering device backend {}", backend);
    current = backend;
  }

  /** Restores the unavailable backend. */
  public static void reset() {
    current = NoDeviceBackend.INSTANCE;
  }

  public static DeviceBackend current() {
    return current;
  }

  /** Returns the backend used when no device is available. */
  public static DeviceBackend none() {
    return NoDeviceBackend.INSTANCE;
  }

  static final class NoDeviceBackend implements DeviceBackend {
    static final DeviceBackend INSTANCE = new NoDeviceBackend();

    @Override
    public boolean isAvailable() {
      return false;
    }

    @Override
    public DeviceRecord record() {
      throw unavailable();
    }

    @Override
    public void synchronize() {
      throw unavailable();
    }

    @Override
    public double elapsedMicros(DeviceMarker start, DeviceMarker end) {
      throw unavailable();
    }

    @Override
    public int deviceCount() {
      return 0;
    }

    @Override
    public void onEachDevice(IntConsumer operation) {}

    @Override
    public void rangePush(String label) {
      throw unavailable();
    }

    @Override
    public void rangePop() {
      throw unavailable();
    }

    @Override
    public void mark(String label) {
      throw unavailable();
    }

    private static UnsupportedOperationException unavailable() {
      return new UnsupportedOperationException("No device backend registered");
    }

    @Override
    public String toString() {
      return "NoDeviceBackend";
    }
  }
}
