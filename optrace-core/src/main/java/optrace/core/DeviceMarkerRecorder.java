package optrace.core;

import java.util.List;
import optrace.core.device.DeviceBackend;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Forwards ranges and marks to the vendor tools of the device backend. */
final class DeviceMarkerRecorder implements EventRecorder {
  private static final Logger log = LoggerFactory.getLogger(DeviceMarkerRecorder.class);

  private final DeviceBackend backend;

  DeviceMarkerRecorder(DeviceBackend backend) {
    this.backend = backend;
  }

  /**
   * Formats the label of a pushed range, such as {@code mul, seq = 3, sizes = [[2, 3], []]}.
   *
   * @param name the range name.
   * @param sequenceNr the sequence number; omitted when negative.
   * @param shapes the argument shapes; omitted when empty.
   * @return the label.
   */
  static String rangeLabel(String name, long sequenceNr, List<List<Long>> shapes) {
    StringBuilder label = new StringBuilder(name);
    if (sequenceNr >= 0) {
      label.append(", seq = ").append(sequenceNr);
    }
    if (!shapes.isEmpty()) {
      label.append(", sizes = ").append(shapes);
    }
    return label.toString();
  }

  @Override
  public void mark(String name, boolean includeDevice) {
    try {
      this.backend.mark(name);
    } catch (RuntimeException e) {
      log.debug("Failed to forward mark {} to the device backend", name, e);
    }
  }

  @Override
  public void pushRange(String name, long sequenceNr, List<List<Long>> shapes) {
    try {
      this.backend.rangePush(rangeLabel(name, sequenceNr, shapes));
    } catch (RuntimeException e) {
      log.debug("Failed to forward range {} to the device backend", name, e);
    }
  }

  @Override
  public void popRange() {
    try {
      this.backend.rangePop();
    } catch (RuntimeException e) {
      log.debug("Failed to forward range end to the device backend", e);
    }
  }
}
