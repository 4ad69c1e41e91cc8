package optrace.core;

/** Thrown when a device duration is requested between events that cannot be compared. */
public class MeasurementException extends IllegalStateException {
  public MeasurementException(String message) {
    super(message);
  }
}
