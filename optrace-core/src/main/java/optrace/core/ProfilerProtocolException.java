package optrace.core;

/** Thrown when the session protocol is not followed, such as stopping a session never started. */
public class ProfilerProtocolException extends IllegalStateException {
  public ProfilerProtocolException(String message) {
    super(message);
  }
}
