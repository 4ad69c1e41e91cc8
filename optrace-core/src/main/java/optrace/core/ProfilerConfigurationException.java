package optrace.core;

/** Thrown when a session is started with a configuration the process cannot honor. */
public class ProfilerConfigurationException extends IllegalStateException {
  public ProfilerConfigurationException(String message) {
    super(message);
  }
}
