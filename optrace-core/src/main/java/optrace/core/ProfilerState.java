package optrace.core;

import java.util.Locale;

/** What a session records, and where. Each state supplies the recorder its session uses. */
public enum ProfilerState {
  /** Records nothing. */
  DISABLED {
    @Override
    EventRecorder recorder(ProfilerSession session) {
      return EventRecorder.DISABLED;
    }
  },
  /** Buffers events with CPU timestamps. */
  CPU {
    @Override
    EventRecorder recorder(ProfilerSession session) {
      return new EventListRecorder(session, false);
    }
  },
  /** Buffers events with CPU timestamps and device markers. */
  DEVICE_TIMED {
    @Override
    EventRecorder recorder(ProfilerSession session) {
      return new EventListRecorder(session, true);
    }

    @Override
    public boolean requiresDevice() {
      return true;
    }
  },
  /** Forwards ranges and marks to the vendor tools of the device backend, buffering nothing. */
  DEVICE_MARKERS {
    @Override
    EventRecorder recorder(ProfilerSession session) {
      return new DeviceMarkerRecorder(session.deviceBackend());
    }

    @Override
    public boolean requiresDevice() {
      return true;
    }
  };

  abstract EventRecorder recorder(ProfilerSession session);

  public boolean isEnabled() {
    return this != DISABLED;
  }

  public boolean requiresDevice() {
    return false;
  }

  /**
   * Parses a state name, ignoring case and accepting dashes for underscores, such as {@code
   * device-timed}.
   *
   * @throws ProfilerConfigurationException if the name matches no state.
   */
  public static ProfilerState fromName(String name) {
    String normalized = name.trim().replace('-', '_').toUpperCase(Locale.ROOT);
    for (ProfilerState state : values()) {
      if (state.name().equals(normalized)) {
        return state;
      }
    }
    throw new ProfilerConfigurationException("Unknown profiler state: " + name);
  }
}
