package optrace.core;

import static java.util.Objects.requireNonNull;
import static optrace.core.config.ProfilerSettings.PROFILER_RECORD_SHAPES;
import static optrace.core.config.ProfilerSettings.PROFILER_RECORD_SHAPES_DEFAULT;
import static optrace.core.config.ProfilerSettings.PROFILER_STATE;
import static optrace.core.config.ProfilerSettings.PROFILER_STATE_DEFAULT;

import optrace.core.config.ConfigProvider;

/** Immutable configuration of a profiling session. */
public final class ProfilerConfig {
  private final ProfilerState state;
  private final boolean reportInputShapes;

  public ProfilerConfig(ProfilerState state, boolean reportInputShapes) {
    this.state = requireNonNull(state, "Profiler state cannot be null");
    this.reportInputShapes = reportInputShapes;
  }

  public ProfilerConfig(ProfilerState state) {
    this(state, false);
  }

  /** Builds the configuration from the process settings. */
  public static ProfilerConfig fromSettings() {
    return fromSettings(ConfigProvider.get());
  }

  public static ProfilerConfig fromSettings(ConfigProvider provider) {
    return new ProfilerConfig(
        ProfilerState.fromName(provider.getString(PROFILER_STATE, PROFILER_STATE_DEFAULT)),
        provider.getBoolean(PROFILER_RECORD_SHAPES, PROFILER_RECORD_SHAPES_DEFAULT));
  }

  public ProfilerState state() {
    return this.state;
  }

  public boolean reportInputShapes() {
    return this.reportInputShapes;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    ProfilerConfig that = (ProfilerConfig) o;
    return this.state == that.state && this.reportInputShapes == that.reportInputShapes;
  }

  @Override
  public int hashCode() {
    return 31 * this.state.hashCode() + (this.reportInputShapes ? 1 : 0);
  }

  @Override
  public String toString() {
    return "ProfilerConfig{state="
        + this.state
        + ", reportInputShapes="
        + this.reportInputShapes
        + '}';
  }
}
