package optrace.core.config;

/** Configuration keys of the profiler and their defaults. */
public final class ProfilerSettings {
  public static final String PROFILER_STATE = "profiler.state";
  public static final String PROFILER_STATE_DEFAULT = "cpu";

  public static final String PROFILER_RECORD_SHAPES = "profiler.record-shapes";
  public static final boolean PROFILER_RECORD_SHAPES_DEFAULT = false;

  public static final String PROFILER_EVENT_BLOCK_SIZE = "profiler.event-block-size";
  public static final int PROFILER_EVENT_BLOCK_SIZE_DEFAULT = 1024;

  public static final String PROFILER_DEVICE_WARMUP_ITERATIONS =
      "profiler.device.warmup-iterations";
  public static final int PROFILER_DEVICE_WARMUP_ITERATIONS_DEFAULT = 5;

  public static final String PROFILER_TRACE_PID = "profiler.trace.pid";
  public static final String PROFILER_TRACE_PID_DEFAULT = "CPU Functions";

  private ProfilerSettings() {}
}
