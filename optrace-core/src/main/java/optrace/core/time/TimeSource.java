package optrace.core.time;

/** Source of CPU timestamps for recorded events. */
public interface TimeSource {
  /** Monotonic timestamp in nanoseconds, only meaningful relative to other ticks. */
  long getNanoTicks();
}
