package optrace.instrumentation;

/**
 * Tag of a callback pair in the {@link CallbackRegistry}. Pairs are reference counted and removed
 * per kind, so consumers do not disturb each other.
 */
public enum CallbackKind {
  PROFILER,
  OBSERVER;

  static final int COUNT = values().length;
}
