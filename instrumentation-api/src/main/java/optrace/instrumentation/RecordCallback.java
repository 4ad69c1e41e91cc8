package optrace.instrumentation;

/** Pair of callbacks invoked around every instrumented call of the scopes it is installed for. */
public interface RecordCallback {
  /**
   * Called when an instrumented call starts.
   *
   * @param fn the starting call.
   * @return {@code true} to have {@link #onExit(RecordFunction)} called when the call ends.
   */
  boolean onEnter(RecordFunction fn);

  /**
   * Called when an instrumented call ends, only if {@link #onEnter(RecordFunction)} returned
   * {@code true} for it.
   *
   * @param fn the ending call.
   */
  void onExit(RecordFunction fn);
}
