package optrace.instrumentation;

/** Category of an instrumented call site. Callbacks are installed for a set of scopes. */
public enum RecordScope {
  /** Framework operators. */
  FUNCTION,
  /** Methods of interpreted or scripted code. */
  METHOD,
  /** Ranges opened explicitly by user code. */
  USER_SCOPE;
}
