package optrace.context;

/**
 * Controls the validity of a context installed on an execution unit.
 *
 * <p>Closing the scope reverts the execution unit to the state it had before the context was
 * installed. Closing is idempotent.
 */
public interface ContextScope extends AutoCloseable {
  /** Returns the context installed by this scope. */
  Context context();

  /** Uninstalls the context from the execution unit. */
  @Override
  void close();
}
