package optrace.context;

/** Manages context across execution units. */
public interface ContextManager {
  /**
   * Returns the context attached to the current execution unit.
   *
   * @return the attached context; {@link Context#root()} if there is none.
   */
  Context current();

  /**
   * Attaches the given context to the current execution unit.
   *
   * @param context the context to attach.
   * @return a scope to be closed when the context is invalid.
   */
  ContextScope attach(Context context);

  /**
   * Swaps the given context with the one attached to current execution unit.
   *
   * @param context the context to swap.
   * @return the previously attached context; {@link Context#root()} if there was none.
   */
  Context swap(Context context);

  /**
   * Requests use of a custom {@link ContextManager}.
   *
   * <p>Once the manager is first used it cannot be replaced and this method has no effect.
   *
   * @param manager the manager to use.
   */
  static void register(ContextManager manager) {
    ContextProviders.customManager = manager;
  }
}
