package optrace.context;

/**
 * Thread local state, other than the {@link Context}, that follows execution units across thread
 * hand-offs.
 *
 * <p>A {@link ContextSnapshot} captures the value of every registered setting together with the
 * context, and re-applies them on the thread restoring the snapshot.
 *
 * @param <V> the type of the captured value.
 * @see ThreadLocalSettings#register(ThreadLocalSetting)
 */
public interface ThreadLocalSetting<V> {
  /**
   * Reads the setting on the calling thread.
   *
   * @return the value to hand over to another thread.
   */
  V capture();

  /**
   * Applies a captured value on the calling thread.
   *
   * @param value a value previously returned by {@link #capture()}, possibly on another thread.
   * @return the action reverting the calling thread to its state before this call.
   */
  Runnable apply(V value);
}
