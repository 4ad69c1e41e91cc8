package optrace.context;

import static optrace.context.ContextProviders.manager;

import javax.annotation.Nullable;

/**
 * Immutable slot store scoped to an execution unit.
 *
 * <p>The context of the current execution unit is retrieved with {@link #current()}. A context
 * instance can be made current with {@link #attach()} or {@link #swap()}. When nothing was attached,
 * {@link #current()} returns the {@link #root()} context.
 *
 * <p>Values are stored per {@link ContextSlot}. Pushing a value into a slot shadows the value that
 * was there; popping it reveals the shadowed value again. Both operations create a new immutable
 * {@link Context} instance, so a context captured by another execution unit is never affected by
 * later pushes or pops.
 *
 * <p>{@link Context} instances are thread safe as they are immutable, but the values they hold may
 * themselves be mutable.
 *
 * @see ContextSlot
 * @see ContextSlots
 */
public interface Context {
  /**
   * Returns the root context.
   *
   * @return the initial context that all contexts extend.
   */
  static Context root() {
    return EmptyContext.INSTANCE;
  }

  /**
   * Returns the context attached to the current execution unit.
   *
   * @return the attached context; {@link #root()} if there is none.
   */
  static Context current() {
    return manager().current();
  }

  /**
   * Attaches this context to the current execution unit.
   *
   * @return a scope to be closed when the context is invalid.
   */
  default ContextScope attach() {
    return manager().attach(this);
  }

  /**
   * Swaps this context with the one attached to current execution unit.
   *
   * @return the previously attached context; {@link #root()} if there was none.
   */
  default Context swap() {
    return manager().swap(this);
  }

  /**
   * Gets the value currently visible in the given slot.
   *
   * @param <T> the type of the value.
   * @param slot the slot to read.
   * @return the last pushed value; {@code null} if there is none.
   */
  @Nullable
  <T> T get(ContextSlot<T> slot);

  /**
   * Creates a copy of this context with the given value pushed into the slot.
   *
   * @param <T> the type of the value.
   * @param slot the slot to push into.
   * @param value the value to push, shadowing the current one.
   * @return a new context where the slot holds the value.
   * @throws NullPointerException if the slot or the value is {@code null}.
   */
  <T> Context push(ContextSlot<T> slot, T value);

  /**
   * Creates a copy of this context with the last value of the slot removed.
   *
   * @param <T> the type of the value.
   * @param slot the slot to pop.
   * @return a new context where the previously shadowed value, if any, is visible again.
   * @throws IllegalStateException if nothing is installed in the slot.
   */
  <T> Context pop(ContextSlot<T> slot);

  /**
   * Returns how many values are stacked in the given slot.
   *
   * @param slot the slot to inspect.
   * @return the number of pushed values, shadowed ones included.
   */
  int depth(ContextSlot<?> slot);
}
