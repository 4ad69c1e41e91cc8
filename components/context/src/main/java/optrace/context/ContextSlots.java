package optrace.context;

import static optrace.context.ContextProviders.manager;

import javax.annotation.Nullable;

/**
 * Push, pop and read slot values of the current execution unit.
 *
 * <p>Example of usage:
 *
 * <pre>
 *   ContextSlots.push(SESSION, session);
 *   try {
 *     // ... ContextSlots.get(SESSION) returns session, here and in tasks launched from here
 *   } finally {
 *     ContextSlots.pop(SESSION);
 *   }
 * </pre>
 */
public final class ContextSlots {
  private ContextSlots() {}

  /**
   * Installs a value for the slot on the current execution unit, shadowing the previous one.
   *
   * @param slot the slot to push into.
   * @param value the value to install.
   */
  public static <T> void push(ContextSlot<T> slot, T value) {
    ContextManager manager = manager();
    manager.swap(manager.current().push(slot, value));
  }

  /**
   * Removes the value installed for the slot on the current execution unit, revealing the value it
   * shadowed.
   *
   * @param slot the slot to pop.
   * @return the removed value.
   * @throws IllegalStateException if nothing is installed in the slot.
   */
  public static <T> T pop(ContextSlot<T> slot) {
    ContextManager manager = manager();
    Context current = manager.current();
    T value = current.get(slot);
    // pop() throws before anything is swapped
    manager.swap(current.pop(slot));
    return value;
  }

  /**
   * Reads the value installed for the slot on the current execution unit.
   *
   * @param slot the slot to read.
   * @return the installed value; {@code null} if there is none.
   */
  @Nullable
  public static <T> T get(ContextSlot<T> slot) {
    return manager().current().get(slot);
  }
}
