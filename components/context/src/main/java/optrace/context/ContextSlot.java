package optrace.context;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * {@link Context} slot holding values of type {@link T}.
 *
 * <p>Slots are compared by identity rather than by name. Each functional area should create its slot
 * once, as a constant, and share it: the slot index is used to address the context storage.
 */
public final class ContextSlot<T> {
  private static final AtomicInteger NEXT_INDEX = new AtomicInteger(0);

  /** The slot name, for debugging purpose only. */
  private final String name;

  /** The slot unique index, related to {@link IndexedContext} storage. */
  final int index;

  private ContextSlot(String name) {
    this.name = name;
    this.index = NEXT_INDEX.getAndIncrement();
  }

  /**
   * Creates a new slot with the given name.
   *
   * @param name the slot name, for debugging purpose only.
   * @return the newly created unique slot.
   */
  public static <T> ContextSlot<T> named(String name) {
    return new ContextSlot<>(name);
  }

  @Override
  public int hashCode() {
    return this.index;
  }

  // identity equality

  @Override
  public String toString() {
    return this.name;
  }
}
