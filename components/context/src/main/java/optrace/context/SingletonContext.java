package optrace.context;

import static java.lang.Math.max;
import static java.util.Objects.requireNonNull;

import javax.annotation.Nullable;
import javax.annotation.ParametersAreNonnullByDefault;

/** {@link Context} with a single slot in use. */
@ParametersAreNonnullByDefault
final class SingletonContext implements Context {
  final int index;
  final SlotEntry entry;

  SingletonContext(int index, SlotEntry entry) {
    this.index = index;
    this.entry = entry;
  }

  @Override
  @Nullable
  @SuppressWarnings("unchecked")
  public <T> T get(ContextSlot<T> slot) {
    requireNonNull(slot, "Context slot cannot be null");
    return this.index == slot.index ? (T) this.entry.value : null;
  }

  @Override
  public <T> Context push(ContextSlot<T> slot, T value) {
    requireNonNull(slot, "Context slot cannot be null");
    if (this.index == slot.index) {
      return new SingletonContext(this.index, SlotEntry.push(this.entry, value));
    }
    Object[] store = new Object[max(this.index, slot.index) + 1];
    store[this.index] = this.entry;
    store[slot.index] = SlotEntry.push(null, value);
    return new IndexedContext(store);
  }

  @Override
  public <T> Context pop(ContextSlot<T> slot) {
    requireNonNull(slot, "Context slot cannot be null");
    if (this.index != slot.index) {
      throw SlotEntry.nothingInstalled(slot);
    }
    SlotEntry shadowed = this.entry.shadowed;
    return shadowed == null ? EmptyContext.INSTANCE : new SingletonContext(this.index, shadowed);
  }

  @Override
  public int depth(ContextSlot<?> slot) {
    return this.index == slot.index ? this.entry.depth() : 0;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    SingletonContext that = (SingletonContext) o;
    return this.index == that.index && this.entry.equals(that.entry);
  }

  @Override
  public int hashCode() {
    int result = 31;
    result = 31 * result + this.index;
    result = 31 * result + this.entry.hashCode();
    return result;
  }

  @Override
  public String toString() {
    return "SingletonContext{" + "index=" + this.index + ", entry=" + this.entry + '}';
  }
}
