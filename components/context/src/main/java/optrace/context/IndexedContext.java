package optrace.context;

import static java.lang.Math.max;
import static java.util.Arrays.copyOfRange;
import static java.util.Objects.requireNonNull;

import java.util.Arrays;
import javax.annotation.Nullable;
import javax.annotation.ParametersAreNonnullByDefault;

/** {@link Context} with many slots in use, addressed by slot index. */
@ParametersAreNonnullByDefault
final class IndexedContext implements Context {
  final Object[] store;

  IndexedContext(Object[] store) {
    this.store = store;
  }

  @Nullable
  private SlotEntry entry(ContextSlot<?> slot) {
    requireNonNull(slot, "Context slot cannot be null");
    int index = slot.index;
    return index < this.store.length ? (SlotEntry) this.store[index] : null;
  }

  @Override
  @Nullable
  @SuppressWarnings("unchecked")
  public <T> T get(ContextSlot<T> slot) {
    return (T) SlotEntry.valueOf(entry(slot));
  }

  @Override
  public <T> Context push(ContextSlot<T> slot, T value) {
    SlotEntry top = SlotEntry.push(entry(slot), value);
    int index = slot.index;
    Object[] newStore = copyOfRange(this.store, 0, max(this.store.length, index + 1));
    newStore[index] = top;
    return new IndexedContext(newStore);
  }

  @Override
  public <T> Context pop(ContextSlot<T> slot) {
    SlotEntry top = entry(slot);
    if (top == null) {
      throw SlotEntry.nothingInstalled(slot);
    }
    Object[] newStore = this.store.clone();
    newStore[slot.index] = top.shadowed;
    return compact(newStore);
  }

  @Override
  public int depth(ContextSlot<?> slot) {
    SlotEntry top = entry(slot);
    return top == null ? 0 : top.depth();
  }

  /** Falls back to the smaller representations once slots are emptied. */
  private static Context compact(Object[] store) {
    int used = -1;
    for (int i = 0; i < store.length; i++) {
      if (store[i] != null) {
        if (used >= 0) {
          return new IndexedContext(store);
        }
        used = i;
      }
    }
    if (used < 0) {
      return EmptyContext.INSTANCE;
    }
    return new SingletonContext(used, (SlotEntry) store[used]);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    IndexedContext that = (IndexedContext) o;
    return Arrays.equals(this.store, that.store);
  }

  @Override
  public int hashCode() {
    int result = 31;
    result = 31 * result + Arrays.hashCode(this.store);
    return result;
  }

  @Override
  public String toString() {
    return "IndexedContext{store=" + Arrays.toString(this.store) + '}';
  }
}
