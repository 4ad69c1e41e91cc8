package optrace.context;

import static java.util.Objects.requireNonNull;

import javax.annotation.Nullable;
import javax.annotation.ParametersAreNonnullByDefault;

/** {@link Context} containing no values. */
@ParametersAreNonnullByDefault
final class EmptyContext implements Context {
  static final Context INSTANCE = new EmptyContext();

  @Override
  @Nullable
  public <T> T get(ContextSlot<T> slot) {
    requireNonNull(slot, "Context slot cannot be null");
    return null;
  }

  @Override
  public <T> Context push(ContextSlot<T> slot, T value) {
    requireNonNull(slot, "Context slot cannot be null");
    return new SingletonContext(slot.index, SlotEntry.push(null, value));
  }

  @Override
  public <T> Context pop(ContextSlot<T> slot) {
    requireNonNull(slot, "Context slot cannot be null");
    throw SlotEntry.nothingInstalled(slot);
  }

  @Override
  public int depth(ContextSlot<?> slot) {
    return 0;
  }

  @Override
  public String toString() {
    return "EmptyContext{}";
  }
}
