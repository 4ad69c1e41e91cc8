package optrace.context;

import static java.util.Objects.requireNonNull;

import java.util.Objects;
import javax.annotation.Nullable;

/** A value pushed into a {@link ContextSlot}, linked to the value it shadows. */
final class SlotEntry {
  final Object value;
  @Nullable final SlotEntry shadowed;

  private SlotEntry(Object value, @Nullable SlotEntry shadowed) {
    this.value = value;
    this.shadowed = shadowed;
  }

  static SlotEntry push(@Nullable SlotEntry top, Object value) {
    requireNonNull(value, "Context value cannot be null");
    return new SlotEntry(value, top);
  }

  @Nullable
  static Object valueOf(@Nullable SlotEntry entry) {
    return entry == null ? null : entry.value;
  }

  static IllegalStateException nothingInstalled(ContextSlot<?> slot) {
    return new IllegalStateException("Nothing is installed in context slot " + slot);
  }

  int depth() {
    int depth = 1;
    for (SlotEntry e = this.shadowed; e != null; e = e.shadowed) {
      depth++;
    }
    return depth;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    SlotEntry that = (SlotEntry) o;
    return this.value.equals(that.value) && Objects.equals(this.shadowed, that.shadowed);
  }

  @Override
  public int hashCode() {
    int result = 31;
    result = 31 * result + this.value.hashCode();
    result = 31 * result + Objects.hashCode(this.shadowed);
    return result;
  }

  @Override
  public String toString() {
    if (this.shadowed == null) {
      return String.valueOf(this.value);
    }
    return this.value + " (shadows " + this.shadowed.depth() + ")";
  }
}
