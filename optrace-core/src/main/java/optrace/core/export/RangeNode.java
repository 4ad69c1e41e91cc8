package optrace.core.export;

import static java.util.Collections.unmodifiableList;

import java.util.ArrayList;
import java.util.List;
import javax.annotation.Nullable;
import optrace.core.Event;

/** A range reconstructed from its start and end events, with the ranges nested in it. */
public final class RangeNode {
  private final Event start;
  @Nullable private Event end;
  @Nullable final RangeNode parent;
  final List<RangeNode> children = new ArrayList<>();

  RangeNode(Event start, @Nullable RangeNode parent) {
    this.start = start;
    this.parent = parent;
  }

  void close(Event end) {
    this.end = end;
  }

  boolean isClosed() {
    return this.end != null;
  }

  public String name() {
    return this.start.name();
  }

  public long threadId() {
    return this.start.threadId();
  }

  public Event start() {
    return this.start;
  }

  public Event end() {
    if (this.end == null) {
      throw new IllegalStateException("Range " + name() + " is not closed");
    }
    return this.end;
  }

  /** Returns the CPU duration of the range in microseconds. */
  public double cpuElapsedUs() {
    return this.start.cpuElapsedUs(end());
  }

  public List<RangeNode> children() {
    return unmodifiableList(this.children);
  }

  @Override
  public String toString() {
    return "RangeNode{"
        + name()
        + ", thread="
        + threadId()
        + ", children="
        + this.children.size()
        + '}';
  }
}
