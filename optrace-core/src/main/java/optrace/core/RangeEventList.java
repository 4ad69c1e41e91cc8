package optrace.core;

import java.util.ArrayList;
import java.util.List;

/**
 * Append-only event buffer of one thread in one session.
 *
 * <p>Only the owning thread appends, without locking. Events are stored in fixed size blocks so
 * appending never copies. The size is published with a volatile write after the event is stored,
 * so a consolidating thread reading {@link #size()} first sees every event up to that size.
 */
public final class RangeEventList {
  private final int blockSize;
  private final List<Event[]> blocks = new ArrayList<>();
  private Event[] tail;
  private int tailSize;
  private volatile int size;

  public RangeEventList(int blockSize) {
    if (blockSize <= 0) {
      throw new IllegalArgumentException("Block size must be positive: " + blockSize);
    }
    this.blockSize = blockSize;
  }

  /** Appends an event. Must only be called by the owning thread. */
  public void append(Event event) {
    if (this.tail == null || this.tailSize == this.blockSize) {
      this.tail = new Event[this.blockSize];
      this.blocks.add(this.tail);
      this.tailSize = 0;
    }
    this.tail[this.tailSize++] = event;
    this.size = this.size + 1;
  }

  public int size() {
    return this.size;
  }

  int blockCount() {
    return this.blocks.size();
  }

  /** Copies the published events, in append order. */
  public List<Event> snapshot() {
    int count = this.size;
    List<Event> events = new ArrayList<>(count);
    for (int i = 0; i < count; i++) {
      events.add(this.blocks.get(i / this.blockSize)[i % this.blockSize]);
    }
    return events;
  }

  /** Drops every event. The owning thread must have stopped appending. */
  public void clear() {
    this.blocks.clear();
    this.tail = null;
    this.tailSize = 0;
    this.size = 0;
  }
}
