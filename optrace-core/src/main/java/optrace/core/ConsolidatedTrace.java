package optrace.core;

import static java.util.Collections.emptyList;
import static java.util.Collections.unmodifiableList;
import static java.util.Collections.unmodifiableSortedMap;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/** Events of a finished session, grouped per thread and ordered by thread id. */
public final class ConsolidatedTrace {
  private static final ConsolidatedTrace EMPTY =
      new ConsolidatedTrace(new TreeMap<Long, List<Event>>());

  private final SortedMap<Long, List<Event>> threads;

  ConsolidatedTrace(SortedMap<Long, List<Event>> threads) {
    this.threads = unmodifiableSortedMap(threads);
  }

  public static ConsolidatedTrace empty() {
    return EMPTY;
  }

  /** Builds a trace from events of any threads, kept in the given order within each thread. */
  public static ConsolidatedTrace of(Iterable<Event> events) {
    SortedMap<Long, List<Event>> threads = new TreeMap<>();
    for (Event event : events) {
      threads.computeIfAbsent(event.threadId(), id -> new ArrayList<>()).add(event);
    }
    for (Map.Entry<Long, List<Event>> entry : threads.entrySet()) {
      entry.setValue(unmodifiableList(entry.getValue()));
    }
    return new ConsolidatedTrace(threads);
  }

  /** Returns the events per thread id, in ascending thread id order. */
  public SortedMap<Long, List<Event>> threads() {
    return this.threads;
  }

  public List<Event> events(long threadId) {
    List<Event> events = this.threads.get(threadId);
    return events == null ? emptyList() : events;
  }

  /** Returns every event, thread after thread. */
  public List<Event> allEvents() {
    List<Event> all = new ArrayList<>(eventCount());
    for (List<Event> events : this.threads.values()) {
      all.addAll(events);
    }
    return all;
  }

  public int eventCount() {
    int count = 0;
    for (List<Event> events : this.threads.values()) {
      count += events.size();
    }
    return count;
  }

  public boolean isEmpty() {
    return this.threads.isEmpty();
  }

  @Override
  public String toString() {
    return "ConsolidatedTrace{threads=" + this.threads.size() + ", events=" + eventCount() + '}';
  }
}
