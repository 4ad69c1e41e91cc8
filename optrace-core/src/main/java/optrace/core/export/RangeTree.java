package optrace.core.export;

import static java.util.Collections.emptyList;
import static java.util.Collections.unmodifiableList;
import static java.util.Collections.unmodifiableSortedMap;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;
import optrace.core.ConsolidatedTrace;
import optrace.core.Event;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Nested ranges of a {@link ConsolidatedTrace}, per thread.
 *
 * <p>Range ends are matched to range starts of the same thread in last-in first-out order. An end
 * without a start is skipped. A start never ended is dropped, its closed children taking its place
 * in its parent.
 */
public final class RangeTree {
  private static final Logger log = LoggerFactory.getLogger(RangeTree.class);

  private final SortedMap<Long, List<RangeNode>> roots;

  private RangeTree(SortedMap<Long, List<RangeNode>> roots) {
    this.roots = unmodifiableSortedMap(roots);
  }

  public static RangeTree build(ConsolidatedTrace trace) {
    SortedMap<Long, List<RangeNode>> roots = new TreeMap<>();
    for (Map.Entry<Long, List<Event>> thread : trace.threads().entrySet()) {
      List<RangeNode> threadRoots = buildThread(thread.getKey(), thread.getValue());
      if (!threadRoots.isEmpty()) {
        roots.put(thread.getKey(), unmodifiableList(threadRoots));
      }
    }
    return new RangeTree(roots);
  }

  private static List<RangeNode> buildThread(long threadId, List<Event> events) {
    List<RangeNode> roots = new ArrayList<>();
    Deque<RangeNode> open = new ArrayDeque<>();
    for (Event event : events) {
      switch (event.kind()) {
        case PUSH_RANGE:
          RangeNode parent = open.peek();
          RangeNode node = new RangeNode(event, parent);
          (parent == null ? roots : parent.children).add(node);
          open.push(node);
          break;
        case POP_RANGE:
          if (open.isEmpty()) {
            log.debug("Skipping unmatched range end on thread {}", threadId);
          } else {
            open.pop().close(event);
          }
          break;
        default:
          break;
      }
    }
    // innermost first, so the children spliced into a parent are already closed
    while (!open.isEmpty()) {
      RangeNode unclosed = open.pop();
      log.debug("Dropping range {} never ended on thread {}", unclosed.name(), threadId);
      List<RangeNode> siblings = unclosed.parent == null ? roots : unclosed.parent.children;
      int index = siblings.indexOf(unclosed);
      siblings.remove(index);
      siblings.addAll(index, unclosed.children);
    }
    return roots;
  }

  /** Returns the ids of the threads with ranges, in ascending order. */
  public List<Long> threadIds() {
    return new ArrayList<>(this.roots.keySet());
  }

  /** Returns the outermost ranges of the thread, in start order. */
  public List<RangeNode> roots(long threadId) {
    List<RangeNode> threadRoots = this.roots.get(threadId);
    return threadRoots == null ? emptyList() : threadRoots;
  }

  /** Returns every range, thread after thread, each parent before its children. */
  public List<RangeNode> ranges() {
    List<RangeNode> ranges = new ArrayList<>();
    for (List<RangeNode> threadRoots : this.roots.values()) {
      for (RangeNode root : threadRoots) {
        collect(root, ranges);
      }
    }
    return ranges;
  }

  private static void collect(RangeNode node, List<RangeNode> ranges) {
    ranges.add(node);
    for (RangeNode child : node.children) {
      collect(child, ranges);
    }
  }

  public boolean isEmpty() {
    return this.roots.isEmpty();
  }
}
