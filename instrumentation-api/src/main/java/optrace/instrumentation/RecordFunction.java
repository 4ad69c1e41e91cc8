package optrace.instrumentation;

import static java.util.Collections.emptyList;
import static java.util.Collections.unmodifiableList;

import java.util.ArrayList;
import java.util.List;

/**
 * Hook point reported by instrumented call sites.
 *
 * <pre>
 *   try (RecordFunction fn = RecordFunction.start(RecordScope.FUNCTION, "add", seqNr, inputs)) {
 *     // instrumented work
 *   }
 * </pre>
 *
 * <p>Starting a record invokes the entry callbacks installed in the {@link CallbackRegistry} for
 * its scope on the calling thread. Closing it invokes the exit callbacks of the entries that asked
 * for it, in reverse order. When no callback fires, a shared inactive record is returned.
 */
public final class RecordFunction implements AutoCloseable {
  public static final long NO_SEQUENCE_NR = -1;

  private static final RecordFunction INACTIVE =
      new RecordFunction(RecordScope.FUNCTION, "", NO_SEQUENCE_NR, emptyList(), 0);

  private final RecordScope scope;
  private final String name;
  private final long sequenceNr;
  private final List<InputValue> inputs;
  private final long threadId;
  private List<CallbackRegistry.Registration> entered;

  private RecordFunction(
      RecordScope scope, String name, long sequenceNr, List<InputValue> inputs, long threadId) {
    this.scope = scope;
    this.name = name;
    this.sequenceNr = sequenceNr;
    this.inputs = inputs;
    this.threadId = threadId;
  }

  public static RecordFunction start(RecordScope scope, String name) {
    return start(scope, name, NO_SEQUENCE_NR, emptyList());
  }

  /**
   * Starts recording an instrumented call.
   *
   * @param scope the category of the call site.
   * @param name the operation name.
   * @param sequenceNr the sequence number of the call; {@link #NO_SEQUENCE_NR} if there is none.
   * @param inputs the argument descriptors, only kept when a firing callback reads them.
   * @return the record to close when the call ends.
   */
  public static RecordFunction start(
      RecordScope scope, String name, long sequenceNr, List<InputValue> inputs) {
    CallbackRegistry registry = CallbackRegistry.get();
    List<CallbackRegistry.Registration> active = registry.active(scope);
    if (active == null) {
      return INACTIVE;
    }
    List<InputValue> kept = emptyList();
    if (!inputs.isEmpty() && registry.needsInputs(scope)) {
      kept = unmodifiableList(new ArrayList<>(inputs));
    }
    RecordFunction fn = new RecordFunction(scope, name, sequenceNr, kept, ThreadIds.current());
    List<CallbackRegistry.Registration> entered = new ArrayList<>(active.size());
    for (CallbackRegistry.Registration registration : active) {
      if (registration.enter(fn)) {
        entered.add(registration);
      }
    }
    fn.entered = entered;
    return fn;
  }

  public RecordScope scope() {
    return this.scope;
  }

  public String name() {
    return this.name;
  }

  /** Returns the sequence number; {@link #NO_SEQUENCE_NR} when absent. */
  public long sequenceNr() {
    return this.sequenceNr;
  }

  public List<InputValue> inputs() {
    return this.inputs;
  }

  public long threadId() {
    return this.threadId;
  }

  public boolean isActive() {
    return this != INACTIVE;
  }

  /** Ends the call. Exit callbacks run once, on the first call. */
  public void end() {
    List<CallbackRegistry.Registration> entered = this.entered;
    if (entered == null) {
      return;
    }
    this.entered = null;
    for (int i = entered.size() - 1; i >= 0; i--) {
      entered.get(i).exit(this);
    }
  }

  @Override
  public void close() {
    end();
  }

  @Override
  public String toString() {
    return "RecordFunction{" + this.scope + ' ' + this.name + ", seq=" + this.sequenceNr + '}';
  }
}
