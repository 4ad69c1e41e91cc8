package optrace.core;

import static java.util.Collections.emptyList;
import static java.util.Collections.unmodifiableList;

import java.util.ArrayList;
import java.util.List;
import javax.annotation.Nullable;
import optrace.context.ContextSlots;
import optrace.instrumentation.InputValue;
import optrace.instrumentation.RecordCallback;
import optrace.instrumentation.RecordFunction;

/** Opens and closes ranges in the session visible to the instrumented call. */
final class TracingCallbacks implements RecordCallback {
  static final TracingCallbacks INSTANCE = new TracingCallbacks();

  private TracingCallbacks() {}

  @Override
  public boolean onEnter(RecordFunction fn) {
    ProfilerSession session = enabledSession();
    if (session != null) {
      List<List<Long>> shapes = emptyList();
      if (session.config().reportInputShapes() && !fn.inputs().isEmpty()) {
        shapes = shapesOf(fn.inputs());
      }
      session.pushRange(fn.name(), fn.sequenceNr(), shapes);
    }
    // exit runs even when nothing was opened, and does nothing then
    return true;
  }

  @Override
  public void onExit(RecordFunction fn) {
    ProfilerSession session = enabledSession();
    if (session != null) {
      session.popRange();
    }
  }

  @Nullable
  private static ProfilerSession enabledSession() {
    ProfilerSession session = ContextSlots.get(Profiler.PROFILER_STATE);
    return session != null && session.config().state().isEnabled() ? session : null;
  }

  static List<List<Long>> shapesOf(List<InputValue> inputs) {
    List<List<Long>> shapes = new ArrayList<>(inputs.size());
    for (InputValue input : inputs) {
      shapes.add(input.shape());
    }
    return unmodifiableList(shapes);
  }

  @Override
  public String toString() {
    return "TracingCallbacks";
  }
}
