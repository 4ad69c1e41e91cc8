package optrace.core;

import static java.util.Collections.emptyList;

import java.util.List;

/** Appends events to the event list of the calling thread in the session. */
final class EventListRecorder implements EventRecorder {
  private final ProfilerSession session;
  private final boolean deviceTimed;

  EventListRecorder(ProfilerSession session, boolean deviceTimed) {
    this.session = session;
    this.deviceTimed = deviceTimed;
  }

  @Override
  public void mark(String name, boolean includeDevice) {
    this.session.record(
        EventKind.MARK, name, Event.NO_SEQUENCE_NR, emptyList(), this.deviceTimed && includeDevice);
  }

  @Override
  public void pushRange(String name, long sequenceNr, List<List<Long>> shapes) {
    this.session.record(EventKind.PUSH_RANGE, name, sequenceNr, shapes, this.deviceTimed);
  }

  @Override
  public void popRange() {
    this.session.record(
        EventKind.POP_RANGE, "", Event.NO_SEQUENCE_NR, emptyList(), this.deviceTimed);
  }
}
