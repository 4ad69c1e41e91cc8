package optrace.core;

import java.util.List;

/** Destination of the marks and ranges of a session. Implementations never throw. */
interface EventRecorder {
  EventRecorder DISABLED =
      new EventRecorder() {
        @Override
        public void mark(String name, boolean includeDevice) {}

        @Override
        public void pushRange(String name, long sequenceNr, List<List<Long>> shapes) {}

        @Override
        public void popRange() {}
      };

  void mark(String name, boolean includeDevice);

  void pushRange(String name, long sequenceNr, List<List<Long>> shapes);

  void popRange();
}
