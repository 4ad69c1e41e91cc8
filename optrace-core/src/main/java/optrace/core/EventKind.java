package optrace.core;

public enum EventKind {
  MARK,
  PUSH_RANGE,
  POP_RANGE;
}
