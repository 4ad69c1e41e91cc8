package optrace.instrumentation;

import java.util.concurrent.atomic.AtomicLong;

/** Small sequential thread identifiers, assigned on first use and stable for the thread life. */
public final class ThreadIds {
  private static final AtomicLong NEXT_ID = new AtomicLong(1);

  private static final ThreadLocal<Long> CURRENT =
      ThreadLocal.withInitial(NEXT_ID::getAndIncrement);

  private ThreadIds() {}

  public static long current() {
    return CURRENT.get();
  }
}
