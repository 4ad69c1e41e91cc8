package optrace.core.time;

import java.util.concurrent.atomic.AtomicLong;

public class ControllableTimeSource implements TimeSource {
  private final AtomicLong currentTime = new AtomicLong();

  public void advance(long nanosIncrement) {
    currentTime.addAndGet(nanosIncrement);
  }

  public void set(long nanos) {
    currentTime.set(nanos);
  }

  @Override
  public long getNanoTicks() {
    return currentTime.get();
  }
}
