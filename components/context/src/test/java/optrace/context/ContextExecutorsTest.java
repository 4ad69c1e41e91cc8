package optrace.context;

import static optrace.context.Context.root;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;

import java.util.concurrent.Callable;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ContextExecutorsTest {
  static final ContextSlot<String> SLOT = ContextSlot.named("executors-test");

  private ExecutorService executor;

  @BeforeEach
  void setUp() {
    this.executor = Executors.newSingleThreadExecutor();
  }

  @AfterEach
  void tearDown() throws InterruptedException {
    this.executor.shutdownNow();
    this.executor.awaitTermination(5, TimeUnit.SECONDS);
    root().swap();
  }

  @Test
  void wrappedCallableSeesSubmitterSlot() throws Exception {
    ContextSlots.push(SLOT, "submitter");
    Callable<String> task = ContextExecutors.wrap(() -> ContextSlots.get(SLOT));
    assertEquals("submitter", this.executor.submit(task).get());
    // the worker thread is back to its own state
    assertNull(this.executor.submit(() -> ContextSlots.get(SLOT)).get());
  }

  @Test
  void propagatingExecutorServiceCapturesAtSubmission() throws Exception {
    ExecutorService propagating = ContextExecutors.propagating(this.executor);
    ContextSlots.push(SLOT, "first");
    String first = propagating.submit(() -> ContextSlots.get(SLOT)).get();
    ContextSlots.push(SLOT, "second");
    String second = propagating.submit(() -> ContextSlots.get(SLOT)).get();
    assertEquals("first", first);
    assertEquals("second", second);
  }

  @Test
  void propagatingExecutorRunsWrappedTasks() throws Exception {
    ContextSlots.push(SLOT, "plain");
    String[] seen = new String[1];
    ContextExecutors.propagating((Executor) this.executor)
        .execute(() -> seen[0] = ContextSlots.get(SLOT));
    this.executor.submit(() -> {}).get();
    assertEquals("plain", seen[0]);
  }

  @Test
  void wrappingIsIdempotent() {
    Runnable task = () -> {};
    Runnable wrapped = ContextExecutors.wrap(task);
    assertSame(wrapped, ContextExecutors.wrap(wrapped));
    ExecutorService propagating = ContextExecutors.propagating(this.executor);
    assertSame(propagating, ContextExecutors.propagating(propagating));
  }
}
