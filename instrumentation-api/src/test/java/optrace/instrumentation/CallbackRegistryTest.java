package optrace.instrumentation;

import static optrace.instrumentation.CallbackKind.OBSERVER;
import static optrace.instrumentation.CallbackKind.PROFILER;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;

import java.util.EnumSet;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class CallbackRegistryTest {
  private static final EnumSet<RecordScope> ALL_SCOPES = EnumSet.allOf(RecordScope.class);

  private CallbackRegistry registry;
  private RecordCallback callback;

  @BeforeEach
  void setUp() {
    this.registry = new CallbackRegistry();
    this.callback = mock(RecordCallback.class);
  }

  @AfterEach
  void tearDown() {
    this.registry.setIncluded(PROFILER, false);
    this.registry.setIncluded(OBSERVER, false);
  }

  @Test
  void lastCancelUninstalls() {
    Subscription outer = this.registry.install(PROFILER, this.callback, false, ALL_SCOPES);
    Subscription inner = this.registry.install(PROFILER, this.callback, false, ALL_SCOPES);
    assertTrue(this.registry.isInstalled(PROFILER));
    inner.cancel();
    assertTrue(this.registry.isInstalled(PROFILER), "outer reference keeps the callbacks");
    // cancelling twice does not release the outer reference
    inner.cancel();
    assertTrue(this.registry.isInstalled(PROFILER));
    outer.cancel();
    assertFalse(this.registry.isInstalled(PROFILER));
  }

  @Test
  void removeIgnoresReferenceCountAndOtherKinds() {
    this.registry.install(PROFILER, this.callback, false, ALL_SCOPES);
    Subscription stale = this.registry.install(PROFILER, this.callback, false, ALL_SCOPES);
    this.registry.install(OBSERVER, mock(RecordCallback.class), false, ALL_SCOPES);
    assertTrue(this.registry.remove(PROFILER));
    assertFalse(this.registry.isInstalled(PROFILER));
    assertTrue(this.registry.isInstalled(OBSERVER));
    assertFalse(this.registry.remove(PROFILER));

    // subscriptions taken before the removal do not release a new installation
    Subscription fresh = this.registry.install(PROFILER, this.callback, false, ALL_SCOPES);
    stale.cancel();
    assertTrue(this.registry.isInstalled(PROFILER));
    fresh.cancel();
    assertFalse(this.registry.isInstalled(PROFILER));
  }

  @Test
  void differentCallbackForInstalledKindIsRejected() {
    this.registry.install(PROFILER, this.callback, false, ALL_SCOPES);
    assertThrows(
        IllegalStateException.class,
        () -> this.registry.install(PROFILER, mock(RecordCallback.class), false, ALL_SCOPES));
  }

  @Test
  void dispatchRequiresInclusionOnCallingThread() throws Exception {
    this.registry.install(PROFILER, this.callback, false, ALL_SCOPES);
    assertTrue(this.registry.active(RecordScope.FUNCTION) == null);
    this.registry.setIncluded(PROFILER, true);
    assertTrue(this.registry.isIncluded(PROFILER));
    assertTrue(this.registry.active(RecordScope.FUNCTION).size() == 1);

    ExecutorService executor = Executors.newSingleThreadExecutor();
    try {
      assertFalse(executor.submit(() -> this.registry.isIncluded(PROFILER)).get());
      assertTrue(executor.submit(() -> this.registry.active(RecordScope.FUNCTION) == null).get());
    } finally {
      executor.shutdownNow();
    }
  }

  @Test
  void scopesFilterDispatch() {
    this.registry.install(
        PROFILER, this.callback, false, EnumSet.of(RecordScope.FUNCTION, RecordScope.USER_SCOPE));
    this.registry.setIncluded(PROFILER, true);
    assertTrue(this.registry.active(RecordScope.FUNCTION) != null);
    assertTrue(this.registry.active(RecordScope.METHOD) == null);
  }

  @Test
  void needsInputsIsSharedByAllReferences() {
    this.registry.install(PROFILER, this.callback, false, ALL_SCOPES);
    this.registry.setIncluded(PROFILER, true);
    assertFalse(this.registry.needsInputs(RecordScope.FUNCTION));
    this.registry.install(PROFILER, this.callback, true, ALL_SCOPES);
    assertTrue(this.registry.needsInputs(RecordScope.FUNCTION));
    this.registry.setIncluded(PROFILER, false);
    assertFalse(this.registry.needsInputs(RecordScope.FUNCTION));
  }
}
