package optrace.core;

import static optrace.core.config.ProfilerSettings.PROFILER_DEVICE_WARMUP_ITERATIONS;
import static optrace.core.config.ProfilerSettings.PROFILER_DEVICE_WARMUP_ITERATIONS_DEFAULT;
import static optrace.core.config.ProfilerSettings.PROFILER_EVENT_BLOCK_SIZE;
import static optrace.core.config.ProfilerSettings.PROFILER_EVENT_BLOCK_SIZE_DEFAULT;

import java.util.EnumSet;
import java.util.Set;
import javax.annotation.Nullable;
import optrace.context.ContextSlot;
import optrace.context.ContextSlots;
import optrace.context.ThreadLocalSetting;
import optrace.context.ThreadLocalSettings;
import optrace.core.config.ConfigProvider;
import optrace.core.device.DeviceBackend;
import optrace.core.device.DeviceBackends;
import optrace.core.time.SystemTimeSource;
import optrace.core.time.TimeSource;
import optrace.instrumentation.CallbackKind;
import optrace.instrumentation.CallbackRegistry;
import optrace.instrumentation.RecordFunction;
import optrace.instrumentation.RecordScope;
import optrace.instrumentation.Subscription;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point to start and stop profiling sessions.
 *
 * <p>A started session is pushed into the {@link #PROFILER_STATE} context slot, so it is visible to
 * the calling thread and to the tasks it launches with a captured {@link
 * optrace.context.ContextSnapshot}. Sessions nest: an inner session shadows the outer one until it
 * is stopped.
 *
 * <pre>
 *   Profiler.startSession(new ProfilerConfig(ProfilerState.CPU));
 *   try (RecordFunction ignored = Profiler.recordFunction("forward")) {
 *     // instrumented work
 *   }
 *   ConsolidatedTrace trace = Profiler.stopSession();
 * </pre>
 */
public final class Profiler {
  private static final Logger log = LoggerFactory.getLogger(Profiler.class);

  public static final ContextSlot<ProfilerSession> PROFILER_STATE =
      ContextSlot.named("profiler-state");

  public static final String START_MARK = "__start_profile";
  public static final String STOP_MARK = "__stop_profile";
  public static final String DEVICE_STARTUP_MARK = "__cuda_startup";
  public static final String DEVICE_START_MARK = "__cuda_start_event";

  static final Set<RecordScope> TRACED_SCOPES =
      EnumSet.of(RecordScope.FUNCTION, RecordScope.USER_SCOPE);

  private static final ThreadLocal<NestedSessions> NESTED_SESSIONS =
      ThreadLocal.withInitial(NestedSessions::new);

  private static volatile TimeSource timeSource = SystemTimeSource.INSTANCE;

  static {
    ThreadLocalSettings.register(NestedSessionsSetting.INSTANCE);
  }

  private Profiler() {}

  /**
   * Starts a session on the calling thread, shadowing the current one if any.
   *
   * @param config the configuration of the session.
   * @throws ProfilerConfigurationException if the state requires a device and no device backend is
   *     available. Nothing is changed then.
   */
  public static void startSession(ProfilerConfig config) {
    DeviceBackend backend = DeviceBackends.current();
    ProfilerState state = config.state();
    if (state.requiresDevice() && !backend.isAvailable()) {
      throw new ProfilerConfigurationException(
          "Can't use the " + state + " profiler state: no device backend is available");
    }
    ConfigProvider settings = ConfigProvider.get();
    ProfilerSession session =
        new ProfilerSession(
            config,
            backend,
            timeSource,
            settings.getInteger(PROFILER_EVENT_BLOCK_SIZE, PROFILER_EVENT_BLOCK_SIZE_DEFAULT));
    // fails before anything is pushed when foreign callbacks hold the profiler kind
    NESTED_SESSIONS.get().enter(config.reportInputShapes());
    ContextSlots.push(PROFILER_STATE, session);
    try {
      if (state == ProfilerState.DEVICE_TIMED) {
        synchronizeDevices(
            session,
            backend,
            settings.getInteger(
                PROFILER_DEVICE_WARMUP_ITERATIONS, PROFILER_DEVICE_WARMUP_ITERATIONS_DEFAULT));
      }
    } catch (RuntimeException e) {
      NESTED_SESSIONS.get().exit();
      ContextSlots.pop(PROFILER_STATE);
      throw e;
    }
    session.mark(START_MARK, false);
    log.debug("Started {}", session);
  }

  // warm-up markers first, then one start marker per device to relate its clock to the CPU one
  private static void synchronizeDevices(
      ProfilerSession session, DeviceBackend backend, int warmupIterations) {
    for (int i = 0; i < warmupIterations; i++) {
      backend.onEachDevice(
          device -> {
            session.mark(DEVICE_STARTUP_MARK);
            backend.synchronize();
          });
    }
    backend.onEachDevice(device -> session.mark(DEVICE_START_MARK));
  }

  /**
   * Stops the session visible to the calling thread, revealing the session it shadowed.
   *
   * @return the consolidated events of the session; empty for the device markers state.
   * @throws ProfilerProtocolException if no session is running, or if the visible session was
   *     already stopped by a task it was propagated to. Nothing is changed then.
   */
  public static ConsolidatedTrace stopSession() {
    ProfilerSession session = ContextSlots.get(PROFILER_STATE);
    if (session == null) {
      throw new ProfilerProtocolException("Can't stop the profiler when it's not running");
    }
    ProfilerState state = session.config().state();
    if (!state.isEnabled()) {
      ContextSlots.pop(PROFILER_STATE);
      NESTED_SESSIONS.get().exit();
      throw new ProfilerProtocolException("Can't stop the profiler when it's not running");
    }
    if (!session.markStopped()) {
      throw new ProfilerProtocolException("Can't stop a profiler session that was already stopped");
    }
    ContextSlots.pop(PROFILER_STATE);
    NESTED_SESSIONS.get().exit();
    log.debug("Stopping {}", session);
    if (state == ProfilerState.DEVICE_MARKERS) {
      return ConsolidatedTrace.empty();
    }
    session.mark(STOP_MARK);
    return session.consolidate();
  }

  /** Tells whether an enabled session is visible to the calling thread. */
  public static boolean isSessionActive() {
    ProfilerSession session = ContextSlots.get(PROFILER_STATE);
    return session != null && session.config().state().isEnabled();
  }

  /** Returns the session visible to the calling thread, {@code null} if there is none. */
  @Nullable
  public static ProfilerSession currentSession() {
    return ContextSlots.get(PROFILER_STATE);
  }

  /** Records a mark in the session visible to the calling thread, if any. */
  public static void mark(String name) {
    ProfilerSession session = ContextSlots.get(PROFILER_STATE);
    if (session != null) {
      session.mark(name);
    }
  }

  /**
   * Opens a user range, closed with the returned record.
   *
   * @param name the range name.
   * @return the record to close.
   */
  public static RecordFunction recordFunction(String name) {
    return RecordFunction.start(RecordScope.USER_SCOPE, name);
  }

  public static void registerDeviceBackend(DeviceBackend backend) {
    DeviceBackends.register(backend);
  }

  static void timeSource(TimeSource source) {
    timeSource = source;
  }

  static int nestedDepth() {
    return NESTED_SESSIONS.get().depth;
  }

  /** Sessions wanting the tracing callbacks on the calling thread. */
  static final class NestedSessions {
    private int depth;
    @Nullable private Subscription subscription;

    void enter(boolean needsInputs) {
      if (this.depth == 0) {
        CallbackRegistry registry = CallbackRegistry.get();
        this.subscription =
            registry.install(
                CallbackKind.PROFILER, TracingCallbacks.INSTANCE, needsInputs, TRACED_SCOPES);
        registry.setIncluded(CallbackKind.PROFILER, true);
      }
      this.depth++;
    }

    void exit() {
      if (this.depth == 0) {
        log.debug("Unbalanced profiler session exit ignored");
        return;
      }
      if (--this.depth == 0) {
        CallbackRegistry.get().setIncluded(CallbackKind.PROFILER, false);
        if (this.subscription != null) {
          this.subscription.cancel();
          this.subscription = null;
        }
      }
    }
  }

  /** Installs the tracing callbacks on threads running tasks launched during a session. */
  static final class NestedSessionsSetting implements ThreadLocalSetting<Boolean> {
    static final NestedSessionsSetting INSTANCE = new NestedSessionsSetting();

    private static final Runnable NOTHING_TO_UNDO = () -> {};

    @Override
    public Boolean capture() {
      return NESTED_SESSIONS.get().depth > 0;
    }

    @Override
    public Runnable apply(Boolean active) {
      if (!active) {
        return NOTHING_TO_UNDO;
      }
      NestedSessions sessions = NESTED_SESSIONS.get();
      sessions.enter(false);
      return sessions::exit;
    }

    @Override
    public String toString() {
      return "NestedSessionsSetting";
    }
  }
}
