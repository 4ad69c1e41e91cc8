package optrace.context;

import static optrace.context.ContextProviders.manager;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Copy of the thread local state of an execution unit, to be handed over to another thread.
 *
 * <p>A snapshot holds the current {@link Context} and the value of every registered {@link
 * ThreadLocalSetting}. It is captured when a task is launched and restored by the thread running
 * the task:
 *
 * <pre>
 *   ContextSnapshot snapshot = ContextSnapshot.capture();
 *   executor.execute(() -> {
 *     try (ContextScope ignored = snapshot.restore()) {
 *       // sees the slots and settings of the launching thread
 *     }
 *   });
 * </pre>
 *
 * <p>Propagation is one-directional: pushes and pops made by the task are not visible to the
 * launching thread, and changes made by the launching thread after the capture are not visible to
 * the task.
 *
 * @see ContextExecutors
 */
public final class ContextSnapshot {
  private static final Logger log = LoggerFactory.getLogger(ContextSnapshot.class);

  private static final Runnable NOTHING_TO_UNDO = () -> {};

  private final Context context;
  private final ThreadLocalSetting<?>[] settings;
  private final Object[] values;

  private ContextSnapshot(Context context, ThreadLocalSetting<?>[] settings, Object[] values) {
    this.context = context;
    this.settings = settings;
    this.values = values;
  }

  /**
   * Captures the thread local state of the current execution unit.
   *
   * @return the captured snapshot.
   */
  public static ContextSnapshot capture() {
    ThreadLocalSetting<?>[] settings = ThreadLocalSettings.registered();
    Object[] values = new Object[settings.length];
    for (int i = 0; i < settings.length; i++) {
      values[i] = settings[i].capture();
    }
    return new ContextSnapshot(manager().current(), settings, values);
  }

  /** Returns the captured context. */
  public Context context() {
    return this.context;
  }

  /**
   * Installs this snapshot on the calling thread.
   *
   * @return a scope reverting the calling thread to its previous state when closed.
   */
  public ContextScope restore() {
    Context previous = manager().swap(this.context);
    Runnable[] undos = new Runnable[this.settings.length];
    for (int i = 0; i < this.settings.length; i++) {
      undos[i] = apply(this.settings[i], this.values[i]);
    }
    return new RestoredScope(this.context, previous, undos);
  }

  @SuppressWarnings("unchecked")
  private static <V> Runnable apply(ThreadLocalSetting<V> setting, Object value) {
    try {
      Runnable undo = setting.apply((V) value);
      return undo == null ? NOTHING_TO_UNDO : undo;
    } catch (Throwable t) {
      log.warn("Failed to restore thread local setting {}", setting, t);
      return NOTHING_TO_UNDO;
    }
  }

  @Override
  public String toString() {
    return "ContextSnapshot{context=" + this.context + ", settings=" + this.settings.length + '}';
  }

  private static final class RestoredScope implements ContextScope {
    private final Context context;
    private final Context previous;
    private final Runnable[] undos;
    private boolean closed;

    RestoredScope(Context context, Context previous, Runnable[] undos) {
      this.context = context;
      this.previous = previous;
      this.undos = undos;
    }

    @Override
    public Context context() {
      return this.context;
    }

    @Override
    public void close() {
      if (this.closed) {
        return;
      }
      this.closed = true;
      for (int i = this.undos.length - 1; i >= 0; i--) {
        try {
          this.undos[i].run();
        } catch (Throwable t) {
          log.warn("Failed to revert thread local setting", t);
        }
      }
      manager().swap(this.previous);
    }
  }
}
