package optrace.context;

import static java.util.Objects.requireNonNull;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/** Registry of the {@link ThreadLocalSetting}s propagated by {@link ContextSnapshot}s. */
public final class ThreadLocalSettings {
  private static final List<ThreadLocalSetting<?>> SETTINGS = new CopyOnWriteArrayList<>();

  private ThreadLocalSettings() {}

  /**
   * Registers a setting. Snapshots captured from now on will carry its value.
   *
   * @param setting the setting to propagate.
   * @return {@code true} if registered; {@code false} if it was already registered.
   */
  public static boolean register(ThreadLocalSetting<?> setting) {
    requireNonNull(setting, "Thread local setting cannot be null");
    return ((CopyOnWriteArrayList<ThreadLocalSetting<?>>) SETTINGS).addIfAbsent(setting);
  }

  /**
   * Unregisters a setting. Snapshots already captured keep their value.
   *
   * @param setting the setting to stop propagating.
   * @return {@code true} if it was registered.
   */
  public static boolean unregister(ThreadLocalSetting<?> setting) {
    return SETTINGS.remove(setting);
  }

  static ThreadLocalSetting<?>[] registered() {
    return SETTINGS.toArray(new ThreadLocalSetting<?>[0]);
  }
}
