package optrace.context;

/** Provides the {@link ContextManager} implementation. */
final class ContextProviders {

  static volatile ContextManager customManager;

  private ContextProviders() {}

  private static final class ProvidedManager {
    static final ContextManager INSTANCE =
        null != ContextProviders.customManager
            ? ContextProviders.customManager
            : ThreadLocalContextManager.INSTANCE;
  }

  static ContextManager manager() {
    return ProvidedManager.INSTANCE; // locked on first use
  }
}
