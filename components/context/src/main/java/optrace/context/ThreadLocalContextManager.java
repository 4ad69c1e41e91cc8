package optrace.context;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** {@link ContextManager} that uses a {@link ThreadLocal} to track context per thread. */
final class ThreadLocalContextManager implements ContextManager {
  private static final Logger log = LoggerFactory.getLogger(ThreadLocalContextManager.class);

  static final ContextManager INSTANCE = new ThreadLocalContextManager();

  // single element array so scopes can update the holder without a second lookup
  private static final ThreadLocal<Context[]> CURRENT_HOLDER =
      ThreadLocal.withInitial(() -> new Context[] {EmptyContext.INSTANCE});

  @Override
  public Context current() {
    return CURRENT_HOLDER.get()[0];
  }

  @Override
  public ContextScope attach(Context context) {
    Context[] holder = CURRENT_HOLDER.get();
    Context previous = holder[0];
    holder[0] = context;
    return new HolderScope(holder, context, previous);
  }

  @Override
  public Context swap(Context context) {
    Context[] holder = CURRENT_HOLDER.get();
    Context previous = holder[0];
    holder[0] = context;
    return previous;
  }

  private static final class HolderScope implements ContextScope {
    private final Context[] holder;
    private final Context context;
    private final Context previous;
    private boolean closed;

    HolderScope(Context[] holder, Context context, Context previous) {
      this.holder = holder;
      this.context = context;
      this.previous = previous;
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
      if (this.context != this.holder[0]) {
        if (log.isDebugEnabled()) {
          log.debug("Ignoring out of order close of scope for {}", this.context);
        }
        return;
      }
      this.holder[0] = this.previous;
      this.closed = true;
    }
  }
}
