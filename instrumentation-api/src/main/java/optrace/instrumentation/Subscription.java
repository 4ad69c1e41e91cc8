package optrace.instrumentation;

/** A handle to a callback installation. */
public interface Subscription {
  /** Releases the installation. Calling it more than once has no effect. */
  void cancel();

  class SubscriptionNoop implements Subscription {
    public static final Subscription INSTANCE = new SubscriptionNoop();

    private SubscriptionNoop() {}

    @Override
    public void cancel() {}
  }
}
