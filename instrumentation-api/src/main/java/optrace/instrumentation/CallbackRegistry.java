package optrace.instrumentation;

import static java.util.Objects.requireNonNull;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReferenceArray;
import javax.annotation.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Process wide registry of the {@link RecordCallback}s invoked by {@link RecordFunction}s.
 *
 * <p>At most one callback pair is installed per {@link CallbackKind}. Installing a kind that is
 * already installed only increments its reference count; the pair is unregistered when the last
 * {@link Subscription} is cancelled or when the kind is {@link #remove(CallbackKind) removed}.
 *
 * <p>Callbacks only fire on threads that {@link #setIncluded(CallbackKind, boolean) include} their
 * kind. Exceptions thrown by callbacks are logged and never reach the instrumented code.
 */
public final class CallbackRegistry {
  private static final Logger log = LoggerFactory.getLogger(CallbackRegistry.class);

  private static final CallbackRegistry INSTANCE = new CallbackRegistry();

  // written under the registry lock, read without locking on dispatch
  private final AtomicReferenceArray<Registration> registrations =
      new AtomicReferenceArray<>(CallbackKind.COUNT);

  private volatile int installedCount;

  private final ThreadLocal<boolean[]> included =
      ThreadLocal.withInitial(() -> new boolean[CallbackKind.COUNT]);

  CallbackRegistry() {}

  public static CallbackRegistry get() {
    return INSTANCE;
  }

  /**
   * Installs a callback pair, or takes one more reference on the pair already installed for the
   * kind.
   *
   * @param kind the tag of the pair.
   * @param callback the callbacks to invoke.
   * @param needsInputs whether the callbacks read the argument descriptors.
   * @param scopes the call site categories to invoke the callbacks for.
   * @return the subscription releasing this reference.
   * @throws IllegalStateException if a different callback is installed for the kind.
   */
  public synchronized Subscription install(
      CallbackKind kind, RecordCallback callback, boolean needsInputs, Set<RecordScope> scopes) {
    requireNonNull(kind, "Callback kind cannot be null");
    requireNonNull(callback, "Callback cannot be null");
    int id = kind.ordinal();
    Registration registration = this.registrations.get(id);
    if (registration == null) {
      registration =
          new Registration(
              kind, callback, scopes.isEmpty() ? EnumSet.noneOf(RecordScope.class) : scopes);
      this.registrations.set(id, registration);
      this.installedCount++;
      log.debug("Installed callbacks {} for {}", callback, kind);
    } else if (registration.callback != callback) {
      String message =
          "Trying to overwrite existing callback " + registration.callback + " for kind " + kind;
      log.warn(message);
      throw new IllegalStateException(message);
    }
    registration.references++;
    if (needsInputs) {
      registration.needsInputs = true;
    }
    return new RegistrationSubscription(this, registration);
  }

  /**
   * Unregisters the callback pair of the kind, whatever its reference count. Other kinds are left
   * untouched.
   *
   * @param kind the tag of the pair to remove.
   * @return {@code true} if a pair was installed.
   */
  public synchronized boolean remove(CallbackKind kind) {
    Registration registration = this.registrations.getAndSet(kind.ordinal(), null);
    if (registration == null) {
      return false;
    }
    this.installedCount--;
    log.debug("Removed callbacks {} for {}", registration.callback, kind);
    return true;
  }

  public synchronized boolean isInstalled(CallbackKind kind) {
    return this.registrations.get(kind.ordinal()) != null;
  }

  synchronized void release(Registration registration) {
    int id = registration.kind.ordinal();
    if (this.registrations.get(id) != registration) {
      // removed, possibly re-installed since
      return;
    }
    if (--registration.references == 0) {
      this.registrations.set(id, null);
      this.installedCount--;
      log.debug("Uninstalled callbacks {} for {}", registration.callback, registration.kind);
    }
  }

  /**
   * Includes or excludes the kind from dispatch on the calling thread.
   *
   * @param kind the kind to set.
   * @param included whether the callbacks of this kind fire on the calling thread.
   */
  public void setIncluded(CallbackKind kind, boolean included) {
    this.included.get()[kind.ordinal()] = included;
  }

  public boolean isIncluded(CallbackKind kind) {
    return this.included.get()[kind.ordinal()];
  }

  /**
   * Tells whether a callback firing on the calling thread for the scope reads argument
   * descriptors.
   */
  public boolean needsInputs(RecordScope scope) {
    if (this.installedCount == 0) {
      return false;
    }
    boolean[] included = this.included.get();
    for (int i = 0; i < CallbackKind.COUNT; i++) {
      Registration registration = this.registrations.get(i);
      if (included[i]
          && registration != null
          && registration.needsInputs
          && registration.scopes.contains(scope)) {
        return true;
      }
    }
    return false;
  }

  /**
   * Collects the callbacks that fire for the scope on the calling thread.
   *
   * @return the active registrations; {@code null} if there is none.
   */
  @Nullable
  List<Registration> active(RecordScope scope) {
    if (this.installedCount == 0) {
      return null;
    }
    boolean[] included = this.included.get();
    List<Registration> active = null;
    for (int i = 0; i < CallbackKind.COUNT; i++) {
      Registration registration = this.registrations.get(i);
      if (included[i] && registration != null && registration.scopes.contains(scope)) {
        if (active == null) {
          active = new ArrayList<>(CallbackKind.COUNT);
        }
        active.add(registration);
      }
    }
    return active;
  }

  static final class Registration {
    final CallbackKind kind;
    final RecordCallback callback;
    final Set<RecordScope> scopes;
    volatile boolean needsInputs;

    // guarded by the registry lock
    int references;

    Registration(CallbackKind kind, RecordCallback callback, Set<RecordScope> scopes) {
      this.kind = kind;
      this.callback = callback;
      this.scopes = EnumSet.copyOf(scopes);
    }

    boolean enter(RecordFunction fn) {
      try {
        return this.callback.onEnter(fn);
      } catch (Throwable t) {
        log.warn("Callback for {} threw.", this.kind, t);
        return false;
      }
    }

    void exit(RecordFunction fn) {
      try {
        this.callback.onExit(fn);
      } catch (Throwable t) {
        log.warn("Callback for {} threw.", this.kind, t);
      }
    }
  }

  private static final class RegistrationSubscription implements Subscription {
    private final CallbackRegistry registry;
    private final Registration registration;
    private final AtomicBoolean cancelled = new AtomicBoolean();

    RegistrationSubscription(CallbackRegistry registry, Registration registration) {
      this.registry = registry;
      this.registration = registration;
    }

    @Override
    public void cancel() {
      if (this.cancelled.compareAndSet(false, true)) {
        this.registry.release(this.registration);
      }
    }
  }
}
