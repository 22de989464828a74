package mongrate.api.lock;

import com.google.errorprone.annotations.ThreadSafe;

/**
 * A mutual-exclusion marker stored in the database itself.
 *
 * <p>The lock is advisory: it only excludes clients that use the same mechanism. Backends that
 * cannot store such a marker use {@link #noop()}, which always succeeds and excludes nobody.
 */
@ThreadSafe
public interface AdvisoryLock {

  /**
   * Takes the lock with a single attempt.
   *
   * @throws mongrate.api.LockHeldException if another holder has it
   */
  void acquire();

  /** Gives the lock back. A no-op if this holder does not hold it. */
  void release();

  /** Gives the lock back however many times it was acquired. */
  void releaseAll();

  /**
   * Keeps a held lock from expiring while its holder works. A no-op if the lock is not held.
   *
   * @throws mongrate.api.LockLostException if the lock expired or was taken away
   */
  void renew();

  boolean isHeld();

  /**
   * @return a lock that never blocks anyone
   */
  static AdvisoryLock noop() {
    return new NoopAdvisoryLock();
  }
}
