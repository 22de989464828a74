package mongrate.api.lock;

import com.google.errorprone.annotations.ThreadSafe;
import com.google.errorprone.annotations.concurrent.GuardedBy;

/** Lock used when advisory locking is disabled. Tracks its own hold count only. */
@ThreadSafe
final class NoopAdvisoryLock implements AdvisoryLock {

  @GuardedBy("this")
  private int holds;

  @Override
  public synchronized void acquire() {
    holds++;
  }

  @Override
  public synchronized void release() {
    if (holds > 0) holds--;
  }

  @Override
  public synchronized void releaseAll() {
    holds = 0;
  }

  @Override
  public void renew() {}

  @Override
  public synchronized boolean isHeld() {
    return holds > 0;
  }
}
