package mongrate.api;

/**
 * The advisory lock marker of a running migration disappeared, typically because it expired. The
 * run stops since another run may have taken the lock in the meantime.
 */
public class LockLostException extends MigrateException {

  private final String lockName;

  public LockLostException(String lockName, String holder) {
    super("Advisory lock '" + lockName + "' held by " + holder + " was lost before the run ended");
    this.lockName = lockName;
  }

  public String getLockName() {
    return lockName;
  }
}
