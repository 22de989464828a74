package mongrate.api;

/** Another migration run holds the advisory lock. Retrying is left to the caller. */
public class LockHeldException extends MigrateException {

  private final String lockName;

  public LockHeldException(String lockName, Throwable cause) {
    super("Advisory lock '" + lockName + "' is held by another migration run", cause);
    this.lockName = lockName;
  }

  public String getLockName() {
    return lockName;
  }
}
