package mongrate.api;

/** Root of every failure raised by a migration driver. */
public class MigrateException extends RuntimeException {

  public MigrateException(Throwable cause) {
    super(cause);
  }

  public MigrateException(String message) {
    super(message);
  }

  public MigrateException(String message, Throwable cause) {
    super(message, cause);
  }
}
