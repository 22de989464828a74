package mongrate.api;

/** The driver was used in a state that does not allow the operation, e.g. after close. */
public class MigrateStateException extends MigrateException {

  public MigrateStateException(String message) {
    super(message);
  }

  public MigrateStateException(Throwable cause) {
    super(cause);
  }
}
