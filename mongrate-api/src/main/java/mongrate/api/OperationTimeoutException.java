package mongrate.api;

/** A migration run did not complete within its configured time limit. */
public class OperationTimeoutException extends MigrateException {

  public OperationTimeoutException(Throwable cause) {
    super(cause);
  }

  public OperationTimeoutException(String message, Throwable cause) {
    super(message, cause);
  }
}
