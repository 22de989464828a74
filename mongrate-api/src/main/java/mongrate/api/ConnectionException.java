package mongrate.api;

/**
 * Transport or connection-establishment failure: bad host, DNS failure, socket error, server
 * selection timeout. Never retried by the driver.
 */
public class ConnectionException extends MigrateException {

  public ConnectionException(String message, Throwable cause) {
    super(message, cause);
  }
}
