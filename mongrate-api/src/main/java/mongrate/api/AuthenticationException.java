package mongrate.api;

/**
 * The server rejected the credentials, or the authenticated user lacks a required privilege.
 *
 * <p>Opening a driver does not validate credentials. This exception is raised by the first
 * operation that talks to the server ({@code run}, {@code version}, {@code lock}, ...), never by
 * {@code open}. A successfully opened driver is not proof of valid credentials.
 */
public class AuthenticationException extends MigrateException {

  public AuthenticationException(String message, Throwable cause) {
    super(message, cause);
  }
}
