package mongrate.storage.mongo.command;

import com.mongodb.MongoClientException;
import com.mongodb.MongoConfigurationException;
import com.mongodb.MongoException;
import com.mongodb.MongoSecurityException;
import com.mongodb.MongoSocketException;
import com.mongodb.MongoTimeoutException;
import mongrate.api.AuthenticationException;
import mongrate.api.ConnectionException;
import mongrate.api.MigrateException;

/** Maps MongoDB driver exceptions onto the migration error taxonomy. */
public final class MongoErrors {

  private MongoErrors() {}

  /**
   * @param action what was being done, used in the message
   * @return a classified exception; migration exceptions pass through unchanged
   */
  public static MigrateException classify(String action, Throwable error) {
    if (error instanceof MigrateException migrateError) {
      return migrateError;
    }
    if (isAuthenticationFailure(error)) {
      return new AuthenticationException(action + " was rejected: " + error.getMessage(), error);
    }
    if (isConnectionFailure(error)) {
      return new ConnectionException(
          action + " could not reach MongoDB: " + error.getMessage(), error);
    }
    return new MigrateException(action + " failed: " + error.getMessage(), error);
  }

  /**
   * @return the classified exception when {@code error} is an authentication or connection
   *     failure, otherwise {@code error} itself
   */
  public static Throwable classifyTransport(String action, Throwable error) {
    if (isAuthenticationFailure(error) || isConnectionFailure(error)) {
      return classify(action, error);
    }
    return error;
  }

  public static boolean isAuthenticationFailure(Throwable error) {
    if (error instanceof MongoSecurityException) return true;
    return error instanceof MongoException mongoError
        && (MongoErrorCode.AUTHENTICATION_FAILED.matches(mongoError)
            || MongoErrorCode.UNAUTHORIZED.matches(mongoError));
  }

  public static boolean isConnectionFailure(Throwable error) {
    return error instanceof MongoSocketException
        || error instanceof MongoTimeoutException
        || error instanceof MongoConfigurationException
        || (error instanceof MongoClientException
            && error.getCause() instanceof MongoSocketException);
  }
}
