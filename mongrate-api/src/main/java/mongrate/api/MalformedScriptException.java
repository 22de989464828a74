package mongrate.api;

/**
 * A migration script could not be decoded into commands, or cannot be executed in the configured
 * mode. Nothing of the script has been executed when this is thrown.
 */
public class MalformedScriptException extends MigrateException {

  public MalformedScriptException(String message) {
    super(message);
  }

  public MalformedScriptException(String message, Throwable cause) {
    super(message, cause);
  }
}
