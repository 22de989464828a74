package mongrate.api;

/** Invalid, missing or unrecognized configuration. Raised before anything touches the database. */
public class ConfigException extends MigrateException {

  public ConfigException(String message) {
    super(message);
  }

  public ConfigException(String message, Throwable cause) {
    super(message, cause);
  }
}
