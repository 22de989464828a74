package mongrate.api;

/**
 * A previous run was interrupted and left the database dirty. New runs are refused until the
 * version is explicitly reset with {@code setVersion(version, false)} after manual correction.
 */
public class DirtyStateException extends MigrateException {

  private final SchemaVersion version;

  public DirtyStateException(SchemaVersion version) {
    super(
        "Database is dirty at version "
            + version.version()
            + "; fix it manually and reset the version before running migrations");
    this.version = version;
  }

  public SchemaVersion getVersion() {
    return version;
  }
}
