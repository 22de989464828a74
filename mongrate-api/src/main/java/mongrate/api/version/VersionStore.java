package mongrate.api.version;

import com.google.errorprone.annotations.ThreadSafe;
import mongrate.api.SchemaVersion;

/** Persists the applied migration version and its dirty flag. */
@ThreadSafe
public interface VersionStore {

  /**
   * @return the stored version, {@link SchemaVersion#nil()} if none was ever stored
   */
  SchemaVersion currentVersion();

  /** Upserts the singleton version record. */
  void setVersion(SchemaVersion version);

  /**
   * Removes the version record, the lock record and every other collection the driver manages.
   *
   * @throws mongrate.api.DropException if part of the teardown failed
   */
  void drop();
}
