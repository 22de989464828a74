package mongrate.api;

import com.google.errorprone.annotations.ThreadSafe;

import java.io.InputStream;

/**
 * A migration driver bound to one logical database.
 *
 * <p>Every operation is synchronous: it completes or throws before returning. Failures are
 * reported with the {@link MigrateException} hierarchy so that "nothing happened" and "the
 * database is now dirty" are never conflated.
 */
@ThreadSafe
public interface Driver extends AutoCloseable {

  /**
   * Takes the advisory lock guarding the database.
   *
   * @throws LockHeldException if another run holds it; no retry is attempted
   */
  void lock();

  /** Releases the advisory lock. Releasing a lock that is not held is a no-op. */
  void unlock();

  /**
   * Executes a migration script without recording a version. A failure in non-transactional mode
   * marks the current version dirty.
   *
   * @param migration the script, an ordered list of command descriptors
   * @throws MalformedScriptException if the script cannot be decoded; nothing is executed
   * @throws DirtyStateException if the database is dirty
   * @throws CommandException if a command fails
   */
  void run(InputStream migration);

  /**
   * Executes a migration script and records {@code version} as applied.
   *
   * @param version the version the script migrates the database to
   * @param migration the script, an ordered list of command descriptors
   * @throws MalformedScriptException if the script cannot be decoded; nothing is executed
   * @throws DirtyStateException if the database is dirty
   * @throws CommandException if a command fails
   */
  void migrate(long version, InputStream migration);

  /**
   * @return the applied version, {@link SchemaVersion#nil()} if none
   */
  SchemaVersion version();

  /** Overwrites the version record. Used to clear a dirty state after manual correction. */
  void setVersion(long version, boolean dirty);

  /**
   * Removes every collection of the database, including the version and lock metadata.
   *
   * @throws DropException if some collections could not be dropped
   */
  void drop();

  /** Releases resources the driver owns. Idempotent. */
  @Override
  void close();
}
