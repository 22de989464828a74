package mongrate.storage.mongo;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import com.google.common.base.Suppliers;
import com.google.errorprone.annotations.ThreadSafe;
import com.mongodb.MongoException;
import com.mongodb.client.MongoClient;
import mongrate.api.ConfigException;
import mongrate.api.Driver;
import mongrate.api.MigrateStateException;
import mongrate.api.SchemaVersion;
import mongrate.api.lock.AdvisoryLock;
import mongrate.storage.mongo.command.CommandCodec;
import mongrate.storage.mongo.command.MongoErrors;
import mongrate.storage.mongo.command.TransactionCapability;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.InputStream;
import java.util.OptionalLong;
import java.util.function.Supplier;

/**
 * MongoDB migration driver.
 *
 * <pre>{@code
 * try (Driver driver = MongoDriver.open("mongodb://localhost:27017/app?x-transaction-mode=true")) {
 *   driver.migrate(1, Files.newInputStream(Path.of("1_init.up.json")));
 * }
 * }</pre>
 *
 * <p>Opening does not contact the server. Connection and authentication problems surface from the
 * first operation that needs the database.
 */
@ThreadSafe
public class MongoDriver implements Driver {

  private static final Logger LOGGER = LoggerFactory.getLogger(MongoDriver.class);

  static final String ADMIN_DATABASE = "admin";

  private final MongoConnection connection;
  private final MongoConfig config;
  private final CommandCodec codec = new CommandCodec();
  private final AdvisoryLock lock;
  private final MongoVersionStore versionStore;
  private final MigrationExecutor executor;

  private MongoDriver(MongoConnection connection, MongoConfig config) {
    this(
        connection,
        config,
        config.isAdvisoryLocking()
            ? new MongoAdvisoryLock(connection, config)
            : AdvisoryLock.noop(),
        new MongoVersionStore(connection, config.getMigrationsCollection()),
        Suppliers.memoize(
            () -> TransactionCapability.probe(connection.client().getDatabase(ADMIN_DATABASE))));
  }

  @VisibleForTesting
  MongoDriver(
      MongoConnection connection,
      MongoConfig config,
      AdvisoryLock lock,
      MongoVersionStore versionStore,
      Supplier<TransactionCapability> transactionCapability) {
    this.connection = connection;
    this.config = config;
    this.lock = lock;
    this.versionStore = versionStore;
    this.executor =
        new MigrationExecutor(connection, config, lock, versionStore, transactionCapability);
  }

  /**
   * Opens a driver with its own client.
   *
   * @throws ConfigException if the URL is invalid
   * @throws mongrate.api.ConnectionException if the client cannot be created
   */
  public static MongoDriver open(String url) {
    MongoConnectionUrl parsed = MongoConnectionUrl.parse(url);
    MongoDriver driver =
        new MongoDriver(MongoConnection.open(parsed.getConnectionString()), parsed.getConfig());
    LOGGER.info("Opened migration driver for {} with {}", parsed.describe(), parsed.getConfig());
    return driver;
  }

  /** Opens a driver on a client owned by the caller. {@link #close()} leaves the client open. */
  public static MongoDriver withInstance(MongoClient client, MongoConfig config) {
    if (client == null) {
      throw new ConfigException("A MongoClient is required");
    }
    if (config == null) {
      throw new ConfigException("A MongoConfig is required");
    }
    return new MongoDriver(MongoConnection.adopt(client, config.getDatabaseName()), config);
  }

  @Override
  public void lock() {
    call("Acquiring the advisory lock", lock::acquire);
  }

  @Override
  public void unlock() {
    call("Releasing the advisory lock", lock::release);
  }

  @Override
  public void run(InputStream migration) {
    ensureOpen();
    var commands = codec.decode(migration);
    call("Running migration", () -> executor.execute(commands, OptionalLong.empty()));
  }

  @Override
  public void migrate(long version, InputStream migration) {
    Preconditions.checkArgument(version >= 0, "version must not be negative: %s", version);
    ensureOpen();
    var commands = codec.decode(migration);
    call(
        "Migrating to version " + version,
        () -> executor.execute(commands, OptionalLong.of(version)));
  }

  @Override
  public SchemaVersion version() {
    ensureOpen();
    try {
      return versionStore.currentVersion();
    } catch (MongoException e) {
      throw MongoErrors.classify("Reading the schema version", e);
    }
  }

  @Override
  public void setVersion(long version, boolean dirty) {
    Preconditions.checkArgument(
        version >= SchemaVersion.NIL_VERSION,
        "version must be %s or more: %s",
        SchemaVersion.NIL_VERSION,
        version);
    call(
        "Setting the schema version",
        () -> versionStore.setVersion(new SchemaVersion(version, dirty)));
  }

  @Override
  public void drop() {
    call("Dropping database " + connection.databaseName(), versionStore::drop);
  }

  @Override
  public void close() {
    if (connection.isClosed()) return;
    if (lock.isHeld()) {
      try {
        lock.releaseAll();
      } catch (RuntimeException e) {
        LOGGER.warn(
            "Failed to release the advisory lock of '{}' on close, it expires after {}",
            connection.databaseName(),
            config.getLockingTimeout(),
            e);
      }
    }
    connection.close();
  }

  public MongoConfig getConfig() {
    return config;
  }

  private void call(String action, Runnable operation) {
    ensureOpen();
    try {
      operation.run();
    } catch (MongoException e) {
      throw MongoErrors.classify(action, e);
    }
  }

  private void ensureOpen() {
    if (connection.isClosed()) {
      throw new MigrateStateException(
          "Migration driver of '" + connection.databaseName() + "' is closed");
    }
  }
}
