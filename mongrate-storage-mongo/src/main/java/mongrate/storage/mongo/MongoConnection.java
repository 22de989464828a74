package mongrate.storage.mongo;

import com.google.common.annotations.VisibleForTesting;
import com.google.errorprone.annotations.ThreadSafe;
import com.mongodb.ConnectionString;
import com.mongodb.MongoClientSettings;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoClients;
import com.mongodb.client.MongoDatabase;
import mongrate.api.ConnectionException;
import mongrate.api.MigrateStateException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Holds the {@link MongoClient} of a driver and the database it targets.
 *
 * <p>A connection either owns its client ({@link #open}) or borrows one from the caller ({@link
 * #adopt}). Only an owned client is closed by {@link #close()}; a borrowed client stays open and
 * may keep serving other work of its owner.
 *
 * <p>Opening does not talk to the server. The MongoDB driver connects and authenticates lazily,
 * when the first operation needs a connection, so bad credentials are reported by that operation.
 */
@ThreadSafe
public final class MongoConnection implements AutoCloseable {

  private static final Logger LOGGER = LoggerFactory.getLogger(MongoConnection.class);

  private final MongoClient client;
  private final String databaseName;
  private final boolean ownsClient;
  private final AtomicBoolean closed = new AtomicBoolean(false);

  @VisibleForTesting
  MongoConnection(MongoClient client, String databaseName, boolean ownsClient) {
    this.client = Objects.requireNonNull(client, "client");
    this.databaseName = Objects.requireNonNull(databaseName, "databaseName");
    this.ownsClient = ownsClient;
  }

  /**
   * Creates a client for the given connection string. The returned connection owns the client.
   *
   * @throws ConnectionException if the client cannot be created
   */
  public static MongoConnection open(ConnectionString connectionString) {
    MongoClient client;
    try {
      client =
          MongoClients.create(
              MongoClientSettings.builder().applyConnectionString(connectionString).build());
    } catch (RuntimeException e) {
      throw new ConnectionException(
          "Failed to create MongoDB client for " + connectionString.getHosts(), e);
    }
    LOGGER.debug(
        "Opened MongoDB client for {}/{}",
        connectionString.getHosts(),
        connectionString.getDatabase());
    return new MongoConnection(client, connectionString.getDatabase(), true);
  }

  /** Wraps a client owned by the caller. {@link #close()} will leave it open. */
  public static MongoConnection adopt(MongoClient client, String databaseName) {
    return new MongoConnection(client, databaseName, false);
  }

  public MongoClient client() {
    ensureOpen();
    return client;
  }

  public MongoDatabase database() {
    ensureOpen();
    return client.getDatabase(databaseName);
  }

  public String databaseName() {
    return databaseName;
  }

  public boolean ownsClient() {
    return ownsClient;
  }

  public boolean isClosed() {
    return closed.get();
  }

  private void ensureOpen() {
    if (closed.get()) {
      throw new MigrateStateException("Connection to database '" + databaseName + "' is closed");
    }
  }

  @Override
  public void close() {
    if (!closed.compareAndSet(false, true)) return;
    if (ownsClient) {
      client.close();
      LOGGER.debug("Closed MongoDB client of database '{}'", databaseName);
    }
  }
}
