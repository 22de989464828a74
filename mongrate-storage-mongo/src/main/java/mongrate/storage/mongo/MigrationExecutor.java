package mongrate.storage.mongo;

import com.google.errorprone.annotations.ThreadSafe;
import com.mongodb.client.ClientSession;
import com.mongodb.client.MongoDatabase;
import mongrate.api.CommandException;
import mongrate.api.ConfigException;
import mongrate.api.DirtyStateException;
import mongrate.api.SchemaVersion;
import mongrate.api.lock.AdvisoryLock;
import mongrate.storage.mongo.command.CommandPlan;
import mongrate.storage.mongo.command.CommandWriteException;
import mongrate.storage.mongo.command.MongoCommand;
import mongrate.storage.mongo.command.MongoErrors;
import mongrate.storage.mongo.command.MongoExecution;
import mongrate.storage.mongo.command.TransactionCapability;
import org.bson.BsonDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.OptionalLong;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Executes decoded migration scripts.
 *
 * <p>A run validates its plan, takes the advisory lock, refuses a dirty database, executes the
 * commands in script order and releases the lock whatever happened. Commands are never reordered,
 * batched or retried.
 *
 * <p>Without transaction mode every command is applied on its own; when a version is being
 * recorded the version record is marked dirty before the first command, so that a crash half way
 * through stays visible. In transaction mode the data commands and the version update commit or
 * abort together. Structural commands leading the script run before the transaction under the
 * non-transactional rules.
 *
 * <p>The advisory lock is renewed before every command and before the version is recorded. A lost
 * lock stops the run.
 */
@ThreadSafe
public class MigrationExecutor {

  private static final Logger LOGGER = LoggerFactory.getLogger(MigrationExecutor.class);

  private static final String TRANSACTION = "transaction";

  private final MongoConnection connection;
  private final MongoConfig config;
  private final AdvisoryLock lock;
  private final MongoVersionStore versionStore;
  private final Supplier<TransactionCapability> transactionCapability;

  public MigrationExecutor(
      MongoConnection connection,
      MongoConfig config,
      AdvisoryLock lock,
      MongoVersionStore versionStore,
      Supplier<TransactionCapability> transactionCapability) {
    this.connection = connection;
    this.config = config;
    this.lock = lock;
    this.versionStore = versionStore;
    this.transactionCapability = transactionCapability;
  }

  /**
   * @param targetVersion the version to record on success, empty to leave the version as is
   * @throws mongrate.api.MalformedScriptException if the commands cannot form a plan; nothing ran
   * @throws DirtyStateException if the database is dirty; nothing ran
   * @throws CommandException if a command or the commit failed
   */
  public void execute(List<MongoCommand> commands, OptionalLong targetVersion) {
    CommandPlan plan =
        config.isTransactionMode()
            ? CommandPlan.transactional(commands)
            : CommandPlan.sequential(commands);
    if (plan.isEmpty() && targetVersion.isEmpty()) {
      LOGGER.debug("Migration script of '{}' is empty, nothing to run", connection.databaseName());
      return;
    }

    lock.acquire();
    RuntimeException failure = null;
    try {
      SchemaVersion current = versionStore.currentVersion();
      if (current.dirty()) {
        throw new DirtyStateException(current);
      }
      long started = System.nanoTime();
      LOGGER.info(
          "Migrating '{}' from version {}{}: {} command(s), transactional={}",
          connection.databaseName(),
          current.version(),
          targetVersion.isPresent() ? " to " + targetVersion.getAsLong() : "",
          plan.size(),
          plan.transactional());
      if (plan.transactional()) {
        runTransactional(plan, current, targetVersion, started);
      } else {
        runSequential(plan, current, targetVersion, started);
      }
      LOGGER.info(
          "Migrated '{}' in {} ms",
          connection.databaseName(),
          Duration.ofNanos(System.nanoTime() - started).toMillis());
    } catch (RuntimeException e) {
      failure = e;
      throw e;
    } finally {
      releaseLock(failure);
    }
  }

  private void releaseLock(RuntimeException failure) {
    try {
      lock.release();
    } catch (RuntimeException releaseError) {
      if (failure == null) throw releaseError;
      failure.addSuppressed(releaseError);
    }
  }

  private void runSequential(
      CommandPlan plan, SchemaVersion current, OptionalLong targetVersion, long started) {
    if (targetVersion.isPresent()) {
      markDirty(dirtyVersion(current, targetVersion.getAsLong()));
    }
    try {
      runOutsideTransaction(plan, plan.body(), 0, started);
    } catch (CommandException e) {
      if (targetVersion.isEmpty()) {
        markDirtyAfterFailure(current.version(), e);
      }
      throw e;
    }
    if (targetVersion.isPresent()) {
      lock.renew();
      versionStore.setVersion(new SchemaVersion(targetVersion.getAsLong(), false));
    }
  }

  private void runTransactional(
      CommandPlan plan, SchemaVersion current, OptionalLong targetVersion, long started) {
    if (transactionCapability.get() != TransactionCapability.SUPPORTED) {
      throw new ConfigException(
          "Transaction mode requires a replica set or a sharded cluster, '"
              + connection.databaseName()
              + "' is served by a deployment without multi-document transactions");
    }
    versionStore.ensureCollection();

    boolean prefixApplied = !plan.structural().isEmpty();
    if (prefixApplied) {
      markDirty(dirtyVersion(current, targetVersion.orElse(current.version())));
      runOutsideTransaction(plan, plan.structural(), 0, started);
    }

    SchemaVersion next;
    if (targetVersion.isPresent()) {
      next = new SchemaVersion(targetVersion.getAsLong(), false);
    } else if (prefixApplied) {
      next = new SchemaVersion(current.version(), false);
    } else {
      next = null;
    }

    MongoDatabase database = connection.database();
    AtomicInteger cursor = new AtomicInteger(CommandException.NO_INDEX);
    new MongoExecution<Void>(connection.client())
        .withTxn()
        .withTimeout(remaining(started))
        .execute(
            session -> {
              cursor.set(CommandException.NO_INDEX);
              for (int i = 0; i < plan.body().size(); i++) {
                cursor.set(plan.scriptIndexOfBody(i));
                lock.renew();
                runCommand(database, session, plan.body().get(i));
              }
              cursor.set(CommandException.NO_INDEX);
              if (next != null) {
                lock.renew();
                versionStore.setVersion(session, next);
              }
              return null;
            })
        .orElseThrow(cause -> commandFailure(plan, cursor.get(), prefixApplied, cause));
    LOGGER.debug("Committed {} command(s) on '{}'", plan.body().size(), connection.databaseName());
  }

  private void runOutsideTransaction(
      CommandPlan plan, List<MongoCommand> commands, int firstIndex, long started) {
    MongoDatabase database = connection.database();
    AtomicInteger cursor = new AtomicInteger(firstIndex);
    new MongoExecution<Void>(connection.client())
        .withoutTxn()
        .withTimeout(remaining(started))
        .execute(
            session -> {
              for (int i = 0; i < commands.size(); i++) {
                cursor.set(firstIndex + i);
                lock.renew();
                runCommand(database, null, commands.get(i));
              }
              return null;
            })
        .orElseThrow(cause -> commandFailure(plan, cursor.get(), true, cause));
  }

  private void runCommand(MongoDatabase database, ClientSession session, MongoCommand command) {
    BsonDocument response =
        session == null
            ? database.runCommand(command.document(), BsonDocument.class)
            : database.runCommand(session, command.document(), BsonDocument.class);
    CommandWriteException.check(command.name(), response);
    LOGGER.debug("Ran '{}' on '{}': {}", command.name(), connection.databaseName(), response);
  }

  private CommandException commandFailure(
      CommandPlan plan, int index, boolean dirty, Throwable cause) {
    String name = index == CommandException.NO_INDEX ? TRANSACTION : commandAt(plan, index).name();
    Throwable classified =
        MongoErrors.classifyTransport(
            index == CommandException.NO_INDEX ? "Transaction" : "Command #" + index, cause);
    return new CommandException(index, name, dirty, classified);
  }

  private static MongoCommand commandAt(CommandPlan plan, int index) {
    int structural = plan.structural().size();
    return index < structural ? plan.structural().get(index) : plan.body().get(index - structural);
  }

  private long dirtyVersion(SchemaVersion current, long target) {
    return switch (config.getDirtyVersionPolicy()) {
      case TARGET -> target;
      case PREVIOUS -> current.version();
    };
  }

  private void markDirty(long version) {
    LOGGER.warn(
        "Marking '{}' dirty at version {} until the run completes",
        connection.databaseName(),
        version);
    versionStore.setVersion(new SchemaVersion(version, true));
  }

  private void markDirtyAfterFailure(long version, CommandException failure) {
    LOGGER.warn(
        "Marking '{}' dirty at version {} after command #{} failed",
        connection.databaseName(),
        version,
        failure.getIndex());
    try {
      versionStore.setVersion(new SchemaVersion(version, true));
    } catch (RuntimeException e) {
      failure.addSuppressed(e);
    }
  }

  private Duration remaining(long started) {
    Duration limit = config.getMigrationTimeout();
    if (limit.isZero()) {
      return Duration.ZERO;
    }
    Duration left = limit.minusNanos(System.nanoTime() - started);
    return left.isNegative() || left.isZero() ? Duration.ofMillis(1) : left;
  }
}
