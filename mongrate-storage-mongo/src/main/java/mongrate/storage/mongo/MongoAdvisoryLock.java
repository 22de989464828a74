package mongrate.storage.mongo;

import com.google.common.annotations.VisibleForTesting;
import com.google.errorprone.annotations.ThreadSafe;
import com.google.errorprone.annotations.concurrent.GuardedBy;
import com.mongodb.ErrorCategory;
import com.mongodb.MongoCommandException;
import com.mongodb.MongoException;
import com.mongodb.MongoWriteException;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.model.Filters;
import com.mongodb.client.model.IndexOptions;
import com.mongodb.client.model.Indexes;
import com.mongodb.client.model.Updates;
import com.mongodb.client.result.DeleteResult;
import com.mongodb.client.result.UpdateResult;
import mongrate.api.LockHeldException;
import mongrate.api.LockLostException;
import mongrate.api.lock.AdvisoryLock;
import mongrate.storage.mongo.command.MongoErrorCode;
import mongrate.storage.mongo.command.MongoErrors;
import mongrate.storage.mongo.command.MongoExecution;
import mongrate.storage.mongo.internal.HolderIds;
import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Date;
import java.util.concurrent.TimeUnit;

/**
 * Advisory lock backed by a single marker document.
 *
 * <pre>{@code
 * {
 *   "locking_key": 0,
 *   "holder": "host-4711-8a1f...",
 *   "pid": 4711,
 *   "hostname": "host",
 *   "created_at": ISODate("...")
 * }
 * }</pre>
 *
 * A unique index on {@code locking_key} lets at most one marker exist. A TTL index on {@code
 * created_at} removes the marker of a crashed holder once {@code lockingTimeout} has passed; the
 * server's TTL monitor runs about once a minute, so expiry is approximate. A live holder keeps the
 * marker with {@link #renew()}.
 *
 * <p>The lock is reentrant per instance. Only the outermost {@link #release()} deletes the marker.
 */
@ThreadSafe
public class MongoAdvisoryLock implements AdvisoryLock {

  private static final Logger LOGGER = LoggerFactory.getLogger(MongoAdvisoryLock.class);

  static final String LOCKING_KEY_FIELD = "locking_key";
  static final String HOLDER_FIELD = "holder";
  static final String PID_FIELD = "pid";
  static final String HOSTNAME_FIELD = "hostname";
  static final String CREATED_AT_FIELD = "created_at";

  static final int LOCKING_KEY = 0;

  static final String UNIQUE_INDEX_NAME = "unique_locking_key";
  static final String TTL_INDEX_NAME = "ttl_created_at";

  private final MongoConnection connection;
  private final String lockCollection;
  private final Duration lockingTimeout;
  private final String holder;

  @GuardedBy("this")
  private int holdCount;

  public MongoAdvisoryLock(MongoConnection connection, MongoConfig config) {
    this(
        connection,
        config.getLockCollection(),
        config.getLockingTimeout(),
        HolderIds.newHolderId());
  }

  @VisibleForTesting
  MongoAdvisoryLock(
      MongoConnection connection, String lockCollection, Duration lockingTimeout, String holder) {
    this.connection = connection;
    this.lockCollection = lockCollection;
    this.lockingTimeout = lockingTimeout;
    this.holder = holder;
  }

  @Override
  public synchronized void acquire() {
    if (holdCount > 0) {
      holdCount++;
      return;
    }
    MongoCollection<Document> collection = collection();
    ensureIndexes(collection);

    Document marker =
        new Document(LOCKING_KEY_FIELD, LOCKING_KEY)
            .append(HOLDER_FIELD, holder)
            .append(PID_FIELD, HolderIds.pid())
            .append(HOSTNAME_FIELD, HolderIds.hostname())
            .append(CREATED_AT_FIELD, new Date());
    try {
      collection.insertOne(marker);
    } catch (MongoWriteException e) {
      if (e.getError().getCategory() == ErrorCategory.DUPLICATE_KEY) {
        throw new LockHeldException(lockCollection, e);
      }
      throw MongoErrors.classify("Acquiring advisory lock '" + lockCollection + "'", e);
    } catch (MongoException e) {
      throw MongoErrors.classify("Acquiring advisory lock '" + lockCollection + "'", e);
    }
    holdCount = 1;
    LOGGER.debug("Acquired advisory lock '{}' as {}", lockCollection, holder);
  }

  private void ensureIndexes(MongoCollection<Document> collection) {
    createIndex(
        () ->
            collection.createIndex(
                Indexes.ascending(LOCKING_KEY_FIELD),
                new IndexOptions().name(UNIQUE_INDEX_NAME).unique(true)));
    createIndex(
        () ->
            collection.createIndex(
                Indexes.ascending(CREATED_AT_FIELD),
                new IndexOptions()
                    .name(TTL_INDEX_NAME)
                    .expireAfter(lockingTimeout.getSeconds(), TimeUnit.SECONDS)));
  }

  private void createIndex(Runnable creation) {
    try {
      creation.run();
    } catch (MongoCommandException e) {
      if (MongoErrorCode.INDEX_OPTIONS_CONFLICT.matches(e)
          || MongoErrorCode.INDEX_KEY_SPECS_CONFLICT.matches(e)) {
        // An existing index with other options, e.g. a different TTL, stays in place.
        LOGGER.warn(
            "{} on lock collection '{}', keeping the existing index: {}",
            MongoErrorCode.fromException(e).getCodeName(),
            lockCollection,
            e.getErrorMessage());
        return;
      }
      throw MongoErrors.classify("Creating lock indexes on '" + lockCollection + "'", e);
    } catch (MongoException e) {
      throw MongoErrors.classify("Creating lock indexes on '" + lockCollection + "'", e);
    }
  }

  @Override
  public synchronized void release() {
    if (holdCount == 0) return;
    if (holdCount > 1) {
      holdCount--;
      return;
    }
    DeleteResult deleted =
        new MongoExecution<DeleteResult>(connection.client())
            .withoutTxn()
            .retryOnCode(MongoErrorCode.WRITE_CONFLICT)
            .execute(
                session ->
                    collection()
                        .deleteOne(
                            Filters.and(
                                Filters.eq(LOCKING_KEY_FIELD, LOCKING_KEY),
                                Filters.eq(HOLDER_FIELD, holder))))
            .orElseThrow(
                cause ->
                    MongoErrors.classify(
                        "Releasing advisory lock '" + lockCollection + "'", cause));
    holdCount = 0;
    if (deleted.getDeletedCount() == 0) {
      LOGGER.warn(
          "Advisory lock '{}' of {} was already gone, it may have expired", lockCollection, holder);
    } else {
      LOGGER.debug("Released advisory lock '{}'", lockCollection);
    }
  }

  @Override
  public synchronized void releaseAll() {
    if (holdCount == 0) return;
    holdCount = 1;
    release();
  }

  /**
   * Moves {@code created_at} of the marker to now, restarting its TTL. A run calls this between
   * commands so the marker outlives runs longer than {@code lockingTimeout}.
   *
   * @throws LockLostException if the marker of this holder is gone
   */
  @Override
  public synchronized void renew() {
    if (holdCount == 0) return;
    UpdateResult renewed =
        new MongoExecution<UpdateResult>(connection.client())
            .withoutTxn()
            .retryOnCode(MongoErrorCode.WRITE_CONFLICT)
            .execute(
                session ->
                    collection()
                        .updateOne(
                            Filters.and(
                                Filters.eq(LOCKING_KEY_FIELD, LOCKING_KEY),
                                Filters.eq(HOLDER_FIELD, holder)),
                            Updates.set(CREATED_AT_FIELD, new Date())))
            .orElseThrow(
                cause ->
                    MongoErrors.classify(
                        "Renewing advisory lock '" + lockCollection + "'", cause));
    if (renewed.getMatchedCount() == 0) {
      holdCount = 0;
      LOGGER.warn("Advisory lock '{}' of {} expired while held", lockCollection, holder);
      throw new LockLostException(lockCollection, holder);
    }
  }

  @Override
  public synchronized boolean isHeld() {
    return holdCount > 0;
  }

  String holder() {
    return holder;
  }

  private MongoCollection<Document> collection() {
    return connection
        .database()
        .getCollection(lockCollection)
        .withWriteConcern(MongoExecution.WRITE_CONCERN);
  }
}
