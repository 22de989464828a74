package mongrate.storage.mongo;

import com.google.errorprone.annotations.ThreadSafe;
import com.mongodb.MongoException;
import com.mongodb.client.ClientSession;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.MongoDatabase;
import com.mongodb.client.model.Filters;
import com.mongodb.client.model.ReplaceOptions;
import com.mongodb.client.result.UpdateResult;
import mongrate.api.DropException;
import mongrate.api.SchemaVersion;
import mongrate.api.version.VersionStore;
import mongrate.storage.mongo.command.MongoErrorCode;
import mongrate.storage.mongo.command.MongoErrors;
import mongrate.storage.mongo.command.MongoExecution;
import org.bson.BsonBoolean;
import org.bson.BsonDocument;
import org.bson.BsonInt64;
import org.bson.BsonString;
import org.bson.BsonValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Stores the schema version as one document of the migrations collection:
 *
 * <pre>{@code
 * {"_id": "schema_version", "version": 3, "dirty": false}
 * }</pre>
 */
@ThreadSafe
public class MongoVersionStore implements VersionStore {

  private static final Logger LOGGER = LoggerFactory.getLogger(MongoVersionStore.class);

  static final String VERSION_ID = "schema_version";
  static final String VERSION_FIELD = "version";
  static final String DIRTY_FIELD = "dirty";

  private static final String SYSTEM_PREFIX = "system.";

  private final MongoConnection connection;
  private final String migrationsCollection;

  public MongoVersionStore(MongoConnection connection, String migrationsCollection) {
    this.connection = connection;
    this.migrationsCollection = migrationsCollection;
  }

  @Override
  public SchemaVersion currentVersion() {
    BsonDocument record;
    try {
      record = collection().find(Filters.eq("_id", VERSION_ID)).first();
    } catch (MongoException e) {
      throw MongoErrors.classify("Reading the schema version", e);
    }
    return record == null ? SchemaVersion.nil() : toVersion(record);
  }

  static SchemaVersion toVersion(BsonDocument record) {
    BsonValue version = record.get(VERSION_FIELD);
    if (version == null || !version.isNumber()) {
      return SchemaVersion.nil();
    }
    boolean dirty = record.getBoolean(DIRTY_FIELD, BsonBoolean.FALSE).getValue();
    return new SchemaVersion(version.asNumber().longValue(), dirty);
  }

  static BsonDocument toRecord(SchemaVersion version) {
    return new BsonDocument("_id", new BsonString(VERSION_ID))
        .append(VERSION_FIELD, new BsonInt64(version.version()))
        .append(DIRTY_FIELD, BsonBoolean.valueOf(version.dirty()));
  }

  @Override
  public void setVersion(SchemaVersion version) {
    new MongoExecution<UpdateResult>(connection.client())
        .withoutTxn()
        .retryOnCode(MongoErrorCode.WRITE_CONFLICT)
        .execute(session -> replace(null, version))
        .orElseThrow(cause -> MongoErrors.classify("Writing schema version " + version, cause));
    LOGGER.info(
        "Set schema version of '{}' to {}{}",
        connection.databaseName(),
        version.version(),
        version.dirty() ? " (dirty)" : "");
  }

  /** Writes the version inside the transaction of {@code session}. Errors abort it. */
  public void setVersion(ClientSession session, SchemaVersion version) {
    replace(session, version);
  }

  private UpdateResult replace(ClientSession session, SchemaVersion version) {
    ReplaceOptions upsert = new ReplaceOptions().upsert(true);
    if (session == null) {
      return collection()
          .withWriteConcern(MongoExecution.WRITE_CONCERN)
          .replaceOne(Filters.eq("_id", VERSION_ID), toRecord(version), upsert);
    }
    // The transaction carries the write concern.
    return collection()
        .replaceOne(session, Filters.eq("_id", VERSION_ID), toRecord(version), upsert);
  }

  /** Creates the migrations collection if missing. Must run outside a transaction. */
  public void ensureCollection() {
    try {
      connection.database().createCollection(migrationsCollection);
      LOGGER.debug("Created migrations collection '{}'", migrationsCollection);
    } catch (MongoException e) {
      if (!MongoErrorCode.NAMESPACE_EXISTS.matches(e)) {
        throw MongoErrors.classify("Creating collection '" + migrationsCollection + "'", e);
      }
    }
  }

  /**
   * Drops every non-system collection of the database.
   *
   * @throws DropException if some collections could not be dropped; the others are gone
   */
  @Override
  public void drop() {
    MongoDatabase database = connection.database();
    List<String> names;
    try {
      names = database.listCollectionNames().into(new ArrayList<>());
    } catch (MongoException e) {
      throw MongoErrors.classify("Listing collections of '" + database.getName() + "'", e);
    }

    List<String> dropped = new ArrayList<>();
    Map<String, Throwable> failed = new LinkedHashMap<>();
    for (String name : names) {
      if (name.startsWith(SYSTEM_PREFIX)) continue;
      try {
        database.getCollection(name).drop();
        dropped.add(name);
      } catch (MongoException e) {
        failed.put(name, MongoErrors.classifyTransport("Dropping '" + name + "'", e));
      }
    }
    if (!failed.isEmpty()) {
      LOGGER.warn(
          "Dropped {} of '{}', failed to drop {}", dropped, database.getName(), failed.keySet());
      throw new DropException(dropped, failed);
    }
    LOGGER.info("Dropped {} collection(s) of '{}'", dropped.size(), database.getName());
  }

  public String getMigrationsCollection() {
    return migrationsCollection;
  }

  private MongoCollection<BsonDocument> collection() {
    return connection.database().getCollection(migrationsCollection, BsonDocument.class);
  }
}
