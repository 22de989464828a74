package mongrate.storage.mongo.command;

import com.mongodb.MongoCommandException;
import com.mongodb.client.MongoDatabase;
import org.bson.BsonDocument;
import org.bson.BsonInt32;
import org.bson.BsonString;

/**
 * Whether a deployment supports multi-document transactions.
 *
 * <p>Replica sets support them from wire version 7 (MongoDB 4.0), sharded clusters from wire
 * version 8 (MongoDB 4.2). Standalone servers never do.
 */
public enum TransactionCapability {
  SUPPORTED,
  UNSUPPORTED;

  static final int MIN_REPLICA_SET_WIRE_VERSION = 7;
  static final int MIN_SHARDED_WIRE_VERSION = 8;

  /**
   * Asks the server with {@code hello}, falling back to {@code isMaster} on servers that predate
   * it. Neither command requires authentication.
   */
  public static TransactionCapability probe(MongoDatabase admin) {
    BsonDocument hello;
    try {
      hello = admin.runCommand(new BsonDocument("hello", new BsonInt32(1)), BsonDocument.class);
    } catch (MongoCommandException e) {
      if (!MongoErrorCode.COMMAND_NOT_FOUND.matches(e)) throw e;
      hello = admin.runCommand(new BsonDocument("isMaster", new BsonInt32(1)), BsonDocument.class);
    }
    return fromHello(hello);
  }

  static TransactionCapability fromHello(BsonDocument hello) {
    if (!hello.containsKey("logicalSessionTimeoutMinutes")) {
      return UNSUPPORTED;
    }
    int wireVersion = hello.getNumber("maxWireVersion", new BsonInt32(0)).intValue();
    boolean replicaSet = hello.containsKey("setName");
    boolean mongos = "isdbgrid".equals(hello.getString("msg", new BsonString("")).getValue());
    if (replicaSet && wireVersion >= MIN_REPLICA_SET_WIRE_VERSION) return SUPPORTED;
    if (mongos && wireVersion >= MIN_SHARDED_WIRE_VERSION) return SUPPORTED;
    return UNSUPPORTED;
  }
}
