package mongrate.storage.mongo.command;

import org.bson.BsonDocument;

/**
 * One database command of a migration script.
 *
 * <p>Known command kinds get their own variant; anything else is carried as {@link Opaque} and
 * forwarded to the server unchanged. Every variant keeps the full command document as it was
 * decoded, which is what gets sent to the server.
 *
 * <p>{@link #structural()} commands change the schema (collections, indexes). MongoDB refuses them
 * inside a multi-document transaction.
 */
public sealed interface MongoCommand
    permits MongoCommand.Insert,
        MongoCommand.Update,
        MongoCommand.Delete,
        MongoCommand.Create,
        MongoCommand.CreateIndexes,
        MongoCommand.DropCollection,
        MongoCommand.DropIndexes,
        MongoCommand.CollMod,
        MongoCommand.Opaque {

  /**
   * @return the command name, the first key of the command document
   */
  String name();

  /**
   * @return a copy of the command document
   */
  BsonDocument document();

  default boolean structural() {
    return false;
  }

  record Insert(String collection, int documentCount, BsonDocument document)
      implements MongoCommand {
    public Insert {
      document = document.clone();
    }

    @Override
    public String name() {
      return "insert";
    }

    @Override
    public BsonDocument document() {
      return document.clone();
    }
  }

  record Update(String collection, BsonDocument document) implements MongoCommand {
    public Update {
      document = document.clone();
    }

    @Override
    public String name() {
      return "update";
    }

    @Override
    public BsonDocument document() {
      return document.clone();
    }
  }

  record Delete(String collection, BsonDocument document) implements MongoCommand {
    public Delete {
      document = document.clone();
    }

    @Override
    public String name() {
      return "delete";
    }

    @Override
    public BsonDocument document() {
      return document.clone();
    }
  }

  record Create(String collection, BsonDocument document) implements MongoCommand {
    public Create {
      document = document.clone();
    }

    @Override
    public String name() {
      return "create";
    }

    @Override
    public BsonDocument document() {
      return document.clone();
    }

    @Override
    public boolean structural() {
      return true;
    }
  }

  record CreateIndexes(String collection, int indexCount, BsonDocument document)
      implements MongoCommand {
    public CreateIndexes {
      document = document.clone();
    }

    @Override
    public String name() {
      return "createIndexes";
    }

    @Override
    public BsonDocument document() {
      return document.clone();
    }

    @Override
    public boolean structural() {
      return true;
    }
  }

  record DropCollection(String collection, BsonDocument document) implements MongoCommand {
    public DropCollection {
      document = document.clone();
    }

    @Override
    public String name() {
      return "drop";
    }

    @Override
    public BsonDocument document() {
      return document.clone();
    }

    @Override
    public boolean structural() {
      return true;
    }
  }

  record DropIndexes(String collection, BsonDocument document) implements MongoCommand {
    public DropIndexes {
      document = document.clone();
    }

    @Override
    public String name() {
      return "dropIndexes";
    }

    @Override
    public BsonDocument document() {
      return document.clone();
    }

    @Override
    public boolean structural() {
      return true;
    }
  }

  record CollMod(String collection, BsonDocument document) implements MongoCommand {
    public CollMod {
      document = document.clone();
    }

    @Override
    public String name() {
      return "collMod";
    }

    @Override
    public BsonDocument document() {
      return document.clone();
    }

    @Override
    public boolean structural() {
      return true;
    }
  }

  /** A command the codec does not know. The server decides whether it is valid. */
  record Opaque(String name, BsonDocument document) implements MongoCommand {
    public Opaque {
      document = document.clone();
    }

    @Override
    public BsonDocument document() {
      return document.clone();
    }
  }
}
