package mongrate.storage.mongo.command;

import com.google.common.collect.ImmutableList;
import com.google.common.io.ByteStreams;
import mongrate.api.MalformedScriptException;
import org.bson.BSONException;
import org.bson.BsonArray;
import org.bson.BsonDocument;
import org.bson.BsonType;
import org.bson.BsonValue;
import org.bson.codecs.BsonDocumentCodec;
import org.bson.codecs.DecoderContext;
import org.bson.json.JsonParseException;
import org.bson.json.JsonReader;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Decodes a migration script into {@link MongoCommand}s.
 *
 * <p>A script is an Extended JSON array of command documents, e.g.
 *
 * <pre>{@code
 * [
 *   {"create": "hello"},
 *   {"createIndexes": "hello", "indexes": [{"key": {"wild": 1}, "name": "unique_wild"}]},
 *   {"insert": "hello", "documents": [{"wild": "world"}]}
 * ]
 * }</pre>
 *
 * <p>The script must be UTF-8 and hold exactly one array. The codec checks structure only.
 * Known commands must carry the fields they cannot work without; unknown commands are kept as
 * {@link MongoCommand.Opaque} for the server to judge.
 */
public final class CommandCodec {

  private static final BsonDocumentCodec DOCUMENT_CODEC = new BsonDocumentCodec();

  /**
   * @return the commands in script order, empty for an empty array or a blank script
   * @throws MalformedScriptException if the script is not an array of command documents
   */
  public List<MongoCommand> decode(InputStream script) {
    byte[] bytes;
    try {
      bytes = ByteStreams.toByteArray(script);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to read migration script", e);
    }
    String json = utf8(bytes);
    if (json.isBlank()) {
      return ImmutableList.of();
    }

    ImmutableList.Builder<MongoCommand> commands = ImmutableList.builder();
    try (JsonReader reader = new JsonReader(json)) {
      BsonType topLevel = reader.readBsonType();
      if (topLevel != BsonType.ARRAY) {
        throw new MalformedScriptException(
            "Migration script must be an array of commands, found " + topLevel);
      }
      reader.readStartArray();
      int index = 0;
      while (reader.readBsonType() != BsonType.END_OF_DOCUMENT) {
        if (reader.getCurrentBsonType() != BsonType.DOCUMENT) {
          throw new MalformedScriptException(
              "Command #" + index + " must be a document, found " + reader.getCurrentBsonType());
        }
        BsonDocument document = DOCUMENT_CODEC.decode(reader, DecoderContext.builder().build());
        commands.add(toCommand(index, document));
        index++;
      }
      reader.readEndArray();
      BsonType trailing = reader.readBsonType();
      if (trailing != BsonType.END_OF_DOCUMENT) {
        throw new MalformedScriptException(
            "Migration script has content after the command array, found " + trailing);
      }
    } catch (JsonParseException | BSONException e) {
      throw new MalformedScriptException(
          "Migration script is not valid JSON: " + e.getMessage(), e);
    }
    return commands.build();
  }

  private static String utf8(byte[] bytes) {
    try {
      return StandardCharsets.UTF_8
          .newDecoder()
          .onMalformedInput(CodingErrorAction.REPORT)
          .onUnmappableCharacter(CodingErrorAction.REPORT)
          .decode(ByteBuffer.wrap(bytes))
          .toString();
    } catch (CharacterCodingException e) {
      throw new MalformedScriptException("Migration script is not valid UTF-8", e);
    }
  }

  public static MongoCommand toCommand(int index, BsonDocument document) {
    if (document.isEmpty()) {
      throw new MalformedScriptException("Command #" + index + " is an empty document");
    }
    String name = document.getFirstKey();
    return switch (name) {
      case "insert" -> new MongoCommand.Insert(
          collection(index, document),
          documents(index, document, "documents").size(),
          document);
      case "update" -> {
        documents(index, document, "updates");
        yield new MongoCommand.Update(collection(index, document), document);
      }
      case "delete" -> {
        documents(index, document, "deletes");
        yield new MongoCommand.Delete(collection(index, document), document);
      }
      case "create" -> new MongoCommand.Create(collection(index, document), document);
      case "createIndexes" -> new MongoCommand.CreateIndexes(
          collection(index, document),
          documents(index, document, "indexes").size(),
          document);
      case "drop" -> new MongoCommand.DropCollection(collection(index, document), document);
      case "dropIndexes" -> new MongoCommand.DropIndexes(collection(index, document), document);
      case "collMod" -> new MongoCommand.CollMod(collection(index, document), document);
      default -> new MongoCommand.Opaque(name, document);
    };
  }

  private static String collection(int index, BsonDocument document) {
    String name = document.getFirstKey();
    BsonValue value = document.get(name);
    if (!value.isString() || value.asString().getValue().isEmpty()) {
      throw new MalformedScriptException(
          "Command #" + index + " '" + name + "' must name a collection");
    }
    return value.asString().getValue();
  }

  private static BsonArray documents(int index, BsonDocument document, String field) {
    BsonValue value = document.get(field);
    if (value == null || !value.isArray()) {
      throw new MalformedScriptException(
          "Command #"
              + index
              + " '"
              + document.getFirstKey()
              + "' requires an array field '"
              + field
              + "'");
    }
    BsonArray array = value.asArray();
    for (BsonValue element : array) {
      if (!element.isDocument()) {
        throw new MalformedScriptException(
            "Command #" + index + " field '" + field + "' must contain documents only");
      }
    }
    return array;
  }
}
