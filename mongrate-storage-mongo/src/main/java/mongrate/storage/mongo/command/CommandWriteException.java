package mongrate.storage.mongo.command;

import com.mongodb.MongoException;
import org.bson.BsonArray;
import org.bson.BsonDocument;
import org.bson.BsonInt32;
import org.bson.BsonString;

/**
 * A write command returned {@code ok: 1} but reported write errors or a write concern error in its
 * response. {@code runCommand} does not raise these by itself.
 */
public class CommandWriteException extends MongoException {

  private final transient BsonDocument response;

  public CommandWriteException(int code, String message, BsonDocument response) {
    super(code, message);
    this.response = response;
  }

  public BsonDocument getResponse() {
    return response;
  }

  /**
   * @throws CommandWriteException if {@code response} carries a write error or a write concern
   *     error; the first write error decides the code
   */
  public static void check(String commandName, BsonDocument response) {
    BsonArray writeErrors = response.getArray("writeErrors", new BsonArray());
    if (!writeErrors.isEmpty()) {
      BsonDocument first = writeErrors.get(0).asDocument();
      throw new CommandWriteException(
          first.getNumber("code", new BsonInt32(MongoErrorCode.UNKNOWN_ERROR.getCode())).intValue(),
          "'"
              + commandName
              + "' reported "
              + writeErrors.size()
              + " write error(s), first: "
              + first.getString("errmsg", new BsonString("")).getValue(),
          response);
    }
    BsonDocument writeConcernError = response.getDocument("writeConcernError", null);
    if (writeConcernError != null) {
      throw new CommandWriteException(
          writeConcernError
              .getNumber("code", new BsonInt32(MongoErrorCode.UNKNOWN_ERROR.getCode()))
              .intValue(),
          "'"
              + commandName
              + "' reported a write concern error: "
              + writeConcernError.getString("errmsg", new BsonString("")).getValue(),
          response);
    }
  }
}
