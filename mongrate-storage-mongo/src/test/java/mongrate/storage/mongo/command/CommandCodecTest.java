package mongrate.storage.mongo.command;

import mongrate.api.MalformedScriptException;
import org.bson.BsonString;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CommandCodecTest {

  private final CommandCodec codec = new CommandCodec();

  private static InputStream script(String json) {
    return new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8));
  }

  @Test
  void decodesCommandsInScriptOrder() {
    List<MongoCommand> commands =
        codec.decode(
            script(
                """
                [
                  {"create": "hello"},
                  {"createIndexes": "hello",
                   "indexes": [{"key": {"wild": 1}, "name": "unique_wild", "unique": true}]},
                  {"insert": "hello", "documents": [{"wild": "world"}, {"wild": "west"}]},
                  {"update": "hello",
                   "updates": [{"q": {"wild": "west"}, "u": {"$set": {"x": 1}}}]},
                  {"delete": "hello", "deletes": [{"q": {"wild": "world"}, "limit": 1}]},
                  {"collMod": "hello", "validationLevel": "moderate"},
                  {"dropIndexes": "hello", "index": "unique_wild"},
                  {"drop": "hello"}
                ]
                """));

    assertThat(commands)
        .extracting(MongoCommand::name)
        .containsExactly(
            "create", "createIndexes", "insert", "update", "delete", "collMod", "dropIndexes",
            "drop");
    assertThat(commands.get(1)).isInstanceOf(MongoCommand.CreateIndexes.class);
    assertThat(((MongoCommand.CreateIndexes) commands.get(1)).indexCount()).isEqualTo(1);
    MongoCommand.Insert insert = (MongoCommand.Insert) commands.get(2);
    assertThat(insert.collection()).isEqualTo("hello");
    assertThat(insert.documentCount()).isEqualTo(2);
    assertThat(commands)
        .filteredOn(MongoCommand::structural)
        .extracting(MongoCommand::name)
        .containsExactly("create", "createIndexes", "collMod", "dropIndexes", "drop");
  }

  @Test
  void unknownCommandsAreKeptVerbatim() {
    List<MongoCommand> commands =
        codec.decode(
            script(
                "[{\"createUser\": \"deminem\", \"pwd\": \"gogo\","
                    + " \"roles\": [{\"role\": \"readWrite\", \"db\": \"app\"}]}]"));

    assertThat(commands).hasSize(1);
    MongoCommand command = commands.get(0);
    assertThat(command).isInstanceOf(MongoCommand.Opaque.class);
    assertThat(command.name()).isEqualTo("createUser");
    assertThat(command.document().getString("pwd").getValue()).isEqualTo("gogo");
    assertThat(command.structural()).isFalse();
  }

  @Test
  void extendedJsonValuesSurvive() {
    List<MongoCommand> commands =
        codec.decode(
            script(
                "[{\"insert\": \"events\", \"documents\": [{"
                    + "\"at\": {\"$date\": \"2020-01-01T00:00:00Z\"},"
                    + " \"n\": {\"$numberLong\": \"42\"}}]}]"));

    var document = commands.get(0).document().getArray("documents").get(0).asDocument();
    assertThat(document.get("at").isDateTime()).isTrue();
    assertThat(document.get("n").isInt64()).isTrue();
  }

  @Test
  void commandDocumentsAreCopies() {
    MongoCommand command = codec.decode(script("[{\"drop\": \"hello\"}]")).get(0);

    command.document().put("drop", new BsonString("other"));

    assertThat(command.document().getString("drop").getValue()).isEqualTo("hello");
  }

  @Test
  void blankScriptAndEmptyArrayDecodeToNothing() {
    assertThat(codec.decode(script(""))).isEmpty();
    assertThat(codec.decode(script("  \n"))).isEmpty();
    assertThat(codec.decode(script("[]"))).isEmpty();
  }

  @Test
  void topLevelMustBeAnArray() {
    assertThatThrownBy(() -> codec.decode(script("{\"insert\": \"hello\"}")))
        .isInstanceOf(MalformedScriptException.class)
        .hasMessageContaining("array");
  }

  @Test
  void elementsMustBeDocuments() {
    assertThatThrownBy(() -> codec.decode(script("[{\"drop\": \"a\"}, 42]")))
        .isInstanceOf(MalformedScriptException.class)
        .hasMessageContaining("Command #1");
  }

  @Test
  void invalidJsonIsMalformed() {
    assertThatThrownBy(() -> codec.decode(script("[{\"insert\": ")))
        .isInstanceOf(MalformedScriptException.class);
  }

  @Test
  void contentAfterTheArrayIsMalformed() {
    assertThatThrownBy(
            () ->
                codec.decode(
                    script(
                        "[{\"insert\": \"a\", \"documents\": [{\"x\": 1}]}]"
                            + " {\"drop\": \"a\"} garbage")))
        .isInstanceOf(MalformedScriptException.class);
    assertThatThrownBy(() -> codec.decode(script("[{\"drop\": \"a\"}] [{\"drop\": \"b\"}]")))
        .isInstanceOf(MalformedScriptException.class)
        .hasMessageContaining("after the command array");
  }

  @Test
  void trailingWhitespaceIsAllowed() {
    assertThat(codec.decode(script("[{\"drop\": \"a\"}]\n\n  "))).hasSize(1);
  }

  @Test
  void invalidUtf8IsMalformed() {
    byte[] latin1 =
        "[{\"insert\": \"a\", \"documents\": [{\"name\": \"café\"}]}]"
            .getBytes(StandardCharsets.ISO_8859_1);

    assertThatThrownBy(() -> codec.decode(new ByteArrayInputStream(latin1)))
        .isInstanceOf(MalformedScriptException.class)
        .hasMessageContaining("UTF-8");
  }

  @Test
  void utf8TextSurvivesDecoding() {
    MongoCommand command =
        codec.decode(
                script("[{\"insert\": \"a\", \"documents\": [{\"name\": \"café\"}]}]"))
            .get(0);

    assertThat(
            command.document().getArray("documents").get(0).asDocument().getString("name"))
        .isEqualTo(new BsonString("café"));
  }

  @Test
  void emptyCommandDocumentIsMalformed() {
    assertThatThrownBy(() -> codec.decode(script("[{}]")))
        .isInstanceOf(MalformedScriptException.class)
        .hasMessageContaining("empty");
  }

  @Test
  void knownCommandsNeedTheirFields() {
    assertThatThrownBy(() -> codec.decode(script("[{\"insert\": \"hello\"}]")))
        .isInstanceOf(MalformedScriptException.class)
        .hasMessageContaining("documents");
    assertThatThrownBy(
            () -> codec.decode(script("[{\"insert\": \"hello\", \"documents\": [1, 2]}]")))
        .isInstanceOf(MalformedScriptException.class)
        .hasMessageContaining("documents only");
    assertThatThrownBy(() -> codec.decode(script("[{\"createIndexes\": \"hello\"}]")))
        .isInstanceOf(MalformedScriptException.class)
        .hasMessageContaining("indexes");
    assertThatThrownBy(() -> codec.decode(script("[{\"drop\": 1}]")))
        .isInstanceOf(MalformedScriptException.class)
        .hasMessageContaining("must name a collection");
  }
}
