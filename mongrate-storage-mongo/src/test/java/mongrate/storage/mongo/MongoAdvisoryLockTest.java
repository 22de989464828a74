package mongrate.storage.mongo;

import com.mongodb.MongoCommandException;
import com.mongodb.MongoCredential;
import com.mongodb.MongoSecurityException;
import com.mongodb.MongoWriteException;
import com.mongodb.ServerAddress;
import com.mongodb.WriteConcern;
import com.mongodb.WriteError;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.MongoDatabase;
import com.mongodb.client.model.IndexOptions;
import com.mongodb.client.result.DeleteResult;
import com.mongodb.client.result.UpdateResult;
import mongrate.api.AuthenticationException;
import mongrate.api.LockHeldException;
import mongrate.api.LockLostException;
import org.bson.BsonDocument;
import org.bson.Document;
import org.bson.conversions.Bson;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class MongoAdvisoryLockTest {

  private static final String HOLDER = "host-1-test";

  @Mock private MongoClient client;
  @Mock private MongoDatabase database;
  @Mock private MongoCollection<Document> collection;

  private MongoAdvisoryLock lock;

  @BeforeEach
  void setUp() {
    when(client.getDatabase("app")).thenReturn(database);
    when(database.getCollection("migrate_advisory_lock")).thenReturn(collection);
    when(collection.withWriteConcern(any(WriteConcern.class))).thenReturn(collection);
    when(collection.createIndex(any(Bson.class), any(IndexOptions.class))).thenReturn("index");
    when(collection.deleteOne(any(Bson.class))).thenReturn(DeleteResult.acknowledged(1));
    when(collection.updateOne(any(Bson.class), any(Bson.class)))
        .thenReturn(UpdateResult.acknowledged(1, 1L, null));

    lock =
        new MongoAdvisoryLock(
            MongoConnection.adopt(client, "app"),
            "migrate_advisory_lock",
            Duration.ofSeconds(15),
            HOLDER);
  }

  @Test
  void acquireInsertsMarkerAfterEnsuringIndexes() {
    lock.acquire();

    ArgumentCaptor<IndexOptions> indexes = ArgumentCaptor.forClass(IndexOptions.class);
    verify(collection, times(2)).createIndex(any(Bson.class), indexes.capture());
    List<IndexOptions> options = indexes.getAllValues();
    assertThat(options.get(0).isUnique()).isTrue();
    assertThat(options.get(1).getExpireAfter(TimeUnit.SECONDS)).isEqualTo(15L);

    ArgumentCaptor<Document> marker = ArgumentCaptor.forClass(Document.class);
    verify(collection).insertOne(marker.capture());
    assertThat(marker.getValue())
        .containsEntry(MongoAdvisoryLock.LOCKING_KEY_FIELD, MongoAdvisoryLock.LOCKING_KEY)
        .containsEntry(MongoAdvisoryLock.HOLDER_FIELD, HOLDER)
        .containsKeys(
            MongoAdvisoryLock.PID_FIELD,
            MongoAdvisoryLock.HOSTNAME_FIELD,
            MongoAdvisoryLock.CREATED_AT_FIELD);
    assertThat(lock.isHeld()).isTrue();
  }

  @Test
  void duplicateMarkerMeansHeld() {
    when(collection.insertOne(any(Document.class)))
        .thenThrow(
            new MongoWriteException(
                new WriteError(11000, "E11000 duplicate key error", new BsonDocument()),
                new ServerAddress()));

    assertThatThrownBy(lock::acquire)
        .isInstanceOf(LockHeldException.class)
        .hasMessageContaining("migrate_advisory_lock");
    assertThat(lock.isHeld()).isFalse();
  }

  @Test
  void reentrantAcquireDeletesOnLastRelease() {
    lock.acquire();
    lock.acquire();

    lock.release();
    verify(collection, never()).deleteOne(any(Bson.class));
    assertThat(lock.isHeld()).isTrue();

    lock.release();
    verify(collection, times(1)).insertOne(any(Document.class));
    verify(collection, times(1)).deleteOne(any(Bson.class));
    assertThat(lock.isHeld()).isFalse();
  }

  @Test
  void releaseIsIdempotent() {
    lock.release();

    lock.acquire();
    lock.release();
    lock.release();

    verify(collection, times(1)).deleteOne(any(Bson.class));
  }

  @Test
  void releaseToleratesExpiredMarker() {
    when(collection.deleteOne(any(Bson.class))).thenReturn(DeleteResult.acknowledged(0));

    lock.acquire();
    lock.release();

    assertThat(lock.isHeld()).isFalse();
  }

  @Test
  void conflictingIndexIsKept() {
    when(collection.createIndex(any(Bson.class), any(IndexOptions.class)))
        .thenReturn("index")
        .thenThrow(
            new MongoCommandException(
                BsonDocument.parse(
                    "{\"ok\": 0, \"code\": 85, \"errmsg\": \"Index already exists with different"
                        + " options\"}"),
                new ServerAddress()));

    lock.acquire();

    assertThat(lock.isHeld()).isTrue();
  }

  @Test
  void authenticationFailureIsClassified() {
    when(collection.createIndex(any(Bson.class), any(IndexOptions.class)))
        .thenThrow(
            new MongoSecurityException(
                MongoCredential.createScramSha256Credential("wrong", "app", "auth".toCharArray()),
                "Exception authenticating"));

    assertThatThrownBy(lock::acquire).isInstanceOf(AuthenticationException.class);
    verify(collection, never()).insertOne(any(Document.class));
  }

  @Test
  void renewRestartsTheMarkerTtl() {
    lock.acquire();
    lock.renew();

    ArgumentCaptor<Bson> filter = ArgumentCaptor.forClass(Bson.class);
    ArgumentCaptor<Bson> update = ArgumentCaptor.forClass(Bson.class);
    verify(collection).updateOne(filter.capture(), update.capture());
    assertThat(filter.getValue().toBsonDocument().toJson())
        .contains(MongoAdvisoryLock.LOCKING_KEY_FIELD)
        .contains(HOLDER);
    assertThat(update.getValue().toBsonDocument().getDocument("$set"))
        .containsKey(MongoAdvisoryLock.CREATED_AT_FIELD);
    assertThat(lock.isHeld()).isTrue();
  }

  @Test
  void renewWithoutHoldingDoesNothing() {
    lock.renew();

    verify(collection, never()).updateOne(any(Bson.class), any(Bson.class));
  }

  @Test
  void expiredMarkerIsReportedOnRenew() {
    when(collection.updateOne(any(Bson.class), any(Bson.class)))
        .thenReturn(UpdateResult.acknowledged(0, 0L, null));

    lock.acquire();

    assertThatThrownBy(lock::renew)
        .isInstanceOfSatisfying(
            LockLostException.class,
            e -> assertThat(e.getLockName()).isEqualTo("migrate_advisory_lock"));
    assertThat(lock.isHeld()).isFalse();

    lock.release();
    verify(collection, never()).deleteOne(any(Bson.class));
  }

  @Test
  void releaseAllDeletesTheMarkerOfAReentrantHold() {
    lock.acquire();
    lock.acquire();
    lock.acquire();

    lock.releaseAll();

    verify(collection, times(1)).deleteOne(any(Bson.class));
    assertThat(lock.isHeld()).isFalse();
    lock.releaseAll();
    verify(collection, times(1)).deleteOne(any(Bson.class));
  }
}
