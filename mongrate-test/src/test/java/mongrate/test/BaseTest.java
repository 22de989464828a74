package mongrate.test;

import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoClients;
import mongrate.api.Driver;
import mongrate.api.Drivers;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.testcontainers.containers.MongoDBContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Base class of the integration tests. The container runs MongoDB as a single-node replica set, so
 * transactions are available. Every test gets its own database.
 */
@Testcontainers(disabledWithoutDocker = true)
public abstract class BaseTest {

  @Container
  protected static final MongoDBContainer MONGO = new MongoDBContainer("mongo:7.0");

  protected MongoClient mongoClient;
  protected String databaseName;

  private final List<Driver> drivers = new ArrayList<>();

  @BeforeEach
  void setUp() {
    databaseName = "migrate_" + UUID.randomUUID().toString().substring(0, 8);
    mongoClient = MongoClients.create(hostUrl("") + "/?directConnection=true");
  }

  @AfterEach
  void tearDown() {
    drivers.forEach(Driver::close);
    if (mongoClient != null) {
      mongoClient.getDatabase(databaseName).drop();
      mongoClient.close();
    }
  }

  /** Host and port, with optional {@code user:password@} credentials, without a path. */
  protected static String hostUrl(String credentials) {
    return "mongodb://" + credentials + MONGO.getHost() + ":" + MONGO.getFirstMappedPort();
  }

  /** URL of the test database; {@code options} are appended to the query, e.g. {@code &x-...}. */
  protected String url(String options) {
    return hostUrl("") + "/" + databaseName + "?connect=single" + options;
  }

  /** Opens a driver through the registry and closes it after the test. */
  protected Driver open(String url) {
    Driver driver = Drivers.open(url);
    drivers.add(driver);
    return driver;
  }

  protected long count(String collection) {
    return mongoClient.getDatabase(databaseName).getCollection(collection).countDocuments();
  }

  protected static InputStream script(String json) {
    return new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8));
  }
}
