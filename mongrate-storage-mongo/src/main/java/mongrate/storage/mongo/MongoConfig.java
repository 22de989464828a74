package mongrate.storage.mongo;

import com.google.common.base.Strings;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.google.errorprone.annotations.Immutable;
import mongrate.api.ConfigException;

import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Settings of a {@link MongoDriver}.
 *
 * <p>Built with {@link #builder()} or from a string map with {@link #fromMap(Map)}. Unknown map
 * keys are rejected.
 */
@Immutable
public final class MongoConfig {

  public static final String DATABASE_NAME = "databaseName";
  public static final String MIGRATIONS_COLLECTION = "migrationsCollection";
  public static final String TRANSACTION_MODE = "transactionMode";
  public static final String ADVISORY_LOCKING = "advisoryLocking";
  public static final String LOCK_COLLECTION = "lockCollection";
  public static final String LOCKING_TIMEOUT = "lockingTimeout";
  public static final String MIGRATION_TIMEOUT = "migrationTimeout";
  public static final String DIRTY_VERSION_POLICY = "dirtyVersionPolicy";

  public static final Duration DEFAULT_LOCKING_TIMEOUT = Duration.ofSeconds(15);

  private final String databaseName;
  private final String migrationsCollection;
  private final boolean transactionMode;
  private final boolean advisoryLocking;
  private final String lockCollection;

  private final Duration lockingTimeout;
  private final Duration migrationTimeout;

  private final DirtyVersionPolicy dirtyVersionPolicy;

  private MongoConfig(Builder builder) {
    this.databaseName = builder.databaseName;
    this.migrationsCollection = builder.migrationsCollection;
    this.transactionMode = builder.transactionMode;
    this.advisoryLocking = builder.advisoryLocking;
    this.lockCollection = builder.lockCollection;
    this.lockingTimeout = builder.lockingTimeout;
    this.migrationTimeout = builder.migrationTimeout;
    this.dirtyVersionPolicy = builder.dirtyVersionPolicy;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Builds a config from string options. Durations are whole seconds.
   *
   * @throws ConfigException on an unknown key or a value that does not parse
   */
  public static MongoConfig fromMap(Map<String, String> options) {
    Builder builder = builder();
    for (Map.Entry<String, String> option : options.entrySet()) {
      String key = option.getKey();
      String value = option.getValue();
      switch (key) {
        case DATABASE_NAME -> builder.databaseName(value);
        case MIGRATIONS_COLLECTION -> builder.migrationsCollection(value);
        case TRANSACTION_MODE -> builder.transactionMode(parseBoolean(key, value));
        case ADVISORY_LOCKING -> builder.advisoryLocking(parseBoolean(key, value));
        case LOCK_COLLECTION -> builder.lockCollection(value);
        case LOCKING_TIMEOUT -> builder.lockingTimeout(parseSeconds(key, value));
        case MIGRATION_TIMEOUT -> builder.migrationTimeout(parseSeconds(key, value));
        case DIRTY_VERSION_POLICY -> builder.dirtyVersionPolicy(parsePolicy(key, value));
        default -> throw new ConfigException("Unrecognized option '" + key + "'");
      }
    }
    return builder.build();
  }

  private static boolean parseBoolean(String key, String value) {
    if ("true".equalsIgnoreCase(value)) return true;
    if ("false".equalsIgnoreCase(value)) return false;
    throw new ConfigException("Option '" + key + "' expects true or false, got '" + value + "'");
  }

  private static Duration parseSeconds(String key, String value) {
    try {
      return Duration.ofSeconds(Long.parseLong(value.trim()));
    } catch (NumberFormatException e) {
      throw new ConfigException("Option '" + key + "' expects seconds, got '" + value + "'", e);
    }
  }

  private static DirtyVersionPolicy parsePolicy(String key, String value) {
    try {
      return DirtyVersionPolicy.valueOf(value.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new ConfigException(
          "Option '" + key + "' expects target or previous, got '" + value + "'", e);
    }
  }

  public String getDatabaseName() {
    return databaseName;
  }

  public String getMigrationsCollection() {
    return migrationsCollection;
  }

  public boolean isTransactionMode() {
    return transactionMode;
  }

  public boolean isAdvisoryLocking() {
    return advisoryLocking;
  }

  public String getLockCollection() {
    return lockCollection;
  }

  public Duration getLockingTimeout() {
    return lockingTimeout;
  }

  /**
   * @return upper bound of one run, {@link Duration#ZERO} for none
   */
  public Duration getMigrationTimeout() {
    return migrationTimeout;
  }

  public DirtyVersionPolicy getDirtyVersionPolicy() {
    return dirtyVersionPolicy;
  }

  @Override
  public String toString() {
    return "MongoConfig{"
        + "databaseName='"
        + databaseName
        + '\''
        + ", migrationsCollection='"
        + migrationsCollection
        + '\''
        + ", transactionMode="
        + transactionMode
        + ", advisoryLocking="
        + advisoryLocking
        + ", lockCollection='"
        + lockCollection
        + '\''
        + ", lockingTimeout="
        + lockingTimeout
        + ", migrationTimeout="
        + migrationTimeout
        + ", dirtyVersionPolicy="
        + dirtyVersionPolicy
        + '}';
  }

  public static final class Builder {
    private String databaseName;
    private String migrationsCollection = MigrationCollectionNamespace.MIGRATIONS_NAMESPACE;
    private boolean transactionMode;
    private boolean advisoryLocking = true;
    private String lockCollection = MigrationCollectionNamespace.ADVISORY_LOCK_NAMESPACE;
    private Duration lockingTimeout = DEFAULT_LOCKING_TIMEOUT;
    private Duration migrationTimeout = Duration.ZERO;
    private DirtyVersionPolicy dirtyVersionPolicy = DirtyVersionPolicy.TARGET;

    private Builder() {}

    @CanIgnoreReturnValue
    public Builder databaseName(String databaseName) {
      this.databaseName = databaseName;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder migrationsCollection(String migrationsCollection) {
      this.migrationsCollection = migrationsCollection;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder transactionMode(boolean transactionMode) {
      this.transactionMode = transactionMode;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder advisoryLocking(boolean advisoryLocking) {
      this.advisoryLocking = advisoryLocking;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder lockCollection(String lockCollection) {
      this.lockCollection = lockCollection;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder lockingTimeout(Duration lockingTimeout) {
      this.lockingTimeout = lockingTimeout;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder migrationTimeout(Duration migrationTimeout) {
      this.migrationTimeout = migrationTimeout;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder dirtyVersionPolicy(DirtyVersionPolicy dirtyVersionPolicy) {
      this.dirtyVersionPolicy = dirtyVersionPolicy;
      return this;
    }

    /**
     * @throws ConfigException if a setting is missing or inconsistent
     */
    public MongoConfig build() {
      if (Strings.isNullOrEmpty(databaseName) || databaseName.isBlank()) {
        throw new ConfigException("Option '" + DATABASE_NAME + "' is required");
      }
      requireName(MIGRATIONS_COLLECTION, migrationsCollection);
      requireName(LOCK_COLLECTION, lockCollection);
      if (migrationsCollection.equals(lockCollection)) {
        throw new ConfigException(
            "Migrations and lock collections must differ, both are '" + lockCollection + "'");
      }
      requireNonNegative(LOCKING_TIMEOUT, lockingTimeout);
      requireNonNegative(MIGRATION_TIMEOUT, migrationTimeout);
      if (lockingTimeout.getSeconds() == 0) {
        throw new ConfigException("Option '" + LOCKING_TIMEOUT + "' must be at least one second");
      }
      Objects.requireNonNull(dirtyVersionPolicy, DIRTY_VERSION_POLICY);
      return new MongoConfig(this);
    }

    private static void requireName(String key, String value) {
      if (Strings.isNullOrEmpty(value) || value.isBlank()) {
        throw new ConfigException("Option '" + key + "' must not be blank");
      }
      if (value.startsWith("system.") || value.contains("$")) {
        throw new ConfigException("Option '" + key + "' is not a valid collection name: " + value);
      }
    }

    private static void requireNonNegative(String key, Duration value) {
      if (value == null || value.isNegative()) {
        throw new ConfigException("Option '" + key + "' must not be negative");
      }
    }
  }
}
