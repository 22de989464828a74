package mongrate.storage.mongo;

public interface MigrationCollectionNamespace {

  String MIGRATIONS_NAMESPACE = "schema_migrations";
  String ADVISORY_LOCK_NAMESPACE = "migrate_advisory_lock";
}
