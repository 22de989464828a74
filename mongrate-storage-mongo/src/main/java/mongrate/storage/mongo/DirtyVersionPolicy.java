package mongrate.storage.mongo;

/** Which version is recorded as dirty when a non-transactional migration does not complete. */
public enum DirtyVersionPolicy {
  /** The version the script was migrating to. */
  TARGET,
  /** The version applied before the run started. */
  PREVIOUS
}
