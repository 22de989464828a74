package mongrate.api;

/**
 * The migration version currently applied to a database.
 *
 * @param version the applied version, or {@link #NIL_VERSION} if none was ever applied
 * @param dirty true if a run was interrupted and the state relative to {@code version} is
 *     unverified
 */
public record SchemaVersion(long version, boolean dirty) {

  public static final long NIL_VERSION = -1L;

  private static final SchemaVersion NIL = new SchemaVersion(NIL_VERSION, false);

  public static SchemaVersion nil() {
    return NIL;
  }

  public boolean isNil() {
    return version == NIL_VERSION;
  }
}
