package mongrate.api;

/**
 * A command of a migration script failed.
 *
 * <p>{@link #isDirty()} tells the two outcomes apart: {@code false} means the run left no trace
 * (transactional mode aborted the whole batch), {@code true} means some effects may have been
 * applied and the version record was marked dirty.
 */
public class CommandException extends MigrateException {

  /** Index used when the failure is not attributable to a single command, e.g. a failed commit. */
  public static final int NO_INDEX = -1;

  private final int index;
  private final String commandName;
  private final boolean dirty;

  public CommandException(int index, String commandName, boolean dirty, Throwable cause) {
    super(describe(index, commandName, dirty, cause), cause);
    this.index = index;
    this.commandName = commandName;
    this.dirty = dirty;
  }

  private static String describe(int index, String commandName, boolean dirty, Throwable cause) {
    String where =
        index == NO_INDEX
            ? "Migration batch failed"
            : "Command #" + index + " '" + commandName + "' failed";
    return where
        + (dirty ? " (database is dirty)" : " (no changes applied)")
        + ": "
        + (cause == null ? "unknown cause" : cause.getMessage());
  }

  public int getIndex() {
    return index;
  }

  public String getCommandName() {
    return commandName;
  }

  public boolean isDirty() {
    return dirty;
  }
}
