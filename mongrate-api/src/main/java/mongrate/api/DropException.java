package mongrate.api;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import java.util.List;
import java.util.Map;

/** Teardown did not complete. Reports what was dropped and what was not. */
public class DropException extends MigrateException {

  private final ImmutableList<String> dropped;
  private final ImmutableMap<String, Throwable> failed;

  public DropException(List<String> dropped, Map<String, Throwable> failed) {
    super("Dropped " + dropped + " but failed to drop " + failed.keySet());
    this.dropped = ImmutableList.copyOf(dropped);
    this.failed = ImmutableMap.copyOf(failed);
    failed.values().forEach(this::addSuppressed);
  }

  public List<String> getDropped() {
    return dropped;
  }

  public Map<String, Throwable> getFailed() {
    return failed;
  }
}
