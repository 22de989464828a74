package mongrate.storage.mongo.internal;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.UUID;

public final class HolderIds {

  private static final String UNKNOWN_HOST = "unknown-host";

  private HolderIds() {}

  public static long pid() {
    return ProcessHandle.current().pid();
  }

  public static String hostname() {
    try {
      return InetAddress.getLocalHost().getHostName();
    } catch (UnknownHostException e) {
      return UNKNOWN_HOST;
    }
  }

  /**
   * @return an id unique to one lock instance: host, process and a random suffix
   */
  public static String newHolderId() {
    return String.format("%s-%d-%s", hostname(), pid(), UUID.randomUUID());
  }
}
