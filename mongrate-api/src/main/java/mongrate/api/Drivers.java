package mongrate.api;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableMap;

import java.util.Map;
import java.util.ServiceLoader;

/** Entry point that opens a {@link Driver} for a database URL by its scheme. */
public final class Drivers {

  private Drivers() {}

  public static Driver open(String url) {
    String scheme = schemeOf(url);
    DriverProvider provider = discover().get(scheme);
    if (provider == null) {
      throw new ConfigException("No migration driver registered for scheme '" + scheme + "'");
    }
    return provider.open(url);
  }

  /**
   * @return registered providers keyed by scheme
   */
  public static Map<String, DriverProvider> discover() {
    ImmutableMap.Builder<String, DriverProvider> registry = ImmutableMap.builder();
    for (DriverProvider provider : ServiceLoader.load(DriverProvider.class)) {
      provider.schemes().forEach(scheme -> registry.put(scheme, provider));
    }
    return registry.buildKeepingLast();
  }

  @VisibleForTesting
  static String schemeOf(String url) {
    if (Strings.isNullOrEmpty(url)) {
      throw new ConfigException("Database URL is empty");
    }
    int idx = url.indexOf("://");
    if (idx <= 0) {
      throw new ConfigException("Database URL has no scheme: " + url);
    }
    return url.substring(0, idx);
  }
}
