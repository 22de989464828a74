package mongrate.api;

import java.util.Set;

/**
 * Opens drivers for the URL schemes it supports. Implementations are discovered through {@link
 * java.util.ServiceLoader}.
 */
public interface DriverProvider {

  /**
   * @return URL schemes handled by this provider, e.g. {@code mongodb}
   */
  Set<String> schemes();

  Driver open(String url);
}
