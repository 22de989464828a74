package mongrate.storage.mongo;

import com.google.auto.service.AutoService;
import com.google.common.collect.ImmutableSet;
import mongrate.api.Driver;
import mongrate.api.DriverProvider;

import java.util.Set;

@AutoService(DriverProvider.class)
public class MongoDriverProvider implements DriverProvider {

  private static final ImmutableSet<String> SCHEMES = ImmutableSet.of("mongodb", "mongodb+srv");

  @Override
  public Set<String> schemes() {
    return SCHEMES;
  }

  @Override
  public Driver open(String url) {
    return MongoDriver.open(url);
  }
}
