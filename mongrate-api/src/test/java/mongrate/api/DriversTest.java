package mongrate.api;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DriversTest {

  @Test
  void schemeOfUrl() {
    assertThat(Drivers.schemeOf("mongodb://localhost:27017/app")).isEqualTo("mongodb");
    assertThat(Drivers.schemeOf("mongodb+srv://cluster.example.com/app")).isEqualTo("mongodb+srv");
  }

  @Test
  void urlWithoutSchemeIsRejected() {
    assertThatThrownBy(() -> Drivers.schemeOf("localhost:27017/app"))
        .isInstanceOf(ConfigException.class)
        .hasMessageContaining("no scheme");
    assertThatThrownBy(() -> Drivers.schemeOf("://localhost")).isInstanceOf(ConfigException.class);
    assertThatThrownBy(() -> Drivers.schemeOf("")).isInstanceOf(ConfigException.class);
    assertThatThrownBy(() -> Drivers.schemeOf(null)).isInstanceOf(ConfigException.class);
  }

  @Test
  void unknownSchemeIsRejected() {
    assertThatThrownBy(() -> Drivers.open("cassandra://localhost/app"))
        .isInstanceOf(ConfigException.class)
        .hasMessageContaining("cassandra");
  }
}
