package mongrate.test;

import mongrate.api.AuthenticationException;
import mongrate.api.Driver;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DeferredAuthenticationTest extends BaseTest {

  private static final String INSERT =
      "[{\"insert\": \"hello\", \"documents\": [{\"wild\": \"world\"}]}]";

  @BeforeEach
  void createUser() {
    open(url(""))
        .run(
            script(
                "[{\"createUser\": \"deminem\", \"pwd\": \"gogo\","
                    + " \"roles\": [{\"role\": \"readWrite\", \"db\": \""
                    + databaseName
                    + "\"}]}]"));
  }

  @Test
  void rightCredentials() {
    Driver driver = open(hostUrl("deminem:gogo@") + "/" + databaseName + "?connect=single");

    driver.run(script(INSERT));

    assertThat(count("hello")).isEqualTo(1);
  }

  @Test
  void wrongCredentialsFailOnFirstUseNotOnOpen() {
    Driver driver = open(hostUrl("wrong:auth@") + "/" + databaseName + "?connect=single");

    assertThatThrownBy(() -> driver.run(script(INSERT)))
        .isInstanceOf(AuthenticationException.class);
    assertThat(count("hello")).isZero();
  }
}
