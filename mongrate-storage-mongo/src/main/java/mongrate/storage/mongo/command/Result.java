package mongrate.storage.mongo.command;

import java.util.function.Function;

/** Outcome of a {@link MongoExecution}: the value of the work, or the failure that ended it. */
public sealed interface Result<T> permits Result.Success, Result.Failure {

  /**
   * @param classifier turns the failure into the exception to throw
   * @return the value of a successful execution
   */
  default T orElseThrow(Function<Throwable, ? extends RuntimeException> classifier) {
    if (this instanceof Result.Failure<T> failure) {
      throw classifier.apply(failure.cause());
    }
    return ((Result.Success<T>) this).value();
  }

  record Success<T>(T value) implements Result<T> {}

  record Failure<T>(Throwable cause) implements Result<T> {}
}
