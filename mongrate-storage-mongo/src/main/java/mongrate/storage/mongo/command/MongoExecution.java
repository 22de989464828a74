package mongrate.storage.mongo.command;

import com.google.common.collect.ImmutableSet;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.mongodb.ClientSessionOptions;
import com.mongodb.MongoException;
import com.mongodb.ReadConcern;
import com.mongodb.ReadConcernLevel;
import com.mongodb.TransactionOptions;
import com.mongodb.WriteConcern;
import com.mongodb.client.ClientSession;
import com.mongodb.client.MongoClient;
import dev.failsafe.Failsafe;
import dev.failsafe.FailsafeException;
import dev.failsafe.Policy;
import dev.failsafe.RetryPolicy;
import dev.failsafe.Timeout;
import dev.failsafe.TimeoutExceededException;
import dev.failsafe.function.CheckedSupplier;
import mongrate.api.OperationTimeoutException;

import java.time.Duration;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Set;
import java.util.function.Function;

/**
 * Runs a unit of database work under Failsafe policies, optionally inside a multi-document
 * transaction.
 *
 * <p>The work receives the {@link ClientSession} of the transaction, or {@code null} when it runs
 * without one. Failures are returned, not thrown.
 *
 * @see TimeoutExceededException
 * @param <R> result of the work
 */
public class MongoExecution<R> {

  public static final WriteConcern WRITE_CONCERN = WriteConcern.MAJORITY;
  public static final ReadConcern READ_CONCERN = new ReadConcern(ReadConcernLevel.MAJORITY);
  public static final TransactionOptions TRANSACTION_OPTIONS =
      TransactionOptions.builder().writeConcern(WRITE_CONCERN).readConcern(READ_CONCERN).build();

  private static final ClientSessionOptions CLIENT_SESSION_OPTIONS =
      ClientSessionOptions.builder()
          .causallyConsistent(true)
          .defaultTransactionOptions(TRANSACTION_OPTIONS)
          .build();

  static final int MAX_RETRIES = 3;

  private final MongoClient client;
  private final List<Policy<Object>> policies = new ArrayList<>(4);

  private boolean txn;

  public MongoExecution(MongoClient client) {
    this.client = client;
  }

  /** Bounds the whole execution, retries included. Zero disables the bound. */
  @CanIgnoreReturnValue
  public MongoExecution<R> withTimeout(Duration timeout) {
    if (timeout.isZero() || timeout.isNegative()) return this;
    this.policies.add(Timeout.<Object>builder(timeout).withInterrupt().build());
    return this;
  }

  @CanIgnoreReturnValue
  public MongoExecution<R> withTxn() {
    this.txn = true;
    return this;
  }

  @CanIgnoreReturnValue
  public MongoExecution<R> withoutTxn() {
    this.txn = false;
    return this;
  }

  /** Retries the work a few times, with a short backoff, when it fails with one of the codes. */
  @CanIgnoreReturnValue
  public MongoExecution<R> retryOnCode(MongoErrorCode... codes) {
    Set<Integer> retryable =
        Arrays.stream(codes).map(MongoErrorCode::getCode).collect(ImmutableSet.toImmutableSet());
    this.policies.add(
        RetryPolicy.builder()
            .handleIf(
                throwable ->
                    throwable instanceof MongoException dbError
                        && retryable.contains(dbError.getCode()))
            .withMaxRetries(MAX_RETRIES)
            .withBackoff(10, 200, ChronoUnit.MILLIS)
            .build());
    return this;
  }

  public Result<R> execute(Function<ClientSession, R> command) {
    CheckedSupplier<R> block =
        () -> {
          if (txn) {
            try (ClientSession session = client.startSession(CLIENT_SESSION_OPTIONS)) {
              return session.withTransaction(() -> command.apply(session), TRANSACTION_OPTIONS);
            }
          }
          return command.apply(null);
        };
    try {
      if (policies.isEmpty()) {
        return new Result.Success<>(block.get());
      }
      return new Result.Success<>(Failsafe.with(policies).get(block));
    } catch (TimeoutExceededException timeout) {
      return new Result.Failure<>(
          new OperationTimeoutException(
              "Execution exceeded " + timeout.getTimeout().getConfig().getTimeout(), timeout));
    } catch (FailsafeException e) {
      return new Result.Failure<>(e.getCause() == null ? e : e.getCause());
    } catch (Throwable e) {
      return new Result.Failure<>(e);
    }
  }
}
