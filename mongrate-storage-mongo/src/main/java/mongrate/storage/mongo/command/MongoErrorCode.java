package mongrate.storage.mongo.command;

import com.mongodb.MongoException;

import java.util.Arrays;

/** <a href="https://www.mongodb.com/docs/manual/reference/error-codes/">MongoDB Error Code </a> */
public enum MongoErrorCode {
  UNKNOWN_ERROR(8, "UnknownError"),
  INTERNAL_ERROR(1, "InternalError"),
  BAD_VALUE(2, "BadValue"),
  HOST_UNREACHABLE(6, "HostUnreachable"),
  HOST_NOT_FOUND(7, "HostNotFound"),
  UNAUTHORIZED(13, "Unauthorized"),
  AUTHENTICATION_FAILED(18, "AuthenticationFailed"),
  LOCK_TIMEOUT(24, "LockTimeout"),
  NAMESPACE_NOT_FOUND(26, "NamespaceNotFound"),
  LOCK_BUSY(46, "LockBusy"),
  NAMESPACE_EXISTS(48, "NamespaceExists"),
  COMMAND_NOT_FOUND(59, "CommandNotFound"),
  INDEX_OPTIONS_CONFLICT(85, "IndexOptionsConflict"),
  INDEX_KEY_SPECS_CONFLICT(86, "IndexKeySpecsConflict"),
  NETWORK_TIMEOUT(89, "NetworkTimeout"),
  WRITE_CONFLICT(112, "WriteConflict"),
  COMMAND_NOT_SUPPORTED(115, "CommandNotSupported"),
  NO_SUCH_TRANSACTION(251, "NoSuchTransaction"),
  OPERATION_NOT_SUPPORTED_IN_TRANSACTION(263, "OperationNotSupportedInTransaction"),
  DUPLICATE_KEY(11000, "DuplicateKey"),
  ;

  private final int code;
  private final String codeName;

  MongoErrorCode(int code, String codeName) {
    this.code = code;
    this.codeName = codeName;
  }

  public static MongoErrorCode fromException(MongoException error) {
    return Arrays.stream(MongoErrorCode.values())
        .filter(t -> t.code == error.getCode())
        .findFirst()
        .orElse(MongoErrorCode.UNKNOWN_ERROR);
  }

  public boolean matches(MongoException error) {
    return error.getCode() == code;
  }

  public int getCode() {
    return code;
  }

  public String getCodeName() {
    return codeName;
  }
}
