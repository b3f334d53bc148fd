package io.crisisintel.coordination.exception;

/**
 * Thrown when a lifecycle transition is not legal from the record's current state. The code
 * distinguishes a wrong pre-state ({@code invalid_status}), a terminal record ({@code immutable})
 * and the time or availability guards.
 */
public class InvalidStateException extends CoordinationException {

  public InvalidStateException(String title, String detail) {
    this(ErrorCode.INVALID_STATUS, title, detail);
  }

  public InvalidStateException(ErrorCode errorCode, String title, String detail) {
    super(errorCode, title, detail);
  }

  public static InvalidStateException immutable(String entityType, Object status) {
    return new InvalidStateException(
        ErrorCode.IMMUTABLE,
        entityType + " is no longer mutable",
        entityType + " in terminal status " + status + " cannot change");
  }
}
