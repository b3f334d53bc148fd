package io.crisisintel.coordination.exception;

/** Thrown when required input is missing or malformed. Maps to the {@code validation} code. */
public class InvalidRequestException extends CoordinationException {

  public InvalidRequestException(String title, String detail) {
    super(ErrorCode.VALIDATION, title, detail);
  }
}
