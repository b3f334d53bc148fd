package io.crisisintel.coordination.exception;

import org.springframework.http.HttpStatus;

/**
 * Stable error codes surfaced to callers in the {@code code} property of every problem response.
 * Callers switch on these values, so they must never be renamed.
 */
public enum ErrorCode {
  VALIDATION("validation", HttpStatus.BAD_REQUEST),
  FORBIDDEN("forbidden", HttpStatus.FORBIDDEN),
  NOT_FOUND("not_found", HttpStatus.NOT_FOUND),
  CONFLICT("conflict", HttpStatus.CONFLICT),
  INVALID_STATUS("invalid_status", HttpStatus.CONFLICT),
  IMMUTABLE("immutable", HttpStatus.CONFLICT),
  TOO_LATE_TO_CANCEL("too_late_to_cancel", HttpStatus.UNPROCESSABLE_ENTITY),
  INSUFFICIENT_INVENTORY("insufficient_inventory", HttpStatus.UNPROCESSABLE_ENTITY),
  COOLDOWN_ACTIVE("cooldown_active", HttpStatus.UNPROCESSABLE_ENTITY);

  private final String value;
  private final HttpStatus httpStatus;

  ErrorCode(String value, HttpStatus httpStatus) {
    this.value = value;
    this.httpStatus = httpStatus;
  }

  public String value() {
    return value;
  }

  public HttpStatus httpStatus() {
    return httpStatus;
  }
}
