package io.crisisintel.coordination.exception;

public class ForbiddenException extends CoordinationException {

  public ForbiddenException(String title, String detail) {
    super(ErrorCode.FORBIDDEN, title, detail);
  }
}
