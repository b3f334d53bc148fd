package io.crisisintel.coordination.exception;

public class ResourceConflictException extends CoordinationException {

  public ResourceConflictException(String title, String detail) {
    super(ErrorCode.CONFLICT, title, detail);
  }
}
