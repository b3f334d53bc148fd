package io.crisisintel.coordination.exception;

import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * Base class for every error the coordination core raises. Carries an {@link ErrorCode} that is
 * copied into the problem body so clients can branch on it.
 */
public abstract class CoordinationException extends ErrorResponseException {

  private final ErrorCode errorCode;

  protected CoordinationException(ErrorCode errorCode, String title, String detail) {
    super(errorCode.httpStatus(), createProblem(errorCode, title, detail), null);
    this.errorCode = errorCode;
  }

  public ErrorCode getErrorCode() {
    return errorCode;
  }

  @Override
  public String getMessage() {
    return getBody().getTitle() + ": " + getBody().getDetail();
  }

  private static ProblemDetail createProblem(ErrorCode errorCode, String title, String detail) {
    var problem = ProblemDetail.forStatus(errorCode.httpStatus());
    problem.setTitle(title);
    problem.setDetail(detail);
    problem.setProperty("code", errorCode.value());
    return problem;
  }
}
