package io.crisisintel.coordination.exception;

import java.util.Locale;

public class ResourceNotFoundException extends CoordinationException {

  public ResourceNotFoundException(String resourceType, Object id) {
    super(
        ErrorCode.NOT_FOUND,
        resourceType + " not found",
        "No " + resourceType.toLowerCase(Locale.ROOT) + " found with id " + id);
  }

  private ResourceNotFoundException(String title, String detail, boolean custom) {
    super(ErrorCode.NOT_FOUND, title, detail);
  }

  public static ResourceNotFoundException withDetail(String title, String detail) {
    return new ResourceNotFoundException(title, detail, true);
  }
}
