package io.crisisintel.coordination.common;

import io.crisisintel.coordination.exception.InvalidRequestException;
import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/** Parses lower- or upper-case query and body values into status enums. */
public final class EnumParams {

  private EnumParams() {}

  /** Returns null for a null or blank value; an unknown value fails with {@code validation}. */
  public static <E extends Enum<E>> E parse(Class<E> type, String field, String value) {
    if (value == null || value.isBlank()) {
      return null;
    }
    try {
      return Enum.valueOf(type, value.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      var allowed =
          Arrays.stream(type.getEnumConstants())
              .map(c -> c.name().toLowerCase(Locale.ROOT))
              .collect(Collectors.joining(", "));
      throw new InvalidRequestException(
          "Invalid " + field, field + " must be one of " + allowed + "; got: " + value);
    }
  }
}
