package io.crisisintel.coordination.deployment;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

public enum UnitType {
  FIRE_TEAM,
  VOLUNTEER_GROUP;

  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }

  public static Optional<UnitType> fromValue(String value) {
    if (value == null) {
      return Optional.empty();
    }
    return Arrays.stream(values())
        .filter(t -> t.value().equalsIgnoreCase(value.trim()))
        .findFirst();
  }
}
