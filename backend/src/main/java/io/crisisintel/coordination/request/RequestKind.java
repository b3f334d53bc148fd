package io.crisisintel.coordination.request;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/** The four request kinds sharing one lifecycle. */
public enum RequestKind {
  /** Hospital asks a blood bank for units of one blood type. */
  INVENTORY(true),
  /** Donation meeting with a donor; completion starts the donor's cooldown. */
  MEETING(true),
  /** Appointment for a hospital service. */
  BOOKING(true),
  /** Emergency call-out of a fire service. */
  DISPATCH(false);

  private final boolean timeBound;

  RequestKind(boolean timeBound) {
    this.timeBound = timeBound;
  }

  /** Time-bound kinds require a target date-time on creation. */
  public boolean isTimeBound() {
    return timeBound;
  }

  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }

  public static Optional<RequestKind> fromValue(String value) {
    if (value == null) {
      return Optional.empty();
    }
    return Arrays.stream(values())
        .filter(k -> k.value().equalsIgnoreCase(value.trim()))
        .findFirst();
  }
}
