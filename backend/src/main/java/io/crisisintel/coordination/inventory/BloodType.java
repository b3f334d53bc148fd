package io.crisisintel.coordination.inventory;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/** Resource types tracked by the blood ledger, keyed by their conventional label. */
public enum BloodType {
  A_POS("A+"),
  A_NEG("A-"),
  B_POS("B+"),
  B_NEG("B-"),
  AB_POS("AB+"),
  AB_NEG("AB-"),
  O_POS("O+"),
  O_NEG("O-");

  private final String label;

  BloodType(String label) {
    this.label = label;
  }

  public String label() {
    return label;
  }

  public static Optional<BloodType> fromLabel(String value) {
    if (value == null) {
      return Optional.empty();
    }
    String trimmed = value.trim().toUpperCase(Locale.ROOT);
    return Arrays.stream(values()).filter(t -> t.label.equals(trimmed)).findFirst();
  }
}
