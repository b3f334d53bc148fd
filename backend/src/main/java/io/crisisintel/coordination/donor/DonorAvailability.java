package io.crisisintel.coordination.donor;

public enum DonorAvailability {
  AVAILABLE,
  UNAVAILABLE,
  COOLDOWN
}
