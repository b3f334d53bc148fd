package io.crisisintel.coordination.security;

import java.util.Arrays;
import java.util.Optional;

/**
 * Closed set of actor roles. Resolved once from the {@code role} claim when the caller is
 * authenticated and never re-derived from strings afterwards.
 */
public enum ActorRole {
  REGULAR("regular", false),
  HOSPITAL("hospital", true),
  BLOOD_BANK("blood_bank", true),
  FIRE_SERVICE("fire_service", true),
  SOCIAL_ORG("social_org", true),
  ADMIN("admin", false);

  private final String claimValue;
  private final boolean organization;

  ActorRole(String claimValue, boolean organization) {
    this.claimValue = claimValue;
    this.organization = organization;
  }

  public String claimValue() {
    return claimValue;
  }

  /** Organization roles need an active participation record to act inside a crisis. */
  public boolean isOrganization() {
    return organization;
  }

  /** Spring Security authority for this role. */
  public String authority() {
    return "ROLE_" + name();
  }

  public static Optional<ActorRole> fromClaim(String value) {
    if (value == null) {
      return Optional.empty();
    }
    return Arrays.stream(values()).filter(r -> r.claimValue.equals(value)).findFirst();
  }
}
