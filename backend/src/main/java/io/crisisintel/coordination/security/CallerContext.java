package io.crisisintel.coordination.security;

import java.util.Objects;
import java.util.UUID;

/**
 * Identity of the caller, resolved once per request by the identity provider and passed explicitly
 * into every service operation.
 *
 * @param userId the authenticated user
 * @param role the user's actor role
 * @param admin true for platform administrators, who administer every crisis
 */
public record CallerContext(UUID userId, ActorRole role, boolean admin) {

  public CallerContext {
    Objects.requireNonNull(userId, "userId must not be null");
    Objects.requireNonNull(role, "role must not be null");
    admin = admin || role == ActorRole.ADMIN;
  }

  public static CallerContext of(UUID userId, ActorRole role) {
    return new CallerContext(userId, role, false);
  }

  public boolean isOrganization() {
    return role.isOrganization();
  }

  public boolean is(UUID otherUserId) {
    return userId.equals(otherUserId);
  }
}
